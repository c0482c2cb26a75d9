package campaign.schedule;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{name}}} placeholders in step config values with enrollment
 * variables. Unknown placeholders render as the empty string.
 */
public final class TemplateRenderer {
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.-]+)\\s*}}");

  public Map<String, String> render(Map<String, String> config, Map<String, String> variables) {
    Map<String, String> rendered = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : config.entrySet()) {
      rendered.put(entry.getKey(), render(entry.getValue(), variables));
    }
    return rendered;
  }

  public String render(String text, Map<String, String> variables) {
    if (text == null || text.indexOf("{{") < 0) {
      return text;
    }
    Matcher matcher = PLACEHOLDER.matcher(text);
    StringBuilder out = new StringBuilder();
    while (matcher.find()) {
      String value = variables.getOrDefault(matcher.group(1), "");
      matcher.appendReplacement(out, Matcher.quoteReplacement(value));
    }
    matcher.appendTail(out);
    return out.toString();
  }
}

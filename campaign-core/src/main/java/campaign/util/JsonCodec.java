package campaign.util;

import java.util.Map;

/**
 * Codec for the flat string maps stored in JSON columns (step config, rendered
 * content, enrollment variables and addresses, event data).
 *
 * <p>The default implementation is {@link JacksonJsonCodec}.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  static JsonCodec getDefault() {
    return JacksonJsonCodec.INSTANCE;
  }

  /**
   * Encodes a string map as a JSON object. Returns {@code null} for a null or empty map.
   *
   * @param values the map to encode
   * @return JSON text, or {@code null}
   */
  String toJson(Map<String, String> values);

  /**
   * Parses a JSON object into a string map. Returns an empty map for {@code null},
   * blank or {@code "null"} input. Non-string scalar values are converted to text.
   *
   * @param json JSON text
   * @return parsed map, never {@code null}
   * @throws IllegalArgumentException if the input is not a JSON object
   */
  Map<String, String> parseObject(String json);
}

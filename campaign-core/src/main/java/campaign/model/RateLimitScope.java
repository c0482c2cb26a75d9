package campaign.model;

import java.util.Locale;

public enum RateLimitScope {
  TENANT,
  IDENTITY;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static RateLimitScope fromValue(String value) {
    return RateLimitScope.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}

package campaign.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Throttle policy: at most {@code maxSends} sends on {@code channel} in any sliding
 * {@code window}.
 *
 * @param identityId sender identity for {@link RateLimitScope#IDENTITY}, {@code null} for tenant scope
 */
public record SendRateLimit(
    String id,
    String tenantId,
    Channel channel,
    RateLimitScope scope,
    String identityId,
    Duration window,
    int maxSends) {

  public SendRateLimit {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(window, "window");
    if (window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("window must be positive");
    }
    if (maxSends < 0) {
      throw new IllegalArgumentException("maxSends must be >= 0");
    }
    if (scope == RateLimitScope.IDENTITY && identityId == null) {
      throw new IllegalArgumentException("identity-scoped policy requires identityId");
    }
    if (scope == RateLimitScope.TENANT && identityId != null) {
      throw new IllegalArgumentException("tenant-scoped policy must not carry identityId");
    }
  }
}

package campaign.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Tenant-level deny-list entry for {@code (channel, address)}.
 *
 * @param expiresAt end of the suppression, {@code null} for permanent
 */
public record CommunicationSuppression(
    String tenantId,
    Channel channel,
    String address,
    String reason,
    Instant suppressedAt,
    Instant expiresAt) {

  public CommunicationSuppression {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(address, "address");
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(suppressedAt, "suppressedAt");
  }

  public boolean isActiveAt(Instant now) {
    return expiresAt == null || expiresAt.isAfter(now);
  }
}

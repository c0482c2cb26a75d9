package campaign.model;

import java.time.Instant;
import java.util.Objects;

public record ContactUnsubscribe(
    String tenantId,
    Channel channel,
    String address,
    String source,
    Instant unsubscribedAt) {

  public ContactUnsubscribe {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(address, "address");
    Objects.requireNonNull(unsubscribedAt, "unsubscribedAt");
  }
}

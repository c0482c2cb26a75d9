package campaign.dispatch;

import campaign.model.CampaignStepInstance;
import campaign.model.ContactCampaignInstance;
import campaign.model.OutboundMessage;
import campaign.model.OutboundMessageState;
import campaign.spi.CampaignStoreException;
import campaign.spi.ConnectionProvider;
import campaign.spi.OutboundMessageStore;
import campaign.util.Ids;
import campaign.util.Transactions;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Guarantees at most one {@link OutboundMessage} per logical send.
 *
 * <p>A logical send is a step instance at a given epoch. The unique dedupe key makes
 * concurrent reservations of the same send converge on one row.
 */
public final class DedupeGuard {
  private final ConnectionProvider connectionProvider;
  private final OutboundMessageStore store;
  private final Clock clock;

  public DedupeGuard(ConnectionProvider connectionProvider, OutboundMessageStore store, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public static String dedupeKey(CampaignStepInstance step) {
    return step.tenantId() + ":" + step.id() + ":" + step.epoch();
  }

  public Optional<OutboundMessage> find(String tenantId, String dedupeKey) {
    return Transactions.inTransaction(connectionProvider, conn -> store.findByDedupeKey(conn, tenantId, dedupeKey));
  }

  /**
   * Inserts a {@code queued} message for the step unless one with the same dedupe key
   * already exists, in which case the existing row is returned.
   */
  public Reservation reserve(CampaignStepInstance step, ContactCampaignInstance instance, String address) {
    String key = dedupeKey(step);
    Instant now = clock.instant();
    OutboundMessage candidate = new OutboundMessage(Ids.newId(), step.tenantId(), step.campaignId(),
        step.contactId(), step.id(), step.channel(), address, instance.senderIdentityId(), key,
        step.renderedConfig(), OutboundMessageState.QUEUED, null, 0, null, now, now);
    return Transactions.inTransaction(connectionProvider, conn -> {
      if (store.insertIfAbsent(conn, candidate)) {
        return new Reservation(candidate, true);
      }
      OutboundMessage existing = store.findByDedupeKey(conn, step.tenantId(), key)
          .orElseThrow(() -> new CampaignStoreException("Dedupe key conflict without a row: " + key));
      return new Reservation(existing, false);
    });
  }

  /**
   * @param created {@code false} if an earlier attempt had already reserved the key
   */
  public record Reservation(OutboundMessage message, boolean created) {
  }
}

package campaign.spi;

import campaign.model.OutboundMessage;
import campaign.model.OutboundMessageState;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface OutboundMessageStore {

  /**
   * Inserts the message unless a row with the same {@code (tenantId, dedupeKey)} exists.
   * Relies on the store's unique constraint, never on a prior read.
   *
   * @return {@code true} if this call created the row
   */
  boolean insertIfAbsent(Connection conn, OutboundMessage message);

  Optional<OutboundMessage> find(Connection conn, String tenantId, String messageId);

  Optional<OutboundMessage> findByDedupeKey(Connection conn, String tenantId, String dedupeKey);

  /**
   * Finds by provider message id. {@code tenantId} may be {@code null} when the webhook
   * did not carry one.
   */
  Optional<OutboundMessage> findByProviderMessageId(Connection conn, String tenantId, String providerMessageId);

  /**
   * Unscoped lookup for webhook correlation when the payload carried no tenant.
   */
  Optional<OutboundMessage> findById(Connection conn, String messageId);

  List<OutboundMessage> listByStep(Connection conn, String tenantId, String stepInstanceId);

  /**
   * Records provider acceptance. Moves the state to {@code SENT} only from {@code QUEUED};
   * a state already set by a provider event is kept.
   */
  int markSent(Connection conn, String tenantId, String messageId, String providerMessageId, Instant now);

  /** Records a failed provider attempt without leaving {@code QUEUED}. */
  int recordAttemptFailure(Connection conn, String tenantId, String messageId, String error, Instant now);

  int updateState(Connection conn, String tenantId, String messageId, OutboundMessageState state,
      String error, Instant now);
}

package campaign.spi;

import campaign.model.Channel;
import campaign.model.CommunicationSuppression;
import campaign.model.ContactUnsubscribe;
import campaign.model.EmailValidationResult;

import java.sql.Connection;
import java.util.Optional;

/**
 * Deny-lists consulted before every send. Writes are upserts on the natural keys.
 */
public interface SuppressionStore {

  void upsertSuppression(Connection conn, CommunicationSuppression suppression);

  Optional<CommunicationSuppression> findSuppression(Connection conn, String tenantId, Channel channel,
      String address);

  int removeSuppression(Connection conn, String tenantId, Channel channel, String address);

  void upsertUnsubscribe(Connection conn, ContactUnsubscribe unsubscribe);

  Optional<ContactUnsubscribe> findUnsubscribe(Connection conn, String tenantId, Channel channel, String address);

  int removeUnsubscribe(Connection conn, String tenantId, Channel channel, String address);

  void upsertValidation(Connection conn, EmailValidationResult result);

  Optional<EmailValidationResult> findValidation(Connection conn, String tenantId, String email);
}

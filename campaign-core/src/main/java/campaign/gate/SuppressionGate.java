package campaign.gate;

import campaign.model.Channel;
import campaign.model.CommunicationSuppression;
import campaign.model.ContactUnsubscribe;
import campaign.model.EmailValidationResult;
import campaign.spi.ConnectionProvider;
import campaign.spi.SuppressionStore;
import campaign.util.Transactions;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Answers whether a destination may be contacted, and maintains the deny-lists behind
 * that answer.
 *
 * <p>Lookups always hit the store; nothing is cached.
 */
public final class SuppressionGate {
  private final ConnectionProvider connectionProvider;
  private final SuppressionStore store;
  private final Clock clock;

  public SuppressionGate(ConnectionProvider connectionProvider, SuppressionStore store, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public boolean isBlocked(String tenantId, Channel channel, String address) {
    return check(tenantId, channel, address).isPresent();
  }

  public Optional<BlockReason> check(String tenantId, Channel channel, String address) {
    return Transactions.inTransaction(connectionProvider, conn -> check(conn, tenantId, channel, address));
  }

  public Optional<BlockReason> check(Connection conn, String tenantId, Channel channel, String address) {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(channel, "channel");
    String key = Addresses.normalize(channel, address);
    if (key == null || key.isEmpty()) {
      return Optional.of(BlockReason.INVALID_ADDRESS);
    }
    Instant now = clock.instant();
    Optional<CommunicationSuppression> suppression = store.findSuppression(conn, tenantId, channel, key);
    if (suppression.isPresent() && suppression.get().isActiveAt(now)) {
      return Optional.of(BlockReason.SUPPRESSED);
    }
    if (store.findUnsubscribe(conn, tenantId, channel, key).isPresent()) {
      return Optional.of(BlockReason.UNSUBSCRIBED);
    }
    if (channel == Channel.EMAIL) {
      Optional<EmailValidationResult> validation = store.findValidation(conn, tenantId, key);
      if (validation.isPresent() && !validation.get().valid()) {
        return Optional.of(BlockReason.INVALID_ADDRESS);
      }
    }
    return Optional.empty();
  }

  /**
   * @param expiresAt end of the suppression, or {@code null} for a permanent one
   */
  public CommunicationSuppression suppress(String tenantId, Channel channel, String address, String reason,
      Instant expiresAt) {
    return Transactions.inTransaction(connectionProvider, conn ->
        suppress(conn, tenantId, channel, address, reason, expiresAt));
  }

  public CommunicationSuppression suppress(Connection conn, String tenantId, Channel channel, String address,
      String reason, Instant expiresAt) {
    CommunicationSuppression suppression = new CommunicationSuppression(tenantId, channel,
        Addresses.normalize(channel, address), reason, clock.instant(), expiresAt);
    store.upsertSuppression(conn, suppression);
    return suppression;
  }

  public boolean lift(String tenantId, Channel channel, String address) {
    return Transactions.inTransaction(connectionProvider, conn ->
        store.removeSuppression(conn, tenantId, channel, Addresses.normalize(channel, address)) > 0);
  }

  public ContactUnsubscribe unsubscribe(String tenantId, Channel channel, String address, String source) {
    return Transactions.inTransaction(connectionProvider, conn ->
        unsubscribe(conn, tenantId, channel, address, source));
  }

  public ContactUnsubscribe unsubscribe(Connection conn, String tenantId, Channel channel, String address,
      String source) {
    ContactUnsubscribe unsubscribe = new ContactUnsubscribe(tenantId, channel,
        Addresses.normalize(channel, address), source, clock.instant());
    store.upsertUnsubscribe(conn, unsubscribe);
    return unsubscribe;
  }

  public boolean resubscribe(String tenantId, Channel channel, String address) {
    return Transactions.inTransaction(connectionProvider, conn ->
        store.removeUnsubscribe(conn, tenantId, channel, Addresses.normalize(channel, address)) > 0);
  }

  public EmailValidationResult recordValidation(String tenantId, String email, boolean valid, String reason) {
    EmailValidationResult result = new EmailValidationResult(tenantId, Addresses.normalize(Channel.EMAIL, email),
        valid, reason, clock.instant());
    Transactions.run(connectionProvider, conn -> store.upsertValidation(conn, result));
    return result;
  }
}

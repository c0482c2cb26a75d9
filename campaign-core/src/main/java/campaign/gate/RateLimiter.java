package campaign.gate;

import campaign.model.Channel;
import campaign.model.RateLimitScope;
import campaign.model.SendRateLimit;
import campaign.spi.ConnectionProvider;
import campaign.spi.RateLimitStore;
import campaign.util.Ids;
import campaign.util.Transactions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sliding-window send budgets per tenant and channel, optionally narrowed to a sender
 * identity.
 *
 * <p>Every acquisition locks the matching policy rows ({@code SELECT ... FOR UPDATE},
 * tenant scope first), counts the permit ledger inside the window and records a permit
 * only when every policy has room, all in one transaction. Concurrent callers therefore
 * serialize per policy and can never jointly overrun a budget. A tenant and channel with
 * no policy is unlimited.
 */
public final class RateLimiter {
  private static final Logger logger = Logger.getLogger(RateLimiter.class.getName());

  private final ConnectionProvider connectionProvider;
  private final RateLimitStore store;
  private final Clock clock;

  public RateLimiter(ConnectionProvider connectionProvider, RateLimitStore store, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Takes one permit from every policy that applies.
   *
   * @param identity sender identity, or {@code null} to check the tenant budget only
   * @return {@code false} if any applicable budget is exhausted; nothing is consumed then
   */
  public boolean tryAcquire(String tenantId, Channel channel, String identity) {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(channel, "channel");
    Instant now = clock.instant();
    return Transactions.inTransaction(connectionProvider, conn -> {
      List<SendRateLimit> policies = store.lockPolicies(conn, tenantId, channel, identity);
      if (policies.isEmpty()) {
        return true;
      }
      for (SendRateLimit policy : policies) {
        Instant since = now.minus(policy.window());
        store.purgeBefore(conn, policy.id(), since);
        int used = store.countSince(conn, policy.id(), since);
        if (used >= policy.maxSends()) {
          logger.log(Level.FINE, "Rate limit {0} exhausted for tenant {1} on {2}",
              new Object[]{policy.id(), tenantId, channel.value()});
          return false;
        }
      }
      for (SendRateLimit policy : policies) {
        store.recordPermit(conn, policy.id(), now);
      }
      return true;
    });
  }

  /**
   * Creates the policy for the given scope, or updates the window and budget of an
   * existing one. Permits already recorded keep counting.
   */
  public void definePolicy(String tenantId, Channel channel, String identityId, Duration window,
      int maxSends) {
    RateLimitScope scope = identityId == null ? RateLimitScope.TENANT : RateLimitScope.IDENTITY;
    SendRateLimit policy = new SendRateLimit(Ids.newId(), tenantId, channel, scope, identityId, window, maxSends);
    Transactions.run(connectionProvider, conn -> store.upsertPolicy(conn, policy));
  }
}

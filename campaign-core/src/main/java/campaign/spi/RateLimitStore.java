package campaign.spi;

import campaign.model.Channel;
import campaign.model.SendRateLimit;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * Rate limit policies plus the per-policy ledger of acquired permits.
 */
public interface RateLimitStore {

  void upsertPolicy(Connection conn, SendRateLimit policy);

  /**
   * Reads and row-locks the policies that apply to a send: the tenant-scoped policy for
   * the channel first, then the identity-scoped one if {@code identityId} is non-null.
   */
  List<SendRateLimit> lockPolicies(Connection conn, String tenantId, Channel channel, String identityId);

  int countSince(Connection conn, String policyId, Instant since);

  void recordPermit(Connection conn, String policyId, Instant at);

  int purgeBefore(Connection conn, String policyId, Instant before);
}

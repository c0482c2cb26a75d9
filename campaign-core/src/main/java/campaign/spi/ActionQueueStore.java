package campaign.spi;

import campaign.model.ScheduledAction;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for {@link ScheduledAction} rows.
 *
 * <p>Updates that finish or release a claimed action are fenced on the claim token and
 * return the number of rows changed; {@code 0} means the caller no longer owns the row.
 */
public interface ActionQueueStore {

  void insert(Connection conn, ScheduledAction action);

  Optional<ScheduledAction> find(Connection conn, String tenantId, String actionId);

  List<ScheduledAction> listByStep(Connection conn, String tenantId, String stepInstanceId);

  /**
   * Atomically moves up to {@code limit} pending actions with {@code scheduled_at <= now}
   * to {@code CLAIMED} and returns them. Must run inside a transaction. Two concurrent
   * callers never receive the same row.
   *
   * @param tenantId       restrict to one tenant, or {@code null} for all tenants
   * @param ownerId        identifier of the claiming worker process
   * @param claimToken     unique token for this call
   * @param leaseExpiresAt when an unfinished claim becomes reclaimable
   */
  List<ScheduledAction> claimDue(Connection conn, String tenantId, String ownerId, String claimToken,
      Instant now, Instant leaseExpiresAt, int limit);

  int markExecuting(Connection conn, String actionId, String claimToken, Instant now);

  int markDone(Connection conn, String actionId, String claimToken, Instant now);

  int markFailed(Connection conn, String actionId, String claimToken, String error, Instant now);

  int cancelClaimed(Connection conn, String actionId, String claimToken, String reason, Instant now);

  /**
   * Returns a claimed or executing action to {@code PENDING} at {@code nextAt}.
   *
   * @param countAttempt whether this release counts against the retry budget
   */
  int release(Connection conn, String actionId, String claimToken, Instant nextAt, String error,
      boolean countAttempt, Instant now);

  int cancelPendingByCampaign(Connection conn, String tenantId, String campaignId, String reason, Instant now);

  int cancelPendingByInstance(Connection conn, String tenantId, String instanceId, String reason, Instant now);

  int cancelPendingByStep(Connection conn, String tenantId, String stepInstanceId, String reason, Instant now);

  boolean hasInFlight(Connection conn, String tenantId, String stepInstanceId);

  /**
   * Returns every claimed or executing action whose lease expired before {@code now} to
   * {@code PENDING}, counting the lost attempt.
   *
   * @return number of reclaimed actions
   */
  int reclaimExpired(Connection conn, Instant now);

  /**
   * @return scheduled time of the oldest due pending action, if any
   */
  Optional<Instant> oldestDue(Connection conn, Instant now);
}

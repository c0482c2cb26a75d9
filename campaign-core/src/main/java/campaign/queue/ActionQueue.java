package campaign.queue;

import campaign.CampaignValidationException;
import campaign.model.CampaignStepInstance;
import campaign.model.ScheduledAction;
import campaign.model.StepInstanceStatus;
import campaign.spi.ActionQueueStore;
import campaign.spi.ConnectionProvider;
import campaign.spi.StepInstanceStore;
import campaign.util.Ids;
import campaign.util.Transactions;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable job queue of {@link ScheduledAction}s.
 *
 * <p>All mutual exclusion between workers comes from the store: {@link #claimDue} is a
 * single conditional update, and every later update of a claimed action is fenced on the
 * claim token handed out with it. A worker that crashes leaves its action claimed until
 * {@code leaseDuration} passes; {@link #reclaimExpired} then returns it to pending.
 *
 * <p>Methods taking a {@link Connection} join the caller's transaction; the others run in
 * a transaction of their own.
 */
public final class ActionQueue {
  private static final Logger logger = Logger.getLogger(ActionQueue.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ActionQueueStore actions;
  private final StepInstanceStore steps;
  private final Clock clock;
  private final Duration leaseDuration;
  private final String ownerId;

  public ActionQueue(ConnectionProvider connectionProvider, ActionQueueStore actions, StepInstanceStore steps,
      Clock clock, Duration leaseDuration, String ownerId) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.actions = Objects.requireNonNull(actions, "actions");
    this.steps = Objects.requireNonNull(steps, "steps");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.leaseDuration = Objects.requireNonNull(leaseDuration, "leaseDuration");
    if (leaseDuration.isNegative() || leaseDuration.isZero()) {
      throw new IllegalArgumentException("leaseDuration must be positive");
    }
    this.ownerId = ownerId != null ? ownerId : "worker-" + UUID.randomUUID().toString().substring(0, 8);
  }

  public String ownerId() {
    return ownerId;
  }

  public Duration leaseDuration() {
    return leaseDuration;
  }

  /**
   * Enqueues execution of a pending step instance.
   *
   * <p>If the step already owns an in-flight action, that action is returned instead of
   * creating a second one.
   *
   * @throws CampaignValidationException if the step does not exist or is not pending
   */
  public ScheduledAction enqueue(String tenantId, String stepInstanceId, Instant scheduledAt) {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(stepInstanceId, "stepInstanceId");
    Objects.requireNonNull(scheduledAt, "scheduledAt");
    return Transactions.inTransaction(connectionProvider, conn -> {
      CampaignStepInstance step = steps.lock(conn, tenantId, stepInstanceId)
          .orElseThrow(() -> new CampaignValidationException("Unknown step instance: " + stepInstanceId));
      return enqueue(conn, step, scheduledAt);
    });
  }

  public ScheduledAction enqueue(Connection conn, CampaignStepInstance step, Instant scheduledAt) {
    if (step.status() != StepInstanceStatus.PENDING) {
      throw new CampaignValidationException("Step instance " + step.id() + " is " + step.status()
          + ", only pending steps can be enqueued");
    }
    Optional<ScheduledAction> inFlight = actions.listByStep(conn, step.tenantId(), step.id()).stream()
        .filter(a -> a.status().isInFlight())
        .findFirst();
    if (inFlight.isPresent()) {
      return inFlight.get();
    }
    ScheduledAction action = ScheduledAction.pending(Ids.newId(), step, scheduledAt, clock.instant());
    actions.insert(conn, action);
    return action;
  }

  /**
   * Claims up to {@code maxBatch} due actions for this worker process.
   *
   * @param tenantId restrict to one tenant, or {@code null} for all tenants
   * @return claimed actions ordered by scheduled time; never shared with another caller
   */
  public List<ScheduledAction> claimDue(String tenantId, Instant now, int maxBatch) {
    if (maxBatch <= 0) {
      throw new IllegalArgumentException("maxBatch must be > 0");
    }
    String claimToken = Ids.newId();
    Instant leaseExpiresAt = now.plus(leaseDuration);
    return Transactions.inTransaction(connectionProvider, conn ->
        actions.claimDue(conn, tenantId, ownerId, claimToken, now, leaseExpiresAt, maxBatch));
  }

  public List<ScheduledAction> claimDue(String tenantId, int maxBatch) {
    return claimDue(tenantId, clock.instant(), maxBatch);
  }

  /**
   * @return {@code false} if the claim was lost (lease reclaimed by another worker)
   */
  public boolean markExecuting(ScheduledAction action) {
    return update(conn -> actions.markExecuting(conn, action.id(), action.claimToken(), clock.instant())) > 0;
  }

  public boolean markDone(ScheduledAction action) {
    return update(conn -> markDone(conn, action)) > 0;
  }

  public int markDone(Connection conn, ScheduledAction action) {
    return actions.markDone(conn, action.id(), action.claimToken(), clock.instant());
  }

  public boolean markFailed(ScheduledAction action, String reason) {
    return update(conn -> markFailed(conn, action, reason)) > 0;
  }

  public int markFailed(Connection conn, ScheduledAction action, String reason) {
    return actions.markFailed(conn, action.id(), action.claimToken(), reason, clock.instant());
  }

  /**
   * Returns the caller's claimed action to pending at {@code nextAt}.
   *
   * @param countAttempt {@code false} for deferrals that must not consume the retry budget
   */
  public boolean release(ScheduledAction action, Instant nextAt, String reason, boolean countAttempt) {
    return update(conn -> release(conn, action, nextAt, reason, countAttempt)) > 0;
  }

  public int release(Connection conn, ScheduledAction action, Instant nextAt, String reason, boolean countAttempt) {
    return actions.release(conn, action.id(), action.claimToken(), nextAt, reason, countAttempt, clock.instant());
  }

  /**
   * Cancels the caller's own claimed or executing action.
   */
  public boolean cancel(ScheduledAction action, String reason) {
    return update(conn -> cancel(conn, action, reason)) > 0;
  }

  public int cancel(Connection conn, ScheduledAction action, String reason) {
    return actions.cancelClaimed(conn, action.id(), action.claimToken(), reason, clock.instant());
  }

  /**
   * Soft-cancels every pending action of a campaign. Claimed and executing actions are
   * left to finish.
   *
   * @return number of canceled actions
   */
  public int cancelByCampaign(String tenantId, String campaignId) {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(campaignId, "campaignId");
    return update(conn -> cancelByCampaign(conn, tenantId, campaignId, "campaign canceled"));
  }

  public int cancelByCampaign(Connection conn, String tenantId, String campaignId, String reason) {
    return actions.cancelPendingByCampaign(conn, tenantId, campaignId, reason, clock.instant());
  }

  public int cancelByInstance(String tenantId, String instanceId) {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(instanceId, "instanceId");
    return update(conn -> cancelByInstance(conn, tenantId, instanceId, "instance canceled"));
  }

  public int cancelByInstance(Connection conn, String tenantId, String instanceId, String reason) {
    return actions.cancelPendingByInstance(conn, tenantId, instanceId, reason, clock.instant());
  }

  public int cancelByStep(Connection conn, String tenantId, String stepInstanceId, String reason) {
    return actions.cancelPendingByStep(conn, tenantId, stepInstanceId, reason, clock.instant());
  }

  public boolean hasInFlight(String tenantId, String stepInstanceId) {
    return Transactions.inTransaction(connectionProvider, conn -> hasInFlight(conn, tenantId, stepInstanceId));
  }

  public boolean hasInFlight(Connection conn, String tenantId, String stepInstanceId) {
    return actions.hasInFlight(conn, tenantId, stepInstanceId);
  }

  public List<ScheduledAction> actionsForStep(String tenantId, String stepInstanceId) {
    return Transactions.inTransaction(connectionProvider, conn -> actions.listByStep(conn, tenantId, stepInstanceId));
  }

  /**
   * Returns actions whose lease expired before {@code now} to pending.
   *
   * @return number of reclaimed actions
   */
  public int reclaimExpired(Instant now) {
    int reclaimed = update(conn -> actions.reclaimExpired(conn, now));
    if (reclaimed > 0) {
      logger.log(Level.WARNING, "Reclaimed " + reclaimed + " action(s) with expired leases");
    }
    return reclaimed;
  }

  public Optional<Instant> oldestDue(Instant now) {
    return Transactions.inTransaction(connectionProvider, conn -> actions.oldestDue(conn, now));
  }

  private int update(Transactions.Work<Integer> work) {
    return Transactions.inTransaction(connectionProvider, work);
  }
}

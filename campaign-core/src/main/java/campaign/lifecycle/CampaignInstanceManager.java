package campaign.lifecycle;

import campaign.CampaignValidationException;
import campaign.model.CampaignInstanceStatus;
import campaign.model.CampaignStepInstance;
import campaign.model.CampaignTransition;
import campaign.model.ContactCampaignInstance;
import campaign.model.IllegalTransitionException;
import campaign.model.StepInstanceStatus;
import campaign.queue.ActionQueue;
import campaign.schedule.StepScheduler;
import campaign.spi.CampaignStoreException;
import campaign.spi.CampaignStores;
import campaign.spi.ConnectionProvider;
import campaign.util.Transactions;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Moves contact campaign instances between {@code active}, {@code paused} and
 * {@code completed}.
 *
 * <p>Every move locks the instance row, validates the move against
 * {@link CampaignInstanceStatus} and writes a transition in the same transaction.
 * Illegal moves throw {@link IllegalTransitionException}.
 */
public final class CampaignInstanceManager {
  private static final Logger logger = Logger.getLogger(CampaignInstanceManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final CampaignStores stores;
  private final ActionQueue queue;
  private final StepScheduler scheduler;
  private final Clock clock;

  public CampaignInstanceManager(ConnectionProvider connectionProvider, CampaignStores stores, ActionQueue queue,
      StepScheduler scheduler, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.stores = Objects.requireNonNull(stores, "stores");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public Optional<ContactCampaignInstance> find(String tenantId, String instanceId) {
    return Transactions.inTransaction(connectionProvider, conn -> stores.instances().find(conn, tenantId, instanceId));
  }

  public Optional<ContactCampaignInstance> findByContact(String tenantId, String campaignId, String contactId) {
    return Transactions.inTransaction(connectionProvider, conn ->
        stores.instances().findByContact(conn, tenantId, campaignId, contactId));
  }

  public List<CampaignTransition> history(String tenantId, String instanceId) {
    return Transactions.inTransaction(connectionProvider, conn ->
        stores.transitions().listByInstance(conn, tenantId, instanceId));
  }

  /**
   * Pauses an active instance and cancels its pending actions.
   */
  public ContactCampaignInstance pause(String tenantId, String instanceId, String reason) {
    return Transactions.inTransaction(connectionProvider,
        conn -> pause(conn, lock(conn, tenantId, instanceId), reason));
  }

  public ContactCampaignInstance pause(Connection conn, ContactCampaignInstance instance, String reason) {
    ContactCampaignInstance paused = move(conn, instance, CampaignInstanceStatus.PAUSED, reason);
    queue.cancelByInstance(conn, instance.tenantId(), instance.id(), "instance paused");
    return paused;
  }

  /**
   * Resumes a paused instance and re-enqueues its earliest pending step at
   * {@code max(scheduledAt, now)}.
   */
  public ContactCampaignInstance resume(String tenantId, String instanceId, String reason) {
    return Transactions.inTransaction(connectionProvider, conn -> {
      ContactCampaignInstance instance = lock(conn, tenantId, instanceId);
      ContactCampaignInstance resumed = move(conn, instance, CampaignInstanceStatus.ACTIVE, reason);
      Instant now = clock.instant();
      Optional<CampaignStepInstance> next = stores.steps().listByInstance(conn, tenantId, instanceId).stream()
          .filter(s -> s.status() == StepInstanceStatus.PENDING)
          .findFirst();
      if (next.isPresent() && !queue.hasInFlight(conn, tenantId, next.get().id())) {
        Instant at = next.get().scheduledAt().isBefore(now) ? now : next.get().scheduledAt();
        queue.enqueue(conn, next.get(), at);
      }
      return resumed;
    });
  }

  /**
   * Completes an active or paused instance, skipping every pending step.
   */
  public ContactCampaignInstance complete(String tenantId, String instanceId, String reason) {
    return Transactions.inTransaction(connectionProvider, conn -> complete(conn, lock(conn, tenantId, instanceId),
        reason));
  }

  public ContactCampaignInstance complete(Connection conn, ContactCampaignInstance instance, String reason) {
    if (instance.status() == CampaignInstanceStatus.COMPLETED) {
      throw new IllegalTransitionException(instance.status(), CampaignInstanceStatus.COMPLETED);
    }
    queue.cancelByInstance(conn, instance.tenantId(), instance.id(), reason);
    scheduler.skipAllPending(conn, instance, reason);
    return move(conn, instance, CampaignInstanceStatus.COMPLETED, reason);
  }

  /**
   * Cancels a campaign: soft-cancels its pending actions and completes every open
   * instance. Claimed and executing actions finish, then find their instance completed.
   *
   * @return number of completed instances
   */
  public int cancelCampaign(String tenantId, String campaignId, String reason) {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(campaignId, "campaignId");
    int completed = Transactions.inTransaction(connectionProvider, conn -> {
      queue.cancelByCampaign(conn, tenantId, campaignId, reason);
      int count = 0;
      for (ContactCampaignInstance open : stores.instances().listOpenByCampaign(conn, tenantId, campaignId)) {
        ContactCampaignInstance locked = lock(conn, tenantId, open.id());
        if (locked.status() != CampaignInstanceStatus.COMPLETED) {
          complete(conn, locked, reason);
          count++;
        }
      }
      return count;
    });
    logger.log(Level.INFO, "Canceled campaign {0} for tenant {1}: {2} instance(s) completed",
        new Object[]{campaignId, tenantId, completed});
    return completed;
  }

  private ContactCampaignInstance move(Connection conn, ContactCampaignInstance instance,
      CampaignInstanceStatus target, String reason) {
    CampaignInstanceStatus next = instance.status().transitionTo(target);
    Instant now = clock.instant();
    Instant completedAt = next == CampaignInstanceStatus.COMPLETED ? now : null;
    if (stores.instances().updateStatus(conn, instance.tenantId(), instance.id(), instance.status(), next,
        completedAt, now) == 0) {
      throw new CampaignStoreException("Concurrent status change on campaign instance " + instance.id());
    }
    stores.transitions().insert(conn, CampaignTransition.ofInstance(instance, instance.status(), next, reason, now));
    return new ContactCampaignInstance(instance.id(), instance.tenantId(), instance.campaignId(),
        instance.contactId(), instance.planVersionId(), next, instance.addresses(), instance.variables(),
        instance.senderIdentityId(), instance.timezone(), instance.enrolledAt(), completedAt, now);
  }

  private ContactCampaignInstance lock(Connection conn, String tenantId, String instanceId) {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(instanceId, "instanceId");
    return stores.instances().lock(conn, tenantId, instanceId)
        .orElseThrow(() -> new CampaignValidationException("Unknown campaign instance: " + instanceId));
  }
}

package campaign.schedule;

import campaign.CampaignValidationException;
import campaign.model.CampaignInstanceStatus;
import campaign.model.CampaignPlanVersion;
import campaign.model.CampaignStepInstance;
import campaign.model.CampaignTransition;
import campaign.model.Channel;
import campaign.model.ContactCampaignInstance;
import campaign.model.Enrollment;
import campaign.model.IllegalTransitionException;
import campaign.model.PlanStep;
import campaign.model.StepAnchor;
import campaign.model.StepInstanceStatus;
import campaign.model.StepOutcome;
import campaign.queue.ActionQueue;
import campaign.spi.CampaignStoreException;
import campaign.spi.CampaignStores;
import campaign.spi.ConnectionProvider;
import campaign.util.Ids;
import campaign.util.Transactions;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Expands plan versions into per-contact step instances and moves contacts from one step
 * to the next.
 *
 * <p>Lock order is always instance row first, then step row. Methods taking a
 * {@link Connection} join the caller's transaction.
 */
public final class StepScheduler {
  private static final Logger logger = Logger.getLogger(StepScheduler.class.getName());

  private final ConnectionProvider connectionProvider;
  private final CampaignStores stores;
  private final ActionQueue queue;
  private final SendTimeCalculator sendTimes;
  private final TemplateRenderer renderer;
  private final Clock clock;

  public StepScheduler(ConnectionProvider connectionProvider, CampaignStores stores, ActionQueue queue,
      SendTimeCalculator sendTimes, TemplateRenderer renderer, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.stores = Objects.requireNonNull(stores, "stores");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.sendTimes = Objects.requireNonNull(sendTimes, "sendTimes");
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Enrolls a contact into a published plan version.
   *
   * @throws CampaignValidationException if the plan version is unknown or empty, an address
   *     is missing for a channel the plan uses, or the contact is already enrolled
   */
  public MaterializedInstance materializeInstance(Enrollment enrollment, String planVersionId) {
    Objects.requireNonNull(enrollment, "enrollment");
    Objects.requireNonNull(planVersionId, "planVersionId");
    return Transactions.inTransaction(connectionProvider, conn -> {
      CampaignPlanVersion plan = stores.catalog().findPlanVersion(conn, enrollment.tenantId(), planVersionId)
          .orElseThrow(() -> new CampaignValidationException("Unknown plan version: " + planVersionId));
      return materialize(conn, enrollment, plan);
    });
  }

  public MaterializedInstance materializeInstance(Enrollment enrollment, CampaignPlanVersion plan) {
    Objects.requireNonNull(plan, "plan");
    return materializeInstance(enrollment, plan.id());
  }

  private MaterializedInstance materialize(Connection conn, Enrollment enrollment, CampaignPlanVersion plan) {
    if (plan.steps().isEmpty()) {
      throw new CampaignValidationException("Plan version " + plan.id() + " has no steps");
    }
    for (Channel channel : plan.channels()) {
      String address = enrollment.addresses().get(channel);
      if (address == null || address.isBlank()) {
        throw new CampaignValidationException("Enrollment of contact " + enrollment.contactId()
            + " has no " + channel.value() + " address");
      }
    }
    if (stores.instances().findByContact(conn, enrollment.tenantId(), plan.campaignId(), enrollment.contactId())
        .isPresent()) {
      throw new CampaignValidationException("Contact " + enrollment.contactId()
          + " is already enrolled in campaign " + plan.campaignId());
    }

    Instant now = clock.instant();
    ContactCampaignInstance instance = new ContactCampaignInstance(Ids.newId(), enrollment.tenantId(),
        plan.campaignId(), enrollment.contactId(), plan.id(), CampaignInstanceStatus.ACTIVE,
        enrollment.addresses(), enrollment.variables(), enrollment.senderIdentityId(), enrollment.timezone(),
        now, null, now);

    List<CampaignStepInstance> steps = new ArrayList<>();
    Instant previous = now;
    for (PlanStep planStep : plan.steps()) {
      Instant anchor = planStep.anchor() == StepAnchor.PREVIOUS_STEP ? previous : now;
      Instant scheduledAt = sendTimes.compute(anchor, planStep.delay(), planStep.sendWindow(),
          enrollment.timezone());
      steps.add(new CampaignStepInstance(Ids.newId(), instance.tenantId(), instance.id(), instance.campaignId(),
          instance.contactId(), planStep.stepOrder(), planStep.channel(), planStep.condition(), planStep.anchor(),
          planStep.delay(), planStep.sendWindow(), renderer.render(planStep.config(), enrollment.variables()),
          scheduledAt, StepInstanceStatus.PENDING, null, 0, null, null, now));
      previous = scheduledAt;
    }

    stores.instances().insert(conn, instance);
    stores.steps().insertAll(conn, steps);
    stores.transitions().insert(conn, CampaignTransition.ofInstance(instance, null,
        CampaignInstanceStatus.ACTIVE, "enrolled", now));
    for (CampaignStepInstance step : steps) {
      stores.transitions().insert(conn, CampaignTransition.ofStep(step, null, StepInstanceStatus.PENDING,
          "materialized", now));
    }
    CampaignStepInstance first = steps.get(0);
    queue.enqueue(conn, first, first.scheduledAt());
    logger.log(Level.FINE, "Enrolled contact {0} in campaign {1} with {2} step(s)",
        new Object[]{instance.contactId(), instance.campaignId(), steps.size()});
    return new MaterializedInstance(instance, steps);
  }

  /**
   * Applies {@code outcome} to a step and schedules whatever runs next. Safe to repeat.
   */
  public void advance(String tenantId, String stepInstanceId, StepOutcome outcome) {
    Transactions.run(connectionProvider, conn -> advance(conn, tenantId, stepInstanceId, outcome));
  }

  public void advance(Connection conn, String tenantId, String stepInstanceId, StepOutcome outcome) {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(stepInstanceId, "stepInstanceId");
    Objects.requireNonNull(outcome, "outcome");
    CampaignStepInstance unlocked = stores.steps().find(conn, tenantId, stepInstanceId)
        .orElseThrow(() -> new CampaignValidationException("Unknown step instance: " + stepInstanceId));
    ContactCampaignInstance instance = lockInstance(conn, tenantId, unlocked.instanceId());
    CampaignStepInstance step = stores.steps().lock(conn, tenantId, stepInstanceId).orElseThrow();
    Instant now = clock.instant();

    switch (outcome) {
      case OPENED, CLICKED, REPLIED -> recordBranchOutcome(conn, step, outcome.value(), now);
      case DELIVERED, COMPLETED -> completeSent(conn, step, null, outcome.value(), now);
      case BOUNCED, DROPPED -> completeSent(conn, step, outcome.value(), outcome.value(), now);
      default -> {
        // SENT, SKIPPED and FAILED were applied by the caller
      }
    }

    List<CampaignStepInstance> steps = stores.steps().listByInstance(conn, tenantId, instance.id());
    if (instance.isActive()) {
      scheduleNext(conn, steps, instance, now);
    }
    completeIfFinished(conn, instance, steps, now);
  }

  private void recordBranchOutcome(Connection conn, CampaignStepInstance step, String value, Instant now) {
    if (value.equals(step.branchOutcome())) {
      return;
    }
    stores.steps().update(conn, step.withBranchOutcome(value, now), step.status());
    stores.transitions().insert(conn, CampaignTransition.ofStep(step, step.status(), step.status(), value, now));
  }

  private void completeSent(Connection conn, CampaignStepInstance step, String branchOutcome, String reason,
      Instant now) {
    if (step.status() != StepInstanceStatus.SENT) {
      return;
    }
    CampaignStepInstance next = step.withStatus(StepInstanceStatus.COMPLETED, null, now);
    if (branchOutcome != null) {
      next = next.withBranchOutcome(branchOutcome, now);
    }
    stores.steps().update(conn, next, StepInstanceStatus.SENT);
    stores.transitions().insert(conn, CampaignTransition.ofStep(step, StepInstanceStatus.SENT,
        StepInstanceStatus.COMPLETED, reason, now));
  }

  private void scheduleNext(Connection conn, List<CampaignStepInstance> steps, ContactCampaignInstance instance,
      Instant now) {
    Optional<CampaignStepInstance> next = steps.stream()
        .filter(s -> s.status() == StepInstanceStatus.PENDING)
        .findFirst();
    if (next.isEmpty() || queue.hasInFlight(conn, instance.tenantId(), next.get().id())) {
      return;
    }
    CampaignStepInstance step = next.get();
    if (step.anchor() == StepAnchor.PREVIOUS_STEP) {
      Instant reanchored = sendTimes.compute(now, step.delay(), step.sendWindow(), instance.timezone());
      step = step.withScheduledAt(reanchored, now);
      stores.steps().update(conn, step, StepInstanceStatus.PENDING);
    }
    queue.enqueue(conn, step, step.scheduledAt());
  }

  private void completeIfFinished(Connection conn, ContactCampaignInstance instance,
      List<CampaignStepInstance> steps, Instant now) {
    if (instance.status() == CampaignInstanceStatus.COMPLETED || steps.isEmpty()) {
      return;
    }
    boolean anyPending = steps.stream().anyMatch(s -> s.status() == StepInstanceStatus.PENDING);
    if (anyPending || !steps.get(steps.size() - 1).status().isTerminal()) {
      return;
    }
    markCompleted(conn, instance, "all steps finished", now);
  }

  private void markCompleted(Connection conn, ContactCampaignInstance instance, String reason, Instant now) {
    CampaignInstanceStatus next = instance.status().transitionTo(CampaignInstanceStatus.COMPLETED);
    int updated = stores.instances().updateStatus(conn, instance.tenantId(), instance.id(), instance.status(),
        next, now, now);
    if (updated == 0) {
      throw new CampaignStoreException("Concurrent status change on campaign instance " + instance.id());
    }
    stores.transitions().insert(conn, CampaignTransition.ofInstance(instance, instance.status(), next, reason, now));
  }

  /**
   * Resets a step to pending at {@code newTime} under a new epoch and enqueues it.
   *
   * @throws IllegalTransitionException if the step is completed or the instance is completed
   */
  public CampaignStepInstance reschedule(String tenantId, String stepInstanceId, Instant newTime) {
    Objects.requireNonNull(newTime, "newTime");
    return Transactions.inTransaction(connectionProvider, conn -> {
      CampaignStepInstance unlocked = stores.steps().find(conn, tenantId, stepInstanceId)
          .orElseThrow(() -> new CampaignValidationException("Unknown step instance: " + stepInstanceId));
      ContactCampaignInstance instance = lockInstance(conn, tenantId, unlocked.instanceId());
      if (instance.status() == CampaignInstanceStatus.COMPLETED) {
        throw new IllegalTransitionException(instance.status(), CampaignInstanceStatus.ACTIVE);
      }
      CampaignStepInstance step = stores.steps().lock(conn, tenantId, stepInstanceId).orElseThrow();
      Instant now = clock.instant();
      CampaignStepInstance rescheduled = step.rescheduled(newTime, now);
      queue.cancelByStep(conn, tenantId, step.id(), "rescheduled");
      if (stores.steps().update(conn, rescheduled, step.status()) == 0) {
        throw new CampaignStoreException("Concurrent update of step instance " + step.id());
      }
      stores.transitions().insert(conn, CampaignTransition.ofStep(step, step.status(), StepInstanceStatus.PENDING,
          "rescheduled", now));
      if (instance.isActive() && !queue.hasInFlight(conn, tenantId, step.id())) {
        queue.enqueue(conn, rescheduled, newTime);
      }
      return rescheduled;
    });
  }

  /**
   * Skips every pending step of {@code instance} on {@code channel}.
   *
   * @return number of skipped steps
   */
  public int skipRemainingOnChannel(Connection conn, ContactCampaignInstance instance, Channel channel,
      String reason) {
    return skipPending(conn, instance, channel, reason);
  }

  public int skipAllPending(Connection conn, ContactCampaignInstance instance, String reason) {
    return skipPending(conn, instance, null, reason);
  }

  private int skipPending(Connection conn, ContactCampaignInstance instance, Channel channel, String reason) {
    Instant now = clock.instant();
    int skipped = 0;
    for (CampaignStepInstance step : stores.steps().listByInstance(conn, instance.tenantId(), instance.id())) {
      if (step.status() != StepInstanceStatus.PENDING || (channel != null && step.channel() != channel)) {
        continue;
      }
      queue.cancelByStep(conn, step.tenantId(), step.id(), reason);
      if (skipStep(conn, step, reason, now)) {
        skipped++;
      }
    }
    return skipped;
  }

  /**
   * Marks a pending step skipped with a transition.
   *
   * @return {@code false} if the step was no longer pending
   */
  public boolean skipStep(Connection conn, CampaignStepInstance step, String reason, Instant now) {
    CampaignStepInstance skipped = step.withStatus(StepInstanceStatus.SKIPPED, reason, now);
    if (stores.steps().update(conn, skipped, StepInstanceStatus.PENDING) == 0) {
      return false;
    }
    stores.transitions().insert(conn, CampaignTransition.ofStep(step, StepInstanceStatus.PENDING,
        StepInstanceStatus.SKIPPED, reason, now));
    return true;
  }

  private ContactCampaignInstance lockInstance(Connection conn, String tenantId, String instanceId) {
    return stores.instances().lock(conn, tenantId, instanceId)
        .orElseThrow(() -> new CampaignValidationException("Unknown campaign instance: " + instanceId));
  }

  public List<CampaignStepInstance> steps(String tenantId, String instanceId) {
    return Transactions.inTransaction(connectionProvider, conn ->
        stores.steps().listByInstance(conn, tenantId, instanceId));
  }

  public Optional<CampaignStepInstance> step(String tenantId, String stepInstanceId) {
    return Transactions.inTransaction(connectionProvider, conn -> stores.steps().find(conn, tenantId, stepInstanceId));
  }
}

package campaign.dispatch;

import campaign.DispatchResult;
import campaign.ProviderException;
import campaign.SendReceipt;
import campaign.SendRequest;
import campaign.gate.BlockReason;
import campaign.gate.RateLimiter;
import campaign.gate.SuppressionGate;
import campaign.model.CampaignStepInstance;
import campaign.model.CampaignTransition;
import campaign.model.ContactCampaignInstance;
import campaign.model.OutboundMessage;
import campaign.model.OutboundMessageState;
import campaign.model.ScheduledAction;
import campaign.model.StepInstanceStatus;
import campaign.model.StepOutcome;
import campaign.queue.ActionQueue;
import campaign.schedule.StepScheduler;
import campaign.spi.CampaignStoreException;
import campaign.spi.CampaignStores;
import campaign.spi.ConnectionProvider;
import campaign.spi.MessageProvider;
import campaign.spi.MetricsExporter;
import campaign.util.Transactions;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes one claimed {@link ScheduledAction}: gates, reserves the outbound message,
 * calls the channel provider and records the outcome.
 *
 * <p>Gating always runs in this order: step and instance state, due time, branch
 * condition, suppression, provider, dedupe reservation, rate limit. A send is never
 * attempted for a step that a suppression blocks, and budget is only taken once a send
 * is certain.
 *
 * <p>Transient provider and store errors release the action for a later attempt until
 * {@code maxAttempts} is reached; permanent errors fail the step at once.
 */
public final class MessageDispatcher {
  private static final Logger logger = Logger.getLogger(MessageDispatcher.class.getName());

  private final ConnectionProvider connectionProvider;
  private final CampaignStores stores;
  private final ActionQueue queue;
  private final StepScheduler scheduler;
  private final SuppressionGate suppressionGate;
  private final RateLimiter rateLimiter;
  private final DedupeGuard dedupeGuard;
  private final ChannelProviders providers;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final Duration rateLimitBackoff;
  private final Clock clock;
  private final MetricsExporter metrics;

  private MessageDispatcher(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.stores = Objects.requireNonNull(builder.stores, "stores");
    this.queue = Objects.requireNonNull(builder.queue, "queue");
    this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");
    this.suppressionGate = Objects.requireNonNull(builder.suppressionGate, "suppressionGate");
    this.rateLimiter = Objects.requireNonNull(builder.rateLimiter, "rateLimiter");
    this.providers = Objects.requireNonNull(builder.providers, "providers");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.dedupeGuard = new DedupeGuard(connectionProvider, stores.messages(), clock);
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(1_000, 300_000);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = builder.maxAttempts;
    this.rateLimitBackoff = Objects.requireNonNull(builder.rateLimitBackoff, "rateLimitBackoff");
    if (rateLimitBackoff.isNegative()) {
      throw new IllegalArgumentException("rateLimitBackoff must not be negative");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public DispatchResult dispatch(ScheduledAction action) {
    Objects.requireNonNull(action, "action");
    try {
      return doDispatch(action);
    } catch (CampaignStoreException e) {
      logger.log(Level.WARNING, "Store error while dispatching action " + action.id(), e);
      return retryOrFail(action, null, null, describe(e), true, null);
    }
  }

  private DispatchResult doDispatch(ScheduledAction action) {
    String tenantId = action.tenantId();
    Optional<CampaignStepInstance> found = loadStep(action);
    if (found.isEmpty()) {
      return cancel(action, "step instance not found");
    }

    Optional<OutboundMessage> existing = dedupeGuard.find(tenantId, DedupeGuard.dedupeKey(found.get()));
    if (existing.isPresent() && existing.get().state().isAcknowledged()) {
      return alreadySent(action, existing.get());
    }

    if (!queue.markExecuting(action)) {
      logger.log(Level.FINE, "Claim on action {0} was lost", action.id());
      return new DispatchResult.Canceled("claim lost");
    }

    // reloaded under the executing claim; a reschedule may have landed since the claim
    CampaignStepInstance step = loadStep(action).orElse(null);
    if (step == null) {
      return cancel(action, "step instance not found");
    }
    ContactCampaignInstance instance = Transactions.inTransaction(connectionProvider, conn ->
        stores.instances().find(conn, tenantId, step.instanceId())).orElse(null);
    if (step.status() != StepInstanceStatus.PENDING) {
      return cancel(action, "step is " + step.status().name().toLowerCase(Locale.ROOT));
    }
    if (instance == null || !instance.isActive()) {
      return cancel(action, "campaign instance is not active");
    }
    if (step.scheduledAt().isAfter(clock.instant())) {
      return defer(action, step.scheduledAt(), "rescheduled");
    }

    String previousOutcome = previousOutcome(step);
    if (!step.condition().admits(previousOutcome)) {
      return skip(action, step, instance, "branch_not_taken", false);
    }

    String address = instance.address(step.channel());
    Optional<BlockReason> blocked = suppressionGate.check(tenantId, step.channel(), address);
    if (blocked.isPresent()) {
      return skip(action, step, instance, blocked.get().value(), true);
    }

    MessageProvider provider = providers.get(step.channel());
    if (provider == null) {
      return fail(action, step, null, "No provider for channel " + step.channel().value());
    }

    OutboundMessage message = dedupeGuard.reserve(step, instance, address).message();
    if (message.state().isAcknowledged()) {
      return alreadySent(action, message);
    }

    if (!rateLimiter.tryAcquire(tenantId, step.channel(), instance.senderIdentityId())) {
      return defer(action, clock.instant().plus(rateLimitBackoff), "rate limited");
    }

    SendReceipt receipt;
    try {
      receipt = provider.send(toRequest(step, message));
    } catch (ProviderException e) {
      return retryOrFail(action, step, message, describe(e), e.isTransient(), e.retryAfter());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Provider " + provider.getClass().getName() + " failed unexpectedly", e);
      return retryOrFail(action, step, message, describe(e), true, null);
    }
    return recordSent(action, step, message, receipt);
  }

  private Optional<CampaignStepInstance> loadStep(ScheduledAction action) {
    return Transactions.inTransaction(connectionProvider, conn ->
        stores.steps().find(conn, action.tenantId(), action.stepInstanceId()));
  }

  private String previousOutcome(CampaignStepInstance step) {
    return Transactions.inTransaction(connectionProvider, conn ->
        stores.steps().listByInstance(conn, step.tenantId(), step.instanceId())).stream()
        .filter(s -> s.stepOrder() < step.stepOrder())
        .reduce((first, second) -> second)
        .map(CampaignStepInstance::branchOutcome)
        .orElse(null);
  }

  private SendRequest toRequest(CampaignStepInstance step, OutboundMessage message) {
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("tenant_id", step.tenantId());
    if (step.campaignId() != null) {
      metadata.put("campaign_id", step.campaignId());
    }
    metadata.put("step_instance_id", step.id());
    metadata.put("outbound_message_id", message.id());
    metadata.put("dedupe_key", message.dedupeKey());
    return new SendRequest(step.tenantId(), step.channel(), message.senderIdentityId(), message.address(),
        message.content(), message.dedupeKey(), message.id(), metadata);
  }

  private DispatchResult recordSent(ScheduledAction action, CampaignStepInstance step, OutboundMessage message,
      SendReceipt receipt) {
    Transactions.run(connectionProvider, conn -> {
      Instant now = clock.instant();
      lockInstance(conn, step);
      stores.messages().markSent(conn, step.tenantId(), message.id(), receipt.providerMessageId(), now);
      CampaignStepInstance current = stores.steps().lock(conn, step.tenantId(), step.id()).orElseThrow();
      if (current.epoch() != step.epoch()) {
        if (current.status() == StepInstanceStatus.PENDING
            && queue.release(conn, action, current.scheduledAt(), "rescheduled", false) > 0) {
          logger.log(Level.FINE, "Step {0} was rescheduled while sending, action {1} now due at {2}",
              new Object[]{step.id(), action.id(), current.scheduledAt()});
        } else {
          queue.markDone(conn, action);
        }
        return;
      }
      if (current.status() == StepInstanceStatus.PENDING) {
        stores.steps().update(conn, current.sent(now), StepInstanceStatus.PENDING);
        stores.transitions().insert(conn, CampaignTransition.ofStep(current, StepInstanceStatus.PENDING,
            StepInstanceStatus.SENT, "sent", now));
      }
      if (queue.markDone(conn, action) == 0) {
        logger.log(Level.FINE, "Action {0} was reclaimed while sending", action.id());
      }
      OutboundMessageState state = stores.messages().find(conn, step.tenantId(), message.id())
          .map(OutboundMessage::state)
          .orElse(OutboundMessageState.SENT);
      scheduler.advance(conn, step.tenantId(), step.id(), outcomeOf(state, receipt));
    });
    metrics.incrementSent();
    return new DispatchResult.Sent(message.id(), receipt.providerMessageId());
  }

  /**
   * Provider events can be applied before the send is recorded; a message already past
   * {@code SENT} settles the step with that outcome.
   */
  private static StepOutcome outcomeOf(OutboundMessageState state, SendReceipt receipt) {
    return switch (state) {
      case DELIVERED -> StepOutcome.DELIVERED;
      case BOUNCED -> StepOutcome.BOUNCED;
      case DROPPED -> StepOutcome.DROPPED;
      default -> receipt.completed() ? StepOutcome.COMPLETED : StepOutcome.SENT;
    };
  }

  private DispatchResult alreadySent(ScheduledAction action, OutboundMessage message) {
    Transactions.run(connectionProvider, conn -> {
      Instant now = clock.instant();
      CampaignStepInstance unlocked = stores.steps().find(conn, action.tenantId(), action.stepInstanceId())
          .orElseThrow();
      lockInstance(conn, unlocked);
      CampaignStepInstance step = stores.steps().lock(conn, action.tenantId(), unlocked.id()).orElseThrow();
      queue.markDone(conn, action);
      if (step.status() == StepInstanceStatus.PENDING) {
        stores.steps().update(conn, step.sent(now), StepInstanceStatus.PENDING);
        stores.transitions().insert(conn, CampaignTransition.ofStep(step, StepInstanceStatus.PENDING,
            StepInstanceStatus.SENT, "already sent", now));
        scheduler.advance(conn, step.tenantId(), step.id(), StepOutcome.SENT);
      }
    });
    metrics.incrementDeduplicated();
    return new DispatchResult.AlreadySent(message.id());
  }

  private DispatchResult skip(ScheduledAction action, CampaignStepInstance step, ContactCampaignInstance instance,
      String reason, boolean skipChannel) {
    Transactions.run(connectionProvider, conn -> {
      Instant now = clock.instant();
      lockInstance(conn, step);
      CampaignStepInstance current = stores.steps().lock(conn, step.tenantId(), step.id()).orElseThrow();
      scheduler.skipStep(conn, current, reason, now);
      queue.markDone(conn, action);
      if (skipChannel) {
        scheduler.skipRemainingOnChannel(conn, instance, step.channel(), reason);
      }
      scheduler.advance(conn, step.tenantId(), step.id(), StepOutcome.SKIPPED);
    });
    metrics.incrementSkipped();
    logger.log(Level.FINE, "Skipped step {0}: {1}", new Object[]{step.id(), reason});
    return new DispatchResult.Skipped(reason);
  }

  private DispatchResult defer(ScheduledAction action, Instant nextAt, String reason) {
    if (!queue.release(action, nextAt, reason, false)) {
      logger.log(Level.FINE, "Claim on action {0} was lost", action.id());
      return new DispatchResult.Canceled("claim lost");
    }
    metrics.incrementDeferred();
    logger.log(Level.FINE, "Deferred action {0} to {1}: {2}", new Object[]{action.id(), nextAt, reason});
    return new DispatchResult.Deferred(nextAt);
  }

  private DispatchResult cancel(ScheduledAction action, String reason) {
    queue.cancel(action, reason);
    logger.log(Level.FINE, "Canceled action {0}: {1}", new Object[]{action.id(), reason});
    return new DispatchResult.Canceled(reason);
  }

  private DispatchResult retryOrFail(ScheduledAction action, CampaignStepInstance step, OutboundMessage message,
      String error, boolean retryable, Duration retryAfter) {
    int nextAttempt = action.attempts() + 1;
    if (!retryable || nextAttempt >= maxAttempts) {
      return fail(action, step, message, error);
    }
    long delayMs = retryAfter != null ? retryAfter.toMillis() : retryPolicy.computeDelayMs(nextAttempt);
    Instant nextAt = clock.instant().plusMillis(delayMs);
    Transactions.run(connectionProvider, conn -> {
      if (message != null) {
        stores.messages().recordAttemptFailure(conn, message.tenantId(), message.id(), error, clock.instant());
      }
      queue.release(conn, action, nextAt, error, true);
    });
    metrics.incrementRetried();
    logger.log(Level.FINE, "Action {0} attempt {1} failed, retrying at {2}: {3}",
        new Object[]{action.id(), nextAttempt, nextAt, error});
    return new DispatchResult.Retrying(nextAt, error);
  }

  private DispatchResult fail(ScheduledAction action, CampaignStepInstance step, OutboundMessage message,
      String error) {
    Transactions.run(connectionProvider, conn -> {
      Instant now = clock.instant();
      queue.markFailed(conn, action, error);
      if (message != null) {
        stores.messages().updateState(conn, message.tenantId(), message.id(), OutboundMessageState.FAILED, error,
            now);
      }
      CampaignStepInstance target = step != null ? step
          : stores.steps().find(conn, action.tenantId(), action.stepInstanceId()).orElse(null);
      if (target == null) {
        return;
      }
      lockInstance(conn, target);
      CampaignStepInstance current = stores.steps().lock(conn, target.tenantId(), target.id()).orElseThrow();
      if (current.status() == StepInstanceStatus.PENDING) {
        stores.steps().update(conn, current.withStatus(StepInstanceStatus.FAILED, error, now),
            StepInstanceStatus.PENDING);
        stores.transitions().insert(conn, CampaignTransition.ofStep(current, StepInstanceStatus.PENDING,
            StepInstanceStatus.FAILED, error, now));
        scheduler.advance(conn, current.tenantId(), current.id(), StepOutcome.FAILED);
      }
    });
    metrics.incrementFailed();
    logger.log(Level.WARNING, "Action {0} failed permanently: {1}", new Object[]{action.id(), error});
    return new DispatchResult.Failed(error);
  }

  private void lockInstance(Connection conn, CampaignStepInstance step) {
    stores.instances().lock(conn, step.tenantId(), step.instanceId());
  }

  private static String describe(Exception e) {
    String message = e.getMessage();
    return message != null ? message : e.getClass().getSimpleName();
  }

  /**
   * Builder for {@link MessageDispatcher}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private CampaignStores stores;
    private ActionQueue queue;
    private StepScheduler scheduler;
    private SuppressionGate suppressionGate;
    private RateLimiter rateLimiter;
    private ChannelProviders providers;
    private RetryPolicy retryPolicy;
    private int maxAttempts = 5;
    private Duration rateLimitBackoff = Duration.ofSeconds(30);
    private Clock clock;
    private MetricsExporter metrics;

    private Builder() {
    }

    /** <p><b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <p><b>Required.</b> */
    public Builder stores(CampaignStores stores) {
      this.stores = stores;
      return this;
    }

    /** <p><b>Required.</b> */
    public Builder queue(ActionQueue queue) {
      this.queue = queue;
      return this;
    }

    /** <p><b>Required.</b> */
    public Builder scheduler(StepScheduler scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    /** <p><b>Required.</b> */
    public Builder suppressionGate(SuppressionGate suppressionGate) {
      this.suppressionGate = suppressionGate;
      return this;
    }

    /** <p><b>Required.</b> */
    public Builder rateLimiter(RateLimiter rateLimiter) {
      this.rateLimiter = rateLimiter;
      return this;
    }

    /**
     * Sets the channel providers. A step whose channel has no provider fails permanently.
     *
     * <p><b>Required.</b>
     */
    public Builder providers(ChannelProviders providers) {
      this.providers = providers;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code ExponentialBackoffRetryPolicy(1000, 300000)}.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Total attempts, including the first, before a transiently failing action fails.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &gt;= 1.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Delay before an action refused by the rate limiter becomes due again. Deferrals do
     * not count as attempts.
     *
     * <p>Optional. Defaults to 30 seconds.
     */
    public Builder rateLimitBackoff(Duration rateLimitBackoff) {
      this.rateLimitBackoff = rateLimitBackoff;
      return this;
    }

    /** <p>Optional. Defaults to {@link Clock#systemUTC()}. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** <p>Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public MessageDispatcher build() {
      return new MessageDispatcher(this);
    }
  }
}

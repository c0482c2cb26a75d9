package campaign.ingest;

import campaign.CampaignValidationException;
import campaign.gate.SuppressionGate;
import campaign.lifecycle.CampaignInstanceManager;
import campaign.model.Channel;
import campaign.model.CampaignInstanceStatus;
import campaign.model.ContactCampaignInstance;
import campaign.model.InboundMessage;
import campaign.model.MessageEvent;
import campaign.model.MessageEventType;
import campaign.model.NormalizedEvent;
import campaign.model.OutboundMessage;
import campaign.model.OutboundMessageState;
import campaign.model.ReplyPolicy;
import campaign.model.StepOutcome;
import campaign.schedule.StepScheduler;
import campaign.spi.CampaignStores;
import campaign.spi.ConnectionProvider;
import campaign.spi.MetricsExporter;
import campaign.util.Transactions;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies normalized provider events to campaign state.
 *
 * <p>Each event is applied in its own transaction together with every transition it
 * causes. Message events carrying a provider event id already on record, and replies
 * already stored under the same id, are ignored, which makes webhook redelivery and
 * replay safe.
 */
public final class TransitionEngine {
  private static final Logger logger = Logger.getLogger(TransitionEngine.class.getName());

  private final ConnectionProvider connectionProvider;
  private final CampaignStores stores;
  private final StepScheduler scheduler;
  private final CampaignInstanceManager instanceManager;
  private final SuppressionGate suppressionGate;
  private final ReplyPolicy replyPolicy;
  private final Clock clock;
  private final MetricsExporter metrics;

  public TransitionEngine(ConnectionProvider connectionProvider, CampaignStores stores, StepScheduler scheduler,
      CampaignInstanceManager instanceManager, SuppressionGate suppressionGate, ReplyPolicy replyPolicy,
      Clock clock, MetricsExporter metrics) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.stores = Objects.requireNonNull(stores, "stores");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.instanceManager = Objects.requireNonNull(instanceManager, "instanceManager");
    this.suppressionGate = Objects.requireNonNull(suppressionGate, "suppressionGate");
    this.replyPolicy = Objects.requireNonNull(replyPolicy, "replyPolicy");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  public AppliedEvent apply(NormalizedEvent event) {
    Objects.requireNonNull(event, "event");
    AppliedEvent applied;
    if (event instanceof MessageEvent) {
      applied = Transactions.inTransaction(connectionProvider, conn -> applyMessageEvent(conn, (MessageEvent) event));
    } else {
      applied = Transactions.inTransaction(connectionProvider, conn -> applyReply(conn, (InboundMessage) event));
    }
    if (applied.status() == AppliedEvent.Status.APPLIED) {
      metrics.incrementEventsApplied();
    }
    return applied;
  }

  private AppliedEvent applyMessageEvent(Connection conn, MessageEvent event) {
    Optional<OutboundMessage> found = resolve(conn, event.tenantId(), event.messageId(), event.dedupeKey(),
        event.providerMessageId());
    if (found.isEmpty()) {
      logger.log(Level.FINE, "No outbound message for {0} event {1}",
          new Object[]{event.type().value(), event.providerEventId()});
      return new AppliedEvent(AppliedEvent.Status.UNMATCHED, event.tenantId(), null, event.type().value());
    }
    OutboundMessage message = found.get();
    MessageEvent resolved = event.resolvedTo(message);
    String tenantId = message.tenantId();
    if (resolved.providerEventId() != null
        && stores.events().existsByProviderEventId(conn, tenantId, resolved.providerEventId())) {
      return new AppliedEvent(AppliedEvent.Status.DUPLICATE, tenantId, message.id(), event.type().value());
    }
    stores.events().insert(conn, resolved);

    Instant now = clock.instant();
    ContactCampaignInstance instance = lockInstance(conn, message);
    switch (resolved.type()) {
      case DELIVERED -> {
        if (message.state() == OutboundMessageState.QUEUED || message.state() == OutboundMessageState.SENT) {
          stores.messages().updateState(conn, tenantId, message.id(), OutboundMessageState.DELIVERED, null, now);
        }
        advance(conn, message, StepOutcome.DELIVERED);
      }
      case BOUNCED, DROPPED -> {
        boolean bounced = resolved.type() == MessageEventType.BOUNCED;
        String reason = resolved.type().value();
        stores.messages().updateState(conn, tenantId, message.id(),
            bounced ? OutboundMessageState.BOUNCED : OutboundMessageState.DROPPED, resolved.data().get("reason"), now);
        suppressionGate.suppress(conn, tenantId, message.channel(), message.address(), reason, null);
        skipChannel(conn, instance, message.channel(), reason);
        advance(conn, message, bounced ? StepOutcome.BOUNCED : StepOutcome.DROPPED);
      }
      case OPENED -> advance(conn, message, StepOutcome.OPENED);
      case CLICKED -> advance(conn, message, StepOutcome.CLICKED);
      case SPAM -> {
        suppressionGate.suppress(conn, tenantId, message.channel(), message.address(), "spam_report", null);
        skipChannel(conn, instance, message.channel(), "spam_report");
        advance(conn, message, StepOutcome.SKIPPED);
      }
      case UNSUBSCRIBED, GROUP_UNSUBSCRIBED -> {
        suppressionGate.unsubscribe(conn, tenantId, message.channel(), message.address(), resolved.type().value());
        skipChannel(conn, instance, message.channel(), "unsubscribed");
        advance(conn, message, StepOutcome.SKIPPED);
      }
      default -> {
        // deferred and group_resubscribed are recorded only
      }
    }
    return new AppliedEvent(AppliedEvent.Status.APPLIED, tenantId, message.id(), resolved.type().value());
  }

  private AppliedEvent applyReply(Connection conn, InboundMessage reply) {
    Optional<OutboundMessage> message = resolve(conn, reply.tenantId(), reply.messageId(), null,
        reply.providerMessageId());
    InboundMessage stored = message.map(reply::correlatedTo).orElse(reply);
    if (stored.tenantId() == null) {
      throw new CampaignValidationException("Reply " + reply.id() + " cannot be routed to a tenant");
    }
    if (stores.inbound().exists(conn, stored.tenantId(), stored.id())) {
      return new AppliedEvent(AppliedEvent.Status.DUPLICATE, stored.tenantId(), stored.messageId(), "replied");
    }
    stores.inbound().insert(conn, stored);

    if (stored.campaignId() != null && stored.contactId() != null) {
      Optional<ContactCampaignInstance> instance = stores.instances()
          .findByContact(conn, stored.tenantId(), stored.campaignId(), stored.contactId())
          .flatMap(i -> stores.instances().lock(conn, i.tenantId(), i.id()));
      if (instance.isPresent()) {
        applyReplyPolicy(conn, instance.get());
      }
    }
    message.filter(m -> m.stepInstanceId() != null)
        .ifPresent(m -> scheduler.advance(conn, m.tenantId(), m.stepInstanceId(), StepOutcome.REPLIED));
    return new AppliedEvent(AppliedEvent.Status.APPLIED, stored.tenantId(), stored.messageId(), "replied");
  }

  private void applyReplyPolicy(Connection conn, ContactCampaignInstance instance) {
    if (instance.status() == CampaignInstanceStatus.COMPLETED) {
      return;
    }
    if (replyPolicy == ReplyPolicy.STOP) {
      instanceManager.complete(conn, instance, "reply received");
    } else if (instance.status() == CampaignInstanceStatus.ACTIVE) {
      instanceManager.pause(conn, instance, "reply received");
    }
  }

  private Optional<OutboundMessage> resolve(Connection conn, String tenantId, String messageId, String dedupeKey,
      String providerMessageId) {
    Optional<OutboundMessage> found = Optional.empty();
    if (messageId != null) {
      found = tenantId != null
          ? stores.messages().find(conn, tenantId, messageId)
          : stores.messages().findById(conn, messageId);
    }
    if (found.isEmpty() && dedupeKey != null) {
      String keyTenant = tenantId != null ? tenantId : dedupeKey.substring(0, Math.max(0, dedupeKey.indexOf(':')));
      if (!keyTenant.isEmpty()) {
        found = stores.messages().findByDedupeKey(conn, keyTenant, dedupeKey);
      }
    }
    if (found.isEmpty() && providerMessageId != null) {
      found = stores.messages().findByProviderMessageId(conn, tenantId, providerMessageId);
    }
    return found;
  }

  private ContactCampaignInstance lockInstance(Connection conn, OutboundMessage message) {
    if (message.stepInstanceId() == null) {
      return null;
    }
    return stores.steps().find(conn, message.tenantId(), message.stepInstanceId())
        .flatMap(step -> stores.instances().lock(conn, step.tenantId(), step.instanceId()))
        .orElse(null);
  }

  private void skipChannel(Connection conn, ContactCampaignInstance instance, Channel channel, String reason) {
    if (instance != null) {
      scheduler.skipRemainingOnChannel(conn, instance, channel, reason);
    }
  }

  private void advance(Connection conn, OutboundMessage message, StepOutcome outcome) {
    if (message.stepInstanceId() != null) {
      scheduler.advance(conn, message.tenantId(), message.stepInstanceId(), outcome);
    }
  }
}

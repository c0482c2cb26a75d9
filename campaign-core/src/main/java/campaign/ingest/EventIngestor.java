package campaign.ingest;

import campaign.CampaignValidationException;
import campaign.model.NormalizedEvent;
import campaign.model.WebhookDelivery;
import campaign.model.WebhookDeliveryStatus;
import campaign.spi.ConnectionProvider;
import campaign.spi.WebhookDeliveryStore;
import campaign.util.Ids;
import campaign.util.Transactions;

import java.time.Clock;
import java.time.DateTimeException;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for provider webhooks.
 *
 * <p>Every payload is archived verbatim before anything else happens, so a delivery that
 * fails verification, normalization or application can be inspected and replayed later.
 */
public final class EventIngestor {
  private static final Logger logger = Logger.getLogger(EventIngestor.class.getName());

  private final ConnectionProvider connectionProvider;
  private final WebhookDeliveryStore deliveries;
  private final TransitionEngine transitionEngine;
  private final Map<String, WebhookNormalizer> normalizers = new HashMap<>();
  private final Map<String, WebhookSignatureVerifier> verifiers = new HashMap<>();
  private final Clock clock;

  public EventIngestor(ConnectionProvider connectionProvider, WebhookDeliveryStore deliveries,
      TransitionEngine transitionEngine, Collection<? extends WebhookNormalizer> normalizers,
      Collection<? extends WebhookSignatureVerifier> verifiers, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.deliveries = Objects.requireNonNull(deliveries, "deliveries");
    this.transitionEngine = Objects.requireNonNull(transitionEngine, "transitionEngine");
    this.clock = Objects.requireNonNull(clock, "clock");
    for (WebhookNormalizer normalizer : normalizers) {
      if (this.normalizers.putIfAbsent(normalizer.provider(), normalizer) != null) {
        throw new IllegalArgumentException("Duplicate normalizer for provider " + normalizer.provider());
      }
    }
    for (WebhookSignatureVerifier verifier : verifiers) {
      if (this.verifiers.putIfAbsent(verifier.provider(), verifier) != null) {
        throw new IllegalArgumentException("Duplicate signature verifier for provider " + verifier.provider());
      }
    }
  }

  /**
   * Archives, verifies, normalizes and applies one webhook payload.
   *
   * @param headers request headers used for signature verification; may be empty
   * @return the archived delivery with its final status
   * @throws WebhookRejectedException if a verifier is configured and the signature is invalid
   */
  public WebhookDelivery ingest(String provider, String rawPayload, Map<String, String> headers) {
    Objects.requireNonNull(provider, "provider");
    Objects.requireNonNull(rawPayload, "rawPayload");
    WebhookSignatureVerifier verifier = verifiers.get(provider);
    WebhookDelivery delivery = new WebhookDelivery(Ids.newId(), null, provider, null, null, rawPayload,
        verifier != null ? verifier.signature(headers) : null, WebhookDeliveryStatus.RECEIVED, clock.instant(),
        null, null);
    Transactions.run(connectionProvider, conn -> deliveries.insert(conn, delivery));

    if (verifier != null && !verifier.verify(rawPayload, headers)) {
      finish(delivery, WebhookDeliveryStatus.FAILED, null, null, null, "signature verification failed");
      throw new WebhookRejectedException(delivery.id(), "Invalid " + provider + " webhook signature");
    }
    return process(delivery);
  }

  /**
   * Re-runs normalization and application of an archived delivery. Events already
   * recorded are detected as duplicates.
   */
  public WebhookDelivery replay(String provider, String deliveryId) {
    WebhookDelivery delivery = Transactions.inTransaction(connectionProvider, conn ->
        deliveries.find(conn, provider, deliveryId))
        .orElseThrow(() -> new CampaignValidationException("Unknown webhook delivery: " + deliveryId));
    logger.log(Level.INFO, "Replaying {0} webhook delivery {1}", new Object[]{provider, deliveryId});
    return process(delivery);
  }

  private WebhookDelivery process(WebhookDelivery delivery) {
    WebhookNormalizer normalizer = normalizers.get(delivery.provider());
    if (normalizer == null) {
      return finish(delivery, WebhookDeliveryStatus.FAILED, null, null, null,
          "no normalizer for provider " + delivery.provider());
    }
    List<NormalizedEvent> events;
    try {
      events = normalizer.normalize(delivery);
    } catch (IllegalArgumentException | DateTimeException e) {
      logger.log(Level.WARNING, "Could not normalize webhook delivery " + delivery.id(), e);
      return finish(delivery, WebhookDeliveryStatus.FAILED, null, null, null, e.getMessage());
    }

    int failures = 0;
    String tenantId = null;
    String eventType = null;
    String messageId = null;
    String firstError = null;
    for (NormalizedEvent event : events) {
      try {
        AppliedEvent applied = transitionEngine.apply(event);
        if (tenantId == null) {
          tenantId = applied.tenantId();
        }
        if (eventType == null) {
          eventType = applied.eventType();
        }
        if (messageId == null) {
          messageId = applied.messageId();
        }
      } catch (RuntimeException e) {
        failures++;
        if (firstError == null) {
          firstError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        }
        logger.log(Level.WARNING, "Failed to apply event from webhook delivery " + delivery.id(), e);
      }
    }

    WebhookDeliveryStatus status;
    if (failures == 0) {
      status = WebhookDeliveryStatus.PROCESSED;
    } else if (failures == events.size()) {
      status = WebhookDeliveryStatus.FAILED;
    } else {
      status = WebhookDeliveryStatus.PARTIAL_FAILURE;
    }
    return finish(delivery, status, tenantId, eventType, messageId, firstError);
  }

  private WebhookDelivery finish(WebhookDelivery delivery, WebhookDeliveryStatus status, String tenantId,
      String eventType, String messageId, String error) {
    WebhookDelivery finished = new WebhookDelivery(delivery.id(), tenantId, delivery.provider(), eventType,
        messageId, delivery.payload(), delivery.signature(), status, delivery.receivedAt(), clock.instant(), error);
    Transactions.run(connectionProvider, conn -> deliveries.updateOutcome(conn, finished.id(), status, tenantId,
        eventType, messageId, error, finished.processedAt()));
    return finished;
  }
}

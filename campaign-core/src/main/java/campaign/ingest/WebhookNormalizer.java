package campaign.ingest;

import campaign.model.NormalizedEvent;
import campaign.model.WebhookDelivery;

import java.util.List;

/**
 * Turns one archived provider webhook into typed events.
 *
 * <p>Malformed entries inside an otherwise readable payload are skipped. A payload that
 * cannot be read at all throws {@link IllegalArgumentException}.
 */
public interface WebhookNormalizer {

  /** Provider name this normalizer handles, matched against {@link WebhookDelivery#provider()}. */
  String provider();

  List<NormalizedEvent> normalize(WebhookDelivery delivery);
}

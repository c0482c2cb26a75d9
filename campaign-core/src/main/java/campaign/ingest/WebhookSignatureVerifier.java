package campaign.ingest;

import java.util.Map;

/**
 * Authenticates a raw webhook payload against the provider's signature headers.
 */
public interface WebhookSignatureVerifier {

  String provider();

  /**
   * @param headers request headers; names are matched case-insensitively
   */
  boolean verify(String payload, Map<String, String> headers);

  /**
   * @return the signature value to archive with the delivery, or {@code null}
   */
  default String signature(Map<String, String> headers) {
    return null;
  }

  static String header(Map<String, String> headers, String name) {
    if (headers == null) {
      return null;
    }
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if (name.equalsIgnoreCase(entry.getKey())) {
        return entry.getValue();
      }
    }
    return null;
  }
}

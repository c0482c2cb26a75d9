package campaign.ingest;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Verifies SendGrid Signed Event Webhook requests.
 *
 * <p>SendGrid signs {@code timestamp + payload} with ECDSA over SHA-256. The account's
 * verification key is a base64 DER public key, optionally wrapped in PEM armor.
 * Timestamps older than {@code maxTimestampAge}, or more than five minutes in the future,
 * are rejected.
 */
public final class SendGridSignatureVerifier implements WebhookSignatureVerifier {
  private static final Logger logger = Logger.getLogger(SendGridSignatureVerifier.class.getName());

  public static final String SIGNATURE_HEADER = "X-Twilio-Email-Event-Webhook-Signature";
  public static final String TIMESTAMP_HEADER = "X-Twilio-Email-Event-Webhook-Timestamp";

  private static final Duration MAX_CLOCK_SKEW = Duration.ofSeconds(300);

  private final PublicKey publicKey;
  private final Duration maxTimestampAge;
  private final Clock clock;

  public SendGridSignatureVerifier(String publicKey) {
    this(publicKey, Duration.ofSeconds(600), Clock.systemUTC());
  }

  /**
   * @throws IllegalArgumentException if {@code publicKey} is not a valid EC public key
   */
  public SendGridSignatureVerifier(String publicKey, Duration maxTimestampAge, Clock clock) {
    this.publicKey = decodeKey(Objects.requireNonNull(publicKey, "publicKey"));
    this.maxTimestampAge = Objects.requireNonNull(maxTimestampAge, "maxTimestampAge");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public String provider() {
    return SendGridWebhookNormalizer.PROVIDER;
  }

  @Override
  public boolean verify(String payload, Map<String, String> headers) {
    String signature = WebhookSignatureVerifier.header(headers, SIGNATURE_HEADER);
    String timestamp = WebhookSignatureVerifier.header(headers, TIMESTAMP_HEADER);
    if (payload == null || signature == null || timestamp == null) {
      logger.log(Level.WARNING, "SendGrid webhook is missing signature headers");
      return false;
    }
    long sentAt;
    try {
      sentAt = Long.parseLong(timestamp.trim());
    } catch (NumberFormatException e) {
      logger.log(Level.WARNING, "SendGrid webhook timestamp is not numeric: {0}", timestamp);
      return false;
    }
    long age = clock.instant().getEpochSecond() - sentAt;
    if (age > maxTimestampAge.getSeconds() || age < -MAX_CLOCK_SKEW.getSeconds()) {
      logger.log(Level.WARNING, "SendGrid webhook timestamp outside accepted range, age {0}s", age);
      return false;
    }
    try {
      Signature verifier = Signature.getInstance("SHA256withECDSA");
      verifier.initVerify(publicKey);
      verifier.update((timestamp + payload).getBytes(StandardCharsets.UTF_8));
      return verifier.verify(Base64.getDecoder().decode(signature.trim()));
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      logger.log(Level.WARNING, "SendGrid webhook signature could not be verified", e);
      return false;
    }
  }

  @Override
  public String signature(Map<String, String> headers) {
    return WebhookSignatureVerifier.header(headers, SIGNATURE_HEADER);
  }

  private static PublicKey decodeKey(String key) {
    String base64 = key
        .replace("-----BEGIN PUBLIC KEY-----", "")
        .replace("-----END PUBLIC KEY-----", "")
        .replaceAll("\\s", "");
    try {
      return KeyFactory.getInstance("EC").generatePublic(new X509EncodedKeySpec(Base64.getDecoder().decode(base64)));
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid SendGrid verification key", e);
    }
  }
}

package campaign;

import java.time.Duration;
import java.util.Objects;

/**
 * Failure reported by a {@link campaign.spi.MessageProvider}.
 *
 * <p>{@link Kind#TRANSIENT} failures (timeouts, 5xx, throttling) are retried with backoff
 * up to the dispatcher's attempt limit; {@link Kind#PERMANENT} failures (invalid address,
 * hard bounce, rejected content) fail the step immediately. A transient failure may carry
 * a provider-requested {@link #retryAfter()} delay, e.g. from an HTTP 429
 * {@code Retry-After} header; it replaces the dispatcher's backoff for that attempt.
 */
public class ProviderException extends RuntimeException {

  public enum Kind {
    TRANSIENT,
    PERMANENT
  }

  private final Kind kind;
  private final Duration retryAfter;

  protected ProviderException(Kind kind, Duration retryAfter, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    if (retryAfter != null && retryAfter.isNegative()) {
      throw new IllegalArgumentException("retryAfter must not be negative");
    }
    this.retryAfter = retryAfter;
  }

  public static ProviderException transientFailure(String message) {
    return new ProviderException(Kind.TRANSIENT, null, message, null);
  }

  public static ProviderException transientFailure(String message, Throwable cause) {
    return new ProviderException(Kind.TRANSIENT, null, message, cause);
  }

  public static ProviderException permanentFailure(String message) {
    return new ProviderException(Kind.PERMANENT, null, message, null);
  }

  public static ProviderException permanentFailure(String message, Throwable cause) {
    return new ProviderException(Kind.PERMANENT, null, message, cause);
  }

  /**
   * Transient failure with a provider-specified delay before the next attempt.
   *
   * @throws NullPointerException     if {@code retryAfter} is null
   * @throws IllegalArgumentException if {@code retryAfter} is negative
   */
  public static ProviderException retryAfter(Duration retryAfter, String message) {
    return new ProviderException(Kind.TRANSIENT, Objects.requireNonNull(retryAfter, "retryAfter"),
        message, null);
  }

  public Kind kind() {
    return kind;
  }

  public boolean isTransient() {
    return kind == Kind.TRANSIENT;
  }

  /**
   * @return the provider-requested delay, or {@code null} to use the retry policy
   */
  public Duration retryAfter() {
    return retryAfter;
  }
}

package campaign.dispatch;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Doubles the delay on every attempt starting from {@code baseDelayMs}, caps it at
 * {@code maxDelayMs}, then applies a jitter factor drawn from [0.5, 1.5). The jittered
 * value is capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private static final int MAX_SHIFT = 62;

  private final long baseDelayMs;
  private final long maxDelayMs;

  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempt) {
    if (attempt <= 0) {
      return 0L;
    }
    long ceiling = uncappedDelay(attempt);
    long jittered = (long) (ceiling * ThreadLocalRandom.current().nextDouble(0.5, 1.5));
    return Math.min(maxDelayMs, jittered);
  }

  private long uncappedDelay(int attempt) {
    int shift = Math.min(attempt - 1, MAX_SHIFT);
    if (shift >= Long.numberOfLeadingZeros(baseDelayMs) - 1) {
      return maxDelayMs;
    }
    return Math.min(maxDelayMs, baseDelayMs << shift);
  }
}

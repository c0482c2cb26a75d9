package campaign.dispatch;

/**
 * Computes how long a transiently failed action waits before it becomes due again.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * @param attempt the attempt that just failed, 1-based
   * @return delay in milliseconds, never negative
   */
  long computeDelayMs(int attempt);
}

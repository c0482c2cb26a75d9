package campaign.dispatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void firstAttemptIsAroundBaseDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 300000);

    long delay = policy.computeDelayMs(1);

    assertTrue(delay >= 500 && delay < 1500, "got " + delay);
  }

  @Test
  void delayDoublesPerAttempt() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 100000);

    long delay2 = policy.computeDelayMs(2);
    long delay4 = policy.computeDelayMs(4);

    // base * 2^(n-1) with jitter in [0.5, 1.5)
    assertTrue(delay2 >= 100 && delay2 < 300, "delay2: " + delay2);
    assertTrue(delay4 >= 400 && delay4 < 1200, "delay4: " + delay4);
  }

  @Test
  void delayIsCappedAtMaxDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 500);

    for (int attempt = 1; attempt < 100; attempt++) {
      long delay = policy.computeDelayMs(attempt);
      assertTrue(delay > 0 && delay <= 500, "attempt " + attempt + ": " + delay);
    }
  }

  @Test
  void nonPositiveAttemptHasNoDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 10000);

    assertEquals(0L, policy.computeDelayMs(0));
    assertEquals(0L, policy.computeDelayMs(-3));
  }

  @Test
  void rejectsInvalidBounds() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 1000));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(1000, 999));
  }
}

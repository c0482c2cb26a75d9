package campaign;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ProviderExceptionTest {

  @Test
  void kinds() {
    assertTrue(ProviderException.transientFailure("timeout").isTransient());
    ProviderException permanent = ProviderException.permanentFailure("bad address");
    assertFalse(permanent.isTransient());
    assertEquals(ProviderException.Kind.PERMANENT, permanent.kind());
    assertNull(permanent.retryAfter());
  }

  @Test
  void retryAfterIsTransientWithDelay() {
    ProviderException e = ProviderException.retryAfter(Duration.ofSeconds(20), "429");
    assertTrue(e.isTransient());
    assertEquals(Duration.ofSeconds(20), e.retryAfter());
    assertEquals("429", e.getMessage());
  }

  @Test
  void retryAfterMustBePresentAndNonNegative() {
    assertThrows(NullPointerException.class, () -> ProviderException.retryAfter(null, "x"));
    assertThrows(IllegalArgumentException.class,
        () -> ProviderException.retryAfter(Duration.ofSeconds(-1), "x"));
  }
}

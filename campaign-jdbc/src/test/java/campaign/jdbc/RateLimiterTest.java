package campaign.jdbc;

import campaign.gate.RateLimiter;
import campaign.model.Channel;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static campaign.jdbc.TestSupport.T0;
import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {
  private static final String TENANT = "acme";

  private HikariDataSource dataSource;
  private TestSupport.MutableClock clock;
  private RateLimiter limiter;

  @BeforeEach
  void setup() {
    dataSource = TestSupport.h2("ratelimit", 8);
    clock = new TestSupport.MutableClock(T0);
    limiter = new RateLimiter(new DataSourceConnectionProvider(dataSource),
        JdbcCampaignStores.detect(dataSource).rateLimits(), clock);
  }

  @AfterEach
  void tearDown() {
    dataSource.close();
  }

  @Test
  void channelWithoutPolicyIsUnlimited() {
    for (int i = 0; i < 20; i++) {
      assertTrue(limiter.tryAcquire(TENANT, Channel.SMS, null));
    }
  }

  @Test
  void concurrentCallersNeverExceedBudget() throws Exception {
    limiter.definePolicy(TENANT, Channel.EMAIL, null, Duration.ofHours(1), 25);

    int threads = 8;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Integer>> futures = new ArrayList<>();
    for (int t = 0; t < threads; t++) {
      futures.add(pool.submit(() -> {
        start.await();
        int granted = 0;
        for (int i = 0; i < 10; i++) {
          if (limiter.tryAcquire(TENANT, Channel.EMAIL, null)) {
            granted++;
          }
        }
        return granted;
      }));
    }
    start.countDown();

    int total = 0;
    for (Future<Integer> future : futures) {
      total += future.get(30, TimeUnit.SECONDS);
    }
    pool.shutdown();
    assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    assertEquals(25, total);
  }

  @Test
  void windowSlidesForward() {
    limiter.definePolicy(TENANT, Channel.EMAIL, null, Duration.ofMinutes(10), 2);
    assertTrue(limiter.tryAcquire(TENANT, Channel.EMAIL, null));
    clock.advance(Duration.ofMinutes(5));
    assertTrue(limiter.tryAcquire(TENANT, Channel.EMAIL, null));
    assertFalse(limiter.tryAcquire(TENANT, Channel.EMAIL, null));

    clock.advance(Duration.ofMinutes(5));
    assertTrue(limiter.tryAcquire(TENANT, Channel.EMAIL, null));
    assertFalse(limiter.tryAcquire(TENANT, Channel.EMAIL, null));
  }

  @Test
  void identityAndTenantBudgetsBothApply() {
    limiter.definePolicy(TENANT, Channel.EMAIL, null, Duration.ofHours(1), 3);
    limiter.definePolicy(TENANT, Channel.EMAIL, "sender-a", Duration.ofHours(1), 1);

    assertTrue(limiter.tryAcquire(TENANT, Channel.EMAIL, "sender-a"));
    assertFalse(limiter.tryAcquire(TENANT, Channel.EMAIL, "sender-a"));
    // the refused call above consumed no tenant permit
    assertTrue(limiter.tryAcquire(TENANT, Channel.EMAIL, "sender-b"));
    assertTrue(limiter.tryAcquire(TENANT, Channel.EMAIL, "sender-b"));
    assertFalse(limiter.tryAcquire(TENANT, Channel.EMAIL, "sender-b"));
  }

  @Test
  void budgetsAreIsolatedPerTenantAndChannel() {
    limiter.definePolicy(TENANT, Channel.EMAIL, null, Duration.ofHours(1), 1);
    assertTrue(limiter.tryAcquire(TENANT, Channel.EMAIL, null));
    assertFalse(limiter.tryAcquire(TENANT, Channel.EMAIL, null));
    assertTrue(limiter.tryAcquire(TENANT, Channel.CALL, null));
    assertTrue(limiter.tryAcquire("globex", Channel.EMAIL, null));
  }

  @Test
  void redefiningPolicyKeepsRecordedPermits() {
    limiter.definePolicy(TENANT, Channel.EMAIL, null, Duration.ofHours(1), 1);
    assertTrue(limiter.tryAcquire(TENANT, Channel.EMAIL, null));
    limiter.definePolicy(TENANT, Channel.EMAIL, null, Duration.ofHours(1), 2);

    assertTrue(limiter.tryAcquire(TENANT, Channel.EMAIL, null));
    assertFalse(limiter.tryAcquire(TENANT, Channel.EMAIL, null));
  }
}

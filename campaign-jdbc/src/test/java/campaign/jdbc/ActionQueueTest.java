package campaign.jdbc;

import campaign.CampaignEngine;
import campaign.CampaignValidationException;
import campaign.DispatchResult;
import campaign.model.CampaignPlanVersion;
import campaign.model.Channel;
import campaign.model.Enrollment;
import campaign.model.ScheduledAction;
import campaign.model.ScheduledActionStatus;
import campaign.schedule.MaterializedInstance;
import campaign.schedule.StepDefinition;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static campaign.jdbc.TestSupport.T0;
import static org.junit.jupiter.api.Assertions.*;

class ActionQueueTest {
  private static final String TENANT = "acme";

  private HikariDataSource dataSource;
  private TestSupport.MutableClock clock;
  private CampaignEngine engine;
  private CampaignPlanVersion plan;

  @BeforeEach
  void setup() {
    dataSource = TestSupport.h2("queue", 8);
    clock = new TestSupport.MutableClock(T0);
    engine = TestSupport.engine(dataSource, clock, TestSupport.RecordingProvider.email()).build();
    plan = TestSupport.publish(engine, TENANT,
        StepDefinition.of(1, Channel.EMAIL, Duration.ZERO, Map.of("subject", "hello")),
        StepDefinition.of(2, Channel.EMAIL, Duration.ofDays(1), Map.of("subject", "again")));
  }

  @AfterEach
  void tearDown() {
    engine.close();
    dataSource.close();
  }

  private MaterializedInstance enroll(String contactId) {
    return engine.scheduler().materializeInstance(Enrollment.builder(TENANT, contactId)
        .address(Channel.EMAIL, contactId + "@example.com")
        .build(), plan);
  }

  private ScheduledAction action(MaterializedInstance enrolled, int order) {
    return engine.queue().actionsForStep(TENANT, enrolled.step(order).id()).get(0);
  }

  @Test
  void concurrentClaimersNeverShareAnAction() throws Exception {
    int contacts = 40;
    for (int i = 0; i < contacts; i++) {
      enroll("c" + i);
    }

    int threads = 4;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<List<String>>> futures = new ArrayList<>();
    for (int t = 0; t < threads; t++) {
      futures.add(pool.submit(() -> {
        start.await();
        List<String> ids = new ArrayList<>();
        List<ScheduledAction> batch;
        do {
          batch = engine.queue().claimDue(TENANT, 3);
          batch.forEach(a -> ids.add(a.id()));
        } while (!batch.isEmpty());
        return ids;
      }));
    }
    start.countDown();

    List<String> all = new ArrayList<>();
    for (Future<List<String>> future : futures) {
      all.addAll(future.get(30, TimeUnit.SECONDS));
    }
    pool.shutdown();
    assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

    Set<String> unique = new HashSet<>(all);
    assertEquals(all.size(), unique.size(), "an action was claimed twice");
    assertEquals(contacts, unique.size());
  }

  @Test
  void claimOrdersByScheduledTimeAndSkipsFutureActions() {
    MaterializedInstance first = enroll("c1");
    clock.advance(Duration.ofMinutes(1));
    MaterializedInstance second = enroll("c2");

    List<ScheduledAction> claimed = engine.queue().claimDue(TENANT, 10);

    assertEquals(List.of(action(first, 1).id(), action(second, 1).id()),
        claimed.stream().map(ScheduledAction::id).toList());
    for (ScheduledAction a : claimed) {
      assertEquals(ScheduledActionStatus.CLAIMED, a.status());
      assertNotNull(a.claimToken());
      assertEquals(clock.instant().plus(Duration.ofMinutes(5)), a.leaseExpiresAt());
    }
    assertTrue(engine.queue().claimDue(TENANT, 10).isEmpty());
    assertTrue(engine.queue().claimDue("other-tenant", T0.plus(Duration.ofDays(2)), 10).isEmpty());
  }

  @Test
  void expiredLeaseIsReclaimedAndOldClaimIsFenced() {
    MaterializedInstance enrolled = enroll("c1");
    ScheduledAction stale = engine.queue().claimDue(TENANT, 10).get(0);

    assertEquals(0, engine.queue().reclaimExpired(clock.instant().plus(Duration.ofMinutes(4))));
    clock.advance(Duration.ofMinutes(6));
    assertEquals(1, engine.queue().reclaimExpired(clock.instant()));

    ScheduledAction reclaimed = action(enrolled, 1);
    assertEquals(ScheduledActionStatus.PENDING, reclaimed.status());
    assertEquals(1, reclaimed.attempts());
    assertEquals("lease expired", reclaimed.lastError());
    assertNull(reclaimed.claimToken());

    ScheduledAction fresh = engine.queue().claimDue(TENANT, 10).get(0);
    assertEquals(stale.id(), fresh.id());
    assertNotEquals(stale.claimToken(), fresh.claimToken());

    assertFalse(engine.queue().markDone(stale));
    assertFalse(engine.queue().markExecuting(stale));
    assertInstanceOf(DispatchResult.Canceled.class, engine.dispatcher().dispatch(stale));
    assertEquals(ScheduledActionStatus.CLAIMED, action(enrolled, 1).status());

    assertInstanceOf(DispatchResult.Sent.class, engine.dispatcher().dispatch(fresh));
    assertEquals(ScheduledActionStatus.DONE, action(enrolled, 1).status());
  }

  @Test
  void releaseCountsAttemptOnlyWhenAsked() {
    MaterializedInstance enrolled = enroll("c1");
    ScheduledAction claimed = engine.queue().claimDue(TENANT, 10).get(0);
    assertTrue(engine.queue().release(claimed, T0.plusSeconds(30), "rate limited", false));
    assertEquals(0, action(enrolled, 1).attempts());

    clock.advance(Duration.ofSeconds(30));
    claimed = engine.queue().claimDue(TENANT, 10).get(0);
    assertTrue(engine.queue().release(claimed, T0.plusSeconds(90), "timeout", true));
    ScheduledAction released = action(enrolled, 1);
    assertEquals(1, released.attempts());
    assertEquals(T0.plusSeconds(90), released.scheduledAt());
    assertEquals("timeout", released.lastError());
  }

  @Test
  void enqueueReturnsExistingInFlightAction() {
    MaterializedInstance enrolled = enroll("c1");
    ScheduledAction existing = action(enrolled, 1);

    ScheduledAction again = engine.queue().enqueue(TENANT, enrolled.step(1).id(), T0.plusSeconds(5));

    assertEquals(existing.id(), again.id());
    assertEquals(1, engine.queue().actionsForStep(TENANT, enrolled.step(1).id()).size());
    assertThrows(CampaignValidationException.class,
        () -> engine.queue().enqueue(TENANT, "missing-step", T0));
  }

  @Test
  void cancelByInstanceOnlyTouchesPendingActions() {
    MaterializedInstance claimedInstance = enroll("c1");
    MaterializedInstance pendingInstance = enroll("c2");
    ScheduledAction claimed = engine.queue().claimDue(TENANT, 1).get(0);
    assertEquals(action(claimedInstance, 1).id(), claimed.id());

    assertEquals(0, engine.queue().cancelByInstance(TENANT, claimedInstance.instance().id()));
    assertEquals(1, engine.queue().cancelByInstance(TENANT, pendingInstance.instance().id()));

    assertEquals(ScheduledActionStatus.CLAIMED, action(claimedInstance, 1).status());
    ScheduledAction canceled = action(pendingInstance, 1);
    assertEquals(ScheduledActionStatus.CANCELED, canceled.status());
    assertEquals("instance canceled", canceled.lastError());
    assertFalse(engine.queue().hasInFlight(TENANT, pendingInstance.step(1).id()));
  }

  @Test
  void oldestDueReportsBacklog() {
    assertEquals(Optional.empty(), engine.queue().oldestDue(T0));
    enroll("c1");
    clock.advance(Duration.ofMinutes(3));
    enroll("c2");

    assertEquals(Optional.of(T0), engine.queue().oldestDue(clock.instant()));
    assertEquals(Optional.empty(), engine.queue().oldestDue(T0.minusSeconds(1)));
  }
}

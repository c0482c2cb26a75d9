package campaign.jdbc;

import campaign.CampaignEngine;
import campaign.DispatchResult;
import campaign.ProviderException;
import campaign.gate.RateLimiter;
import campaign.model.CampaignInstanceStatus;
import campaign.model.CampaignPlanVersion;
import campaign.model.Channel;
import campaign.model.Enrollment;
import campaign.model.ScheduledAction;
import campaign.model.StepInstanceStatus;
import campaign.model.WebhookDeliveryStatus;
import campaign.schedule.MaterializedInstance;
import campaign.schedule.StepDefinition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static campaign.jdbc.TestSupport.T0;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the engine against a real database. Subclasses provide a DataSource whose schema
 * is already created. Each test works in its own tenant so tests can share one database.
 */
abstract class AbstractEngineIntegrationTest {

  abstract DataSource dataSource();

  private String tenant;
  private TestSupport.MutableClock clock;
  private TestSupport.RecordingProvider email;
  private CampaignEngine engine;

  @BeforeEach
  void startEngine() {
    tenant = "t-" + UUID.randomUUID();
    clock = new TestSupport.MutableClock(T0);
    email = TestSupport.RecordingProvider.email();
    engine = TestSupport.engine(dataSource(), clock, email, TestSupport.RecordingProvider.call()).build();
  }

  @AfterEach
  void stopEngine() {
    engine.close();
  }

  private List<DispatchResult> runDue() {
    List<DispatchResult> results = new ArrayList<>();
    List<ScheduledAction> claimed;
    while (!(claimed = engine.queue().claimDue(tenant, 10)).isEmpty()) {
      for (ScheduledAction action : claimed) {
        results.add(engine.dispatcher().dispatch(action));
      }
    }
    return results;
  }

  private MaterializedInstance enroll(CampaignPlanVersion plan, String contactId) {
    return engine.scheduler().materializeInstance(Enrollment.builder(tenant, contactId)
        .address(Channel.EMAIL, contactId + "@example.com")
        .address(Channel.CALL, "+15550100000")
        .build(), plan);
  }

  private static <T> List<T> runConcurrently(int threads, Callable<List<T>> task) throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<List<T>>> futures = new ArrayList<>();
    for (int t = 0; t < threads; t++) {
      futures.add(pool.submit(() -> {
        start.await();
        return task.call();
      }));
    }
    start.countDown();
    List<T> all = new ArrayList<>();
    for (Future<List<T>> future : futures) {
      all.addAll(future.get(60, TimeUnit.SECONDS));
    }
    pool.shutdown();
    assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    return all;
  }

  @Test
  void concurrentClaimsAreExclusive() throws Exception {
    CampaignPlanVersion plan = TestSupport.publish(engine, tenant,
        StepDefinition.of(1, Channel.EMAIL, Duration.ZERO, Map.of("subject", "hi")));
    for (int i = 0; i < 30; i++) {
      enroll(plan, "c" + i);
    }

    List<String> claimed = runConcurrently(4, () -> {
      List<String> ids = new ArrayList<>();
      List<ScheduledAction> batch;
      while (!(batch = engine.queue().claimDue(tenant, 4)).isEmpty()) {
        batch.forEach(a -> ids.add(a.id()));
      }
      return ids;
    });

    Set<String> unique = new HashSet<>(claimed);
    assertEquals(claimed.size(), unique.size(), "an action was claimed twice");
    assertEquals(30, unique.size());
  }

  @Test
  void campaignRunsToCompletionWithRetry() {
    email.failWith(() -> ProviderException.transientFailure("timeout"));
    CampaignPlanVersion plan = TestSupport.publish(engine, tenant,
        StepDefinition.of(1, Channel.EMAIL, Duration.ZERO, Map.of("subject", "Hello {{first_name}}")),
        StepDefinition.of(2, Channel.CALL, Duration.ofDays(1), Map.of()));
    MaterializedInstance enrolled = engine.scheduler().materializeInstance(Enrollment.builder(tenant, "c1")
        .address(Channel.EMAIL, "c1@example.com")
        .address(Channel.CALL, "+15550100000")
        .variable("first_name", "Grace")
        .build(), plan);

    assertInstanceOf(DispatchResult.Retrying.class, runDue().get(0));
    clock.advance(Duration.ofMinutes(10));
    assertInstanceOf(DispatchResult.Sent.class, runDue().get(0));
    clock.advance(Duration.ofDays(1));
    assertInstanceOf(DispatchResult.Sent.class, runDue().get(0));

    assertEquals(2, email.requests().size());
    assertEquals(email.requests().get(0).dedupeKey(), email.requests().get(1).dedupeKey());
    assertEquals("Hello Grace", email.requests().get(1).content().get("subject"));
    assertEquals(StepInstanceStatus.COMPLETED,
        engine.scheduler().step(tenant, enrolled.step(2).id()).orElseThrow().status());
    assertEquals(CampaignInstanceStatus.COMPLETED,
        engine.instances().find(tenant, enrolled.instance().id()).orElseThrow().status());
  }

  @Test
  void duplicateWebhookEventsAreIgnored() {
    CampaignPlanVersion plan = TestSupport.publish(engine, tenant,
        StepDefinition.of(1, Channel.EMAIL, Duration.ZERO, Map.of("subject", "hi")));
    enroll(plan, "c1");
    runDue();
    String messageId = email.requests().get(0).outboundMessageId();
    String payload = "[{\"email\":\"c1@example.com\",\"event\":\"delivered\",\"timestamp\":"
        + T0.getEpochSecond() + ",\"sg_event_id\":\"evt-" + tenant + "\",\"tenant_id\":\"" + tenant
        + "\",\"outbound_message_id\":\"" + messageId + "\"}]";

    assertEquals(WebhookDeliveryStatus.PROCESSED, engine.ingestor().ingest("sendgrid", payload, Map.of()).status());
    assertEquals(WebhookDeliveryStatus.PROCESSED, engine.ingestor().ingest("sendgrid", payload, Map.of()).status());
  }

  @Test
  void rateLimitHoldsUnderConcurrency() throws Exception {
    RateLimiter limiter = engine.rateLimiter();
    limiter.definePolicy(tenant, Channel.SMS, null, Duration.ofHours(1), 12);

    List<Boolean> grants = runConcurrently(6, () -> {
      List<Boolean> granted = new ArrayList<>();
      for (int i = 0; i < 5; i++) {
        granted.add(limiter.tryAcquire(tenant, Channel.SMS, null));
      }
      return granted;
    });

    assertEquals(12, grants.stream().filter(Boolean::booleanValue).count());
  }
}

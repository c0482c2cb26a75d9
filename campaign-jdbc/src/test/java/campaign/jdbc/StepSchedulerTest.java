package campaign.jdbc;

import campaign.CampaignEngine;
import campaign.DispatchResult;
import campaign.ProviderException;
import campaign.SendReceipt;
import campaign.SendRequest;
import campaign.model.CampaignPlanVersion;
import campaign.model.CampaignStepInstance;
import campaign.model.CampaignTransition;
import campaign.model.Channel;
import campaign.model.Enrollment;
import campaign.model.IllegalTransitionException;
import campaign.model.ScheduledAction;
import campaign.model.ScheduledActionStatus;
import campaign.model.SendWindow;
import campaign.model.StepInstanceStatus;
import campaign.schedule.MaterializedInstance;
import campaign.schedule.StepDefinition;
import campaign.spi.MessageProvider;
import campaign.util.Transactions;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static campaign.jdbc.TestSupport.T0;
import static org.junit.jupiter.api.Assertions.*;

class StepSchedulerTest {
  private static final String TENANT = "acme";

  private HikariDataSource dataSource;
  private TestSupport.MutableClock clock;
  private TestSupport.RecordingProvider email;
  private CampaignEngine engine;

  @BeforeEach
  void setup() {
    dataSource = TestSupport.h2("scheduler", 4);
    clock = new TestSupport.MutableClock(T0);
    email = TestSupport.RecordingProvider.email();
    engine = TestSupport.engine(dataSource, clock, email, TestSupport.RecordingProvider.call()).build();
  }

  @AfterEach
  void tearDown() {
    engine.close();
    dataSource.close();
  }

  private MaterializedInstance enroll(CampaignPlanVersion plan, ZoneId zone) {
    return engine.scheduler().materializeInstance(Enrollment.builder(TENANT, "contact-1")
        .address(Channel.EMAIL, "ada@example.com")
        .address(Channel.CALL, "+15550100000")
        .timezone(zone)
        .build(), plan);
  }

  private MaterializedInstance enrollTwoEmails() {
    return enroll(TestSupport.publish(engine, TENANT,
        StepDefinition.of(1, Channel.EMAIL, Duration.ZERO, Map.of("subject", "one")),
        StepDefinition.of(2, Channel.EMAIL, Duration.ofDays(2), Map.of("subject", "two"))), null);
  }

  private ScheduledAction onlyAction(String stepInstanceId) {
    List<ScheduledAction> actions = engine.queue().actionsForStep(TENANT, stepInstanceId);
    assertEquals(1, actions.size(), actions.toString());
    return actions.get(0);
  }

  private List<CampaignTransition> transitions(MaterializedInstance enrolled) {
    return Transactions.inTransaction(new DataSourceConnectionProvider(dataSource),
        conn -> JdbcCampaignStores.detect(dataSource).transitions()
            .listByInstance(conn, TENANT, enrolled.instance().id()));
  }

  private CampaignStepInstance step(MaterializedInstance enrolled, int order) {
    return engine.scheduler().step(TENANT, enrolled.step(order).id()).orElseThrow();
  }

  @Test
  void materializeSchedulesEveryStepAndEnqueuesOnlyTheFirst() {
    MaterializedInstance enrolled = enrollTwoEmails();

    List<CampaignStepInstance> steps = engine.scheduler().steps(TENANT, enrolled.instance().id());
    assertEquals(2, steps.size());
    assertEquals(T0, steps.get(0).scheduledAt());
    assertEquals(T0.plus(Duration.ofDays(2)), steps.get(1).scheduledAt());
    assertTrue(steps.stream().allMatch(s -> s.status() == StepInstanceStatus.PENDING && s.epoch() == 0));

    assertTrue(engine.queue().hasInFlight(TENANT, enrolled.step(1).id()));
    assertTrue(engine.queue().actionsForStep(TENANT, enrolled.step(2).id()).isEmpty());
  }

  @Test
  void sendWindowIsAppliedInContactTimezone() {
    CampaignPlanVersion plan = TestSupport.publish(engine, TENANT,
        StepDefinition.of(1, Channel.EMAIL, Duration.ZERO, Map.of("subject", "hi"))
            .within(SendWindow.parse("09:00-17:00")));

    // 09:00Z on a Monday is 04:00 in New York
    MaterializedInstance enrolled = enroll(plan, ZoneId.of("America/New_York"));

    assertEquals(Instant.parse("2025-01-06T14:00:00Z"), enrolled.step(1).scheduledAt());
    assertTrue(TestSupport.runDue(engine).isEmpty());
    clock.set(Instant.parse("2025-01-06T14:00:00Z"));
    assertInstanceOf(DispatchResult.Sent.class, TestSupport.runDue(engine).get(0));
  }

  @Test
  void rescheduleOfSentStepSendsAgainUnderNewEpoch() {
    MaterializedInstance enrolled = enrollTwoEmails();
    TestSupport.runDue(engine);
    assertEquals(StepInstanceStatus.SENT, step(enrolled, 1).status());

    CampaignStepInstance rescheduled = engine.scheduler().reschedule(TENANT, enrolled.step(1).id(),
        T0.plus(Duration.ofDays(1)));

    assertEquals(StepInstanceStatus.PENDING, rescheduled.status());
    assertEquals(1, rescheduled.epoch());
    assertNull(rescheduled.sentAt());

    clock.advance(Duration.ofDays(1));
    assertInstanceOf(DispatchResult.Sent.class, TestSupport.runDue(engine).get(0));

    List<SendRequest> requests = email.requests();
    assertEquals(2, requests.size());
    assertEquals(TENANT + ":" + enrolled.step(1).id() + ":0", requests.get(0).dedupeKey());
    assertEquals(TENANT + ":" + enrolled.step(1).id() + ":1", requests.get(1).dedupeKey());
    assertNotEquals(requests.get(0).outboundMessageId(), requests.get(1).outboundMessageId());
  }

  @Test
  void rescheduleOfPendingStepReplacesItsAction() {
    MaterializedInstance enrolled = enrollTwoEmails();
    TestSupport.runDue(engine);
    Instant later = T0.plus(Duration.ofDays(4));

    engine.scheduler().reschedule(TENANT, enrolled.step(2).id(), later);

    List<ScheduledAction> actions = engine.queue().actionsForStep(TENANT, enrolled.step(2).id());
    assertEquals(2, actions.size());
    assertEquals(1, actions.stream().filter(a -> a.status() == ScheduledActionStatus.CANCELED).count());
    ScheduledAction live = actions.stream().filter(a -> a.status() == ScheduledActionStatus.PENDING)
        .findFirst().orElseThrow();
    assertEquals(later, live.scheduledAt());
    assertEquals(later, step(enrolled, 2).scheduledAt());
  }

  @Test
  void completedStepCannotBeRescheduled() {
    MaterializedInstance enrolled = enroll(TestSupport.publish(engine, TENANT,
        StepDefinition.of(1, Channel.CALL, Duration.ZERO, Map.of()),
        StepDefinition.of(2, Channel.EMAIL, Duration.ofDays(1), Map.of("subject", "x"))), null);
    TestSupport.runDue(engine);
    assertEquals(StepInstanceStatus.COMPLETED, step(enrolled, 1).status());

    assertThrows(IllegalTransitionException.class,
        () -> engine.scheduler().reschedule(TENANT, enrolled.step(1).id(), T0.plusSeconds(60)));
  }

  @Test
  void stepOfCompletedInstanceCannotBeRescheduled() {
    MaterializedInstance enrolled = enrollTwoEmails();
    TestSupport.runDue(engine);
    engine.instances().complete(TENANT, enrolled.instance().id(), "converted");

    assertThrows(IllegalTransitionException.class,
        () -> engine.scheduler().reschedule(TENANT, enrolled.step(1).id(), T0.plusSeconds(60)));
    assertEquals(StepInstanceStatus.SKIPPED, step(enrolled, 2).status());
  }

  @Test
  void rescheduleOfClaimedStepDefersItsAction() {
    MaterializedInstance enrolled = enrollTwoEmails();
    List<ScheduledAction> claimed = engine.queue().claimDue(TENANT, 10);
    assertEquals(1, claimed.size());
    Instant later = T0.plus(Duration.ofDays(1));

    engine.scheduler().reschedule(TENANT, enrolled.step(1).id(), later);
    DispatchResult result = engine.dispatcher().dispatch(claimed.get(0));

    assertEquals(new DispatchResult.Deferred(later), result);
    assertTrue(email.requests().isEmpty());
    ScheduledAction deferred = onlyAction(enrolled.step(1).id());
    assertEquals(ScheduledActionStatus.PENDING, deferred.status());
    assertEquals(later, deferred.scheduledAt());
    assertEquals(0, deferred.attempts());
    assertTrue(TestSupport.runDue(engine).isEmpty());

    clock.advance(Duration.ofDays(1));
    assertInstanceOf(DispatchResult.Sent.class, TestSupport.runDue(engine).get(0));
    assertEquals(1, email.requests().size());
    assertEquals(TENANT + ":" + enrolled.step(1).id() + ":1", email.requests().get(0).dedupeKey());
  }

  @Test
  void rescheduleDuringSendRequeuesForNewTime() {
    Instant later = T0.plus(Duration.ofDays(1));
    List<String> dedupeKeys = new CopyOnWriteArrayList<>();
    MessageProvider rescheduling = new MessageProvider() {
      @Override
      public Channel channel() {
        return Channel.EMAIL;
      }

      @Override
      public SendReceipt send(SendRequest request) {
        dedupeKeys.add(request.dedupeKey());
        if (dedupeKeys.size() == 1) {
          engine.scheduler().reschedule(TENANT, request.metadata().get("step_instance_id"), later);
        }
        return SendReceipt.accepted("prov-" + request.outboundMessageId());
      }
    };
    engine.close();
    engine = TestSupport.engine(dataSource, clock, rescheduling).build();
    MaterializedInstance enrolled = enrollTwoEmails();

    assertInstanceOf(DispatchResult.Sent.class, TestSupport.runDue(engine).get(0));

    CampaignStepInstance pending = step(enrolled, 1);
    assertEquals(StepInstanceStatus.PENDING, pending.status());
    assertEquals(1, pending.epoch());
    assertEquals(later, pending.scheduledAt());
    ScheduledAction requeued = onlyAction(enrolled.step(1).id());
    assertEquals(ScheduledActionStatus.PENDING, requeued.status());
    assertEquals(later, requeued.scheduledAt());

    clock.advance(Duration.ofDays(1));
    assertInstanceOf(DispatchResult.Sent.class, TestSupport.runDue(engine).get(0));
    assertEquals(List.of(TENANT + ":" + enrolled.step(1).id() + ":0", TENANT + ":" + enrolled.step(1).id() + ":1"),
        dedupeKeys);
    assertEquals(StepInstanceStatus.SENT, step(enrolled, 1).status());
  }

  @Test
  void rescheduleOfFailedStepReturnsItToPending() {
    email.failWith(() -> ProviderException.permanentFailure("550 mailbox unavailable"));
    MaterializedInstance enrolled = enrollTwoEmails();
    assertInstanceOf(DispatchResult.Failed.class, TestSupport.runDue(engine).get(0));
    assertEquals(StepInstanceStatus.FAILED, step(enrolled, 1).status());
    Instant later = T0.plus(Duration.ofDays(1));

    CampaignStepInstance rescheduled = engine.scheduler().reschedule(TENANT, enrolled.step(1).id(), later);

    assertEquals(StepInstanceStatus.PENDING, rescheduled.status());
    assertEquals(later, rescheduled.scheduledAt());
    assertEquals(1, rescheduled.epoch());
    assertNull(rescheduled.lastError());
    assertEquals(later, step(enrolled, 1).scheduledAt());
    CampaignTransition transition = transitions(enrolled).stream()
        .filter(t -> enrolled.step(1).id().equals(t.stepInstanceId()))
        .reduce((first, second) -> second)
        .orElseThrow();
    assertEquals("failed", transition.fromStatus());
    assertEquals("pending", transition.toStatus());
    assertEquals("rescheduled", transition.reason());

    clock.advance(Duration.ofDays(1));
    assertInstanceOf(DispatchResult.Sent.class, TestSupport.runDue(engine).get(0));
    assertEquals(2, email.requests().size());
    assertEquals(TENANT + ":" + enrolled.step(1).id() + ":0", email.requests().get(0).dedupeKey());
    assertEquals(TENANT + ":" + enrolled.step(1).id() + ":1", email.requests().get(1).dedupeKey());
    assertEquals(StepInstanceStatus.SENT, step(enrolled, 1).status());
  }
}

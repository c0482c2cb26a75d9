package campaign.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatusTransitionsTest {

  @Test
  void stepLifecycle() {
    assertEquals(StepInstanceStatus.SENT, StepInstanceStatus.PENDING.transitionTo(StepInstanceStatus.SENT));
    assertEquals(StepInstanceStatus.COMPLETED, StepInstanceStatus.SENT.transitionTo(StepInstanceStatus.COMPLETED));
    assertTrue(StepInstanceStatus.PENDING.canTransitionTo(StepInstanceStatus.SKIPPED));
    assertTrue(StepInstanceStatus.PENDING.canTransitionTo(StepInstanceStatus.FAILED));

    assertThrows(IllegalTransitionException.class,
        () -> StepInstanceStatus.PENDING.transitionTo(StepInstanceStatus.COMPLETED));
    assertThrows(IllegalTransitionException.class,
        () -> StepInstanceStatus.SKIPPED.transitionTo(StepInstanceStatus.SENT));
  }

  @Test
  void onlyCompletedStepCannotBeRescheduled() {
    assertEquals(StepInstanceStatus.PENDING, StepInstanceStatus.SENT.reschedule());
    assertEquals(StepInstanceStatus.PENDING, StepInstanceStatus.FAILED.reschedule());
    assertEquals(StepInstanceStatus.PENDING, StepInstanceStatus.SKIPPED.reschedule());
    assertThrows(IllegalTransitionException.class, StepInstanceStatus.COMPLETED::reschedule);
  }

  @Test
  void actionLifecycle() {
    assertTrue(ScheduledActionStatus.PENDING.canTransitionTo(ScheduledActionStatus.CLAIMED));
    assertTrue(ScheduledActionStatus.CLAIMED.canTransitionTo(ScheduledActionStatus.PENDING));
    assertTrue(ScheduledActionStatus.EXECUTING.canTransitionTo(ScheduledActionStatus.DONE));
    assertFalse(ScheduledActionStatus.PENDING.canTransitionTo(ScheduledActionStatus.DONE));
    assertFalse(ScheduledActionStatus.DONE.canTransitionTo(ScheduledActionStatus.PENDING));

    for (ScheduledActionStatus status : ScheduledActionStatus.values()) {
      assertNotEquals(status.isTerminal(), status.isInFlight(), status.name());
    }
  }

  @Test
  void instanceLifecycle() {
    assertEquals(CampaignInstanceStatus.PAUSED,
        CampaignInstanceStatus.ACTIVE.transitionTo(CampaignInstanceStatus.PAUSED));
    assertEquals(CampaignInstanceStatus.ACTIVE,
        CampaignInstanceStatus.PAUSED.transitionTo(CampaignInstanceStatus.ACTIVE));
    assertThrows(IllegalTransitionException.class,
        () -> CampaignInstanceStatus.COMPLETED.transitionTo(CampaignInstanceStatus.ACTIVE));
  }

  @Test
  void codesRoundTrip() {
    for (StepInstanceStatus status : StepInstanceStatus.values()) {
      assertEquals(status, StepInstanceStatus.fromCode(status.code()));
    }
    for (ScheduledActionStatus status : ScheduledActionStatus.values()) {
      assertEquals(status, ScheduledActionStatus.fromCode(status.code()));
    }
    assertThrows(IllegalArgumentException.class, () -> StepInstanceStatus.fromCode(99));
  }

  @Test
  void branchConditions() {
    assertTrue(StepCondition.ALWAYS.admits(null));
    assertTrue(StepCondition.IF_ENGAGED.admits("opened"));
    assertTrue(StepCondition.IF_ENGAGED.admits("replied"));
    assertFalse(StepCondition.IF_ENGAGED.admits("delivered"));
    assertTrue(StepCondition.IF_NOT_ENGAGED.admits(null));
    assertFalse(StepCondition.IF_NOT_ENGAGED.admits("clicked"));
  }

  @Test
  void channelValues() {
    assertEquals("email", Channel.EMAIL.value());
    assertEquals(Channel.CALL, Channel.fromValue(" Call "));
    assertThrows(IllegalArgumentException.class, () -> Channel.fromValue("fax"));
  }
}

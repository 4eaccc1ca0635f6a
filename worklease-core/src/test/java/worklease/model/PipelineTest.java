package worklease.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelineTest {

  private final Pipeline pipeline = Pipeline.defaultPipeline();

  @Test
  void defaultPipelineHasTwoStages() {
    assertEquals(2, pipeline.stageCount());
    assertSame(pipeline, Pipeline.ofStages(2));
    assertEquals(WorkStatus.stageDone(2), pipeline.finalStatus());
  }

  @Test
  void rejectsEmptyPipeline() {
    assertThrows(IllegalArgumentException.class, () -> Pipeline.ofStages(0));
  }

  @Test
  void pendingStatusPerStage() {
    assertEquals(WorkStatus.PENDING, pipeline.pendingStatus(1));
    assertEquals(WorkStatus.stageDone(1), pipeline.pendingStatus(2));
    assertThrows(IllegalArgumentException.class, () -> pipeline.pendingStatus(3));
    assertThrows(IllegalArgumentException.class, () -> pipeline.pendingStatus(0));
  }

  @Test
  void stageClaimedFromStatus() {
    assertEquals(1, pipeline.stageClaimedFrom(WorkStatus.PENDING));
    assertEquals(2, pipeline.stageClaimedFrom(WorkStatus.stageDone(1)));
    assertThrows(IllegalArgumentException.class,
        () -> pipeline.stageClaimedFrom(WorkStatus.stageDone(2)));
    assertThrows(IllegalArgumentException.class,
        () -> pipeline.stageClaimedFrom(WorkStatus.PROCESSING));
  }

  @Test
  void claimableAndTerminalStatuses() {
    assertTrue(pipeline.isClaimable(WorkStatus.PENDING));
    assertTrue(pipeline.isClaimable(WorkStatus.stageDone(1)));
    assertFalse(pipeline.isClaimable(WorkStatus.PROCESSING));
    assertFalse(pipeline.isClaimable(WorkStatus.stageDone(2)));
    assertFalse(pipeline.isClaimable(WorkStatus.FAILED));

    assertTrue(pipeline.isTerminal(WorkStatus.stageDone(2)));
    assertTrue(pipeline.isTerminal(WorkStatus.FAILED));
    assertFalse(pipeline.isTerminal(WorkStatus.stageDone(1)));
    assertFalse(pipeline.isTerminal(WorkStatus.PROCESSING));
  }

  @Test
  void statusesInLifecycleOrder() {
    assertEquals(List.of(WorkStatus.PENDING, WorkStatus.PROCESSING, WorkStatus.stageDone(1),
        WorkStatus.stageDone(2), WorkStatus.FAILED), pipeline.statuses());
    assertEquals(6, Pipeline.ofStages(3).statuses().size());
  }

  @Test
  void happyPathThroughBothStages() {
    WorkStatus s = WorkStatus.PENDING;
    s = pipeline.transition(s, Transition.CLAIM, 1);
    assertEquals(WorkStatus.PROCESSING, s);
    s = pipeline.transition(s, Transition.COMPLETE, 1);
    assertEquals(WorkStatus.stageDone(1), s);
    s = pipeline.transition(s, Transition.CLAIM, 2);
    assertEquals(WorkStatus.PROCESSING, s);
    s = pipeline.transition(s, Transition.COMPLETE, 2);
    assertEquals(WorkStatus.stageDone(2), s);
    assertTrue(pipeline.isTerminal(s));
  }

  @Test
  void retryAndReclaimReturnToStagePending() {
    assertEquals(WorkStatus.PENDING,
        pipeline.transition(WorkStatus.PROCESSING, Transition.RETRY, 1));
    assertEquals(WorkStatus.stageDone(1),
        pipeline.transition(WorkStatus.PROCESSING, Transition.RETRY, 2));
    assertEquals(WorkStatus.stageDone(1),
        pipeline.transition(WorkStatus.PROCESSING, Transition.RECLAIM, 2));
    assertEquals(WorkStatus.FAILED,
        pipeline.transition(WorkStatus.PROCESSING, Transition.FAIL, 2));
  }

  @Test
  void claimFromWrongStageIsIllegal() {
    IllegalTransitionException e = assertThrows(IllegalTransitionException.class,
        () -> pipeline.transition(WorkStatus.PENDING, Transition.CLAIM, 2));
    assertEquals(WorkStatus.PENDING, e.from());
    assertEquals(Transition.CLAIM, e.transition());
  }

  @Test
  void outcomeRequiresProcessing() {
    assertThrows(IllegalTransitionException.class,
        () -> pipeline.transition(WorkStatus.PENDING, Transition.COMPLETE, 1));
    assertThrows(IllegalTransitionException.class,
        () -> pipeline.transition(WorkStatus.stageDone(1), Transition.RETRY, 2));
    assertThrows(IllegalTransitionException.class,
        () -> pipeline.transition(WorkStatus.PENDING, Transition.RECLAIM, 1));
  }

  @Test
  void terminalStatusesAllowNoTransition() {
    for (Transition t : Transition.values()) {
      assertThrows(IllegalTransitionException.class,
          () -> pipeline.transition(WorkStatus.FAILED, t, 1), "FAILED " + t);
      assertThrows(IllegalTransitionException.class,
          () -> pipeline.transition(WorkStatus.stageDone(2), t, 2), "STAGE_2_DONE " + t);
    }
  }

  @Test
  void failureTransitionHonoursRetryBudget() {
    assertEquals(Transition.RETRY, Pipeline.failureTransition(0, 3));
    assertEquals(Transition.RETRY, Pipeline.failureTransition(1, 3));
    assertEquals(Transition.FAIL, Pipeline.failureTransition(2, 3));
    assertEquals(Transition.FAIL, Pipeline.failureTransition(7, 3));
    assertEquals(Transition.FAIL, Pipeline.failureTransition(0, 1));
  }

  @Test
  void failureTransitionRejectsBadArguments() {
    assertThrows(IllegalArgumentException.class, () -> Pipeline.failureTransition(0, 0));
    assertThrows(IllegalArgumentException.class, () -> Pipeline.failureTransition(-1, 3));
  }

  @Test
  void equalityByStageCount() {
    assertEquals(Pipeline.ofStages(4), Pipeline.ofStages(4));
    assertNotEquals(Pipeline.ofStages(4), Pipeline.ofStages(3));
    assertEquals("Pipeline[stages=4]", Pipeline.ofStages(4).toString());
  }
}

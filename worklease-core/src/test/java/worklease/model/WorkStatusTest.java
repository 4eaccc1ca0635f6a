package worklease.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkStatusTest {

  @Test
  void codesMatchPersistedValues() {
    assertEquals("PENDING_STAGE_1", WorkStatus.PENDING.code());
    assertEquals("PROCESSING", WorkStatus.PROCESSING.code());
    assertEquals("STAGE_1_DONE", WorkStatus.stageDone(1).code());
    assertEquals("STAGE_12_DONE", WorkStatus.stageDone(12).code());
    assertEquals("FAILED", WorkStatus.FAILED.code());
  }

  @Test
  void fromCodeParsesEveryStatus() {
    assertSame(WorkStatus.PENDING, WorkStatus.fromCode("PENDING_STAGE_1"));
    assertSame(WorkStatus.PROCESSING, WorkStatus.fromCode("PROCESSING"));
    assertSame(WorkStatus.FAILED, WorkStatus.fromCode("FAILED"));
    assertEquals(WorkStatus.stageDone(2), WorkStatus.fromCode("STAGE_2_DONE"));
  }

  @Test
  void stageDoneEqualityIsByStage() {
    assertEquals(WorkStatus.stageDone(3), WorkStatus.stageDone(3));
    assertNotEquals(WorkStatus.stageDone(3), WorkStatus.stageDone(4));
    assertEquals(WorkStatus.stageDone(3).hashCode(), WorkStatus.stageDone(3).hashCode());
  }

  @Test
  void unknownCodeThrows() {
    assertThrows(IllegalArgumentException.class, () -> WorkStatus.fromCode("DONE"));
    assertThrows(IllegalArgumentException.class, () -> WorkStatus.fromCode("STAGE_0_DONE"));
    assertThrows(IllegalArgumentException.class, () -> WorkStatus.fromCode("PENDING_STAGE_2"));
    assertThrows(NullPointerException.class, () -> WorkStatus.fromCode(null));
  }

  @Test
  void stageDoneRejectsNonPositiveStage() {
    assertThrows(IllegalArgumentException.class, () -> WorkStatus.stageDone(0));
    assertThrows(IllegalArgumentException.class, () -> WorkStatus.stageDone(-1));
  }

  @Test
  void toStringIsCode() {
    assertEquals("STAGE_2_DONE", WorkStatus.stageDone(2).toString());
    assertEquals("PROCESSING", WorkStatus.PROCESSING.toString());
  }
}

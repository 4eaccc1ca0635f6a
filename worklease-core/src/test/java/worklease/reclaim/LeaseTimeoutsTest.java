package worklease.reclaim;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LeaseTimeoutsTest {

  @Test
  void defaultsToThirtyMinutes() {
    LeaseTimeouts timeouts = LeaseTimeouts.defaults();

    assertEquals(Duration.ofMinutes(30), timeouts.defaultTimeout());
    assertEquals(Duration.ofMinutes(30), timeouts.forStage(1));
    assertFalse(timeouts.hasOverrides());
  }

  @Test
  void stageOverridesFallBackToDefault() {
    LeaseTimeouts timeouts = LeaseTimeouts.of(Duration.ofMinutes(10),
        Map.of(2, Duration.ofMinutes(45)));

    assertTrue(timeouts.hasOverrides());
    assertEquals(Duration.ofMinutes(10), timeouts.forStage(1));
    assertEquals(Duration.ofMinutes(45), timeouts.forStage(2));
    assertEquals(Duration.ofMinutes(10), timeouts.forStage(3));
    assertEquals(Map.of(2, Duration.ofMinutes(45)), timeouts.stageOverrides());
  }

  @Test
  void rejectsNonPositiveTimeouts() {
    assertThrows(IllegalArgumentException.class, () -> LeaseTimeouts.of(Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> LeaseTimeouts.of(Duration.ofSeconds(-1)));
    assertThrows(IllegalArgumentException.class,
        () -> LeaseTimeouts.of(Duration.ofMinutes(1), Map.of(1, Duration.ZERO)));
    assertThrows(NullPointerException.class, () -> LeaseTimeouts.of(null));
  }

  @Test
  void rejectsInvalidStage() {
    assertThrows(IllegalArgumentException.class,
        () -> LeaseTimeouts.of(Duration.ofMinutes(1), Map.of(0, Duration.ofMinutes(5))));
  }
}

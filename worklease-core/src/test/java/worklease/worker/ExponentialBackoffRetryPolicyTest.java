package worklease.worker;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void firstRetryIsAroundBaseDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 10000);

    long delay = policy.computeDelayMs(1);

    assertTrue(delay >= 50 && delay < 150, "Expected delay between 50-150, got: " + delay);
  }

  @Test
  void delayDoublesPerAttempt() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 100000);

    long delay2 = policy.computeDelayMs(2); // 200
    long delay3 = policy.computeDelayMs(3); // 400

    assertTrue(delay2 >= 100 && delay2 < 300, "delay2 range: got " + delay2);
    assertTrue(delay3 >= 200 && delay3 < 600, "delay3 range: got " + delay3);
  }

  @Test
  void delayIsCappedAtMaxDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 500);

    for (int attempts = 1; attempts < 20; attempts++) {
      long delay = policy.computeDelayMs(attempts);
      assertTrue(delay <= 500, "attempt " + attempts + " got: " + delay);
    }
  }

  @Test
  void highAttemptCountsDoNotOverflow() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 60000);

    for (int attempts : new int[]{31, 32, 62, 63, 64, 1000, Integer.MAX_VALUE}) {
      long delay = policy.computeDelayMs(attempts);
      assertTrue(delay >= 30000 && delay <= 60000, "attempt " + attempts + " got: " + delay);
    }
  }

  @Test
  void noDelayBeforeFirstAttempt() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy();

    assertEquals(0L, policy.computeDelayMs(0));
    assertEquals(0L, policy.computeDelayMs(-1));
  }

  @Test
  void defaults() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy();

    assertEquals(5_000L, policy.baseDelayMs());
    assertEquals(300_000L, policy.maxDelayMs());
  }

  @Test
  void rejectsInvalidDelays() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 1000));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, -1));
  }
}

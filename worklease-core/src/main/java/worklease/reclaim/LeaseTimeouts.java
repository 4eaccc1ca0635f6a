package worklease.reclaim;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * How long a lease may be held before the reclaimer returns it to the pool: one default,
 * optionally overridden per stage.
 *
 * <p>A timeout must exceed the worst-case time to process one unit, including the
 * collaborator's own retries; otherwise live leases are reclaimed and processed twice.
 */
public final class LeaseTimeouts {

  /** Default lease timeout: 30 minutes. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(30);

  private static final LeaseTimeouts DEFAULTS = new LeaseTimeouts(DEFAULT_TIMEOUT, Map.of());

  private final Duration defaultTimeout;
  private final Map<Integer, Duration> stageTimeouts;

  private LeaseTimeouts(Duration defaultTimeout, Map<Integer, Duration> stageTimeouts) {
    this.defaultTimeout = requirePositive(defaultTimeout, "defaultTimeout");
    TreeMap<Integer, Duration> copy = new TreeMap<>();
    stageTimeouts.forEach((stage, timeout) -> {
      if (stage == null || stage < 1) {
        throw new IllegalArgumentException("stage must be >= 1, got: " + stage);
      }
      copy.put(stage, requirePositive(timeout, "timeout for stage " + stage));
    });
    this.stageTimeouts = Collections.unmodifiableMap(copy);
  }

  public static LeaseTimeouts defaults() {
    return DEFAULTS;
  }

  public static LeaseTimeouts of(Duration timeout) {
    return new LeaseTimeouts(timeout, Map.of());
  }

  /**
   * @param defaultTimeout timeout for stages without an override
   * @param stageTimeouts  per-stage overrides keyed by 1-based stage number
   */
  public static LeaseTimeouts of(Duration defaultTimeout, Map<Integer, Duration> stageTimeouts) {
    return new LeaseTimeouts(defaultTimeout, Objects.requireNonNull(stageTimeouts, "stageTimeouts"));
  }

  public Duration defaultTimeout() {
    return defaultTimeout;
  }

  public Duration forStage(int stage) {
    return stageTimeouts.getOrDefault(stage, defaultTimeout);
  }

  public Map<Integer, Duration> stageOverrides() {
    return stageTimeouts;
  }

  public boolean hasOverrides() {
    return !stageTimeouts.isEmpty();
  }

  private static Duration requirePositive(Duration timeout, String name) {
    Objects.requireNonNull(timeout, name);
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException(name + " must be positive, got: " + timeout);
    }
    return timeout;
  }

  @Override
  public String toString() {
    return "LeaseTimeouts[default=" + defaultTimeout + ", stages=" + stageTimeouts + "]";
  }
}

package worklease.model;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lifecycle status of a unit of work, stored in the {@code status} column by its {@link #code()}.
 *
 * <ul>
 *   <li>{@link Pending} ({@code PENDING_STAGE_1}): created by a producer, waiting for stage 1.</li>
 *   <li>{@link Processing} ({@code PROCESSING}): leased to exactly one worker.</li>
 *   <li>{@link StageDone} ({@code STAGE_<k>_DONE}): stage {@code k} finished; waiting for
 *       stage {@code k+1}, or terminal success when {@code k} is the last stage.</li>
 *   <li>{@link Failed} ({@code FAILED}): retry budget exhausted; terminal.</li>
 * </ul>
 *
 * <p>Which edges are legal between these states is decided by {@link Pipeline#transition}.
 *
 * @see Pipeline
 * @see Transition
 */
public sealed interface WorkStatus
    permits WorkStatus.Pending, WorkStatus.Processing, WorkStatus.StageDone, WorkStatus.Failed {

  Pending PENDING = new Pending();
  Processing PROCESSING = new Processing();
  Failed FAILED = new Failed();

  /**
   * Returns the status recorded after stage {@code stage} completes.
   *
   * @param stage 1-based stage number
   * @return the stage-done status
   * @throws IllegalArgumentException if {@code stage < 1}
   */
  static StageDone stageDone(int stage) {
    return new StageDone(stage);
  }

  /**
   * Parses a persisted status code.
   *
   * @param code the value of the {@code status} column
   * @return the matching status
   * @throws IllegalArgumentException if the code is not a known status
   */
  static WorkStatus fromCode(String code) {
    Objects.requireNonNull(code, "code");
    switch (code) {
      case Pending.CODE:
        return PENDING;
      case Processing.CODE:
        return PROCESSING;
      case Failed.CODE:
        return FAILED;
      default:
        Matcher m = StageDone.CODE_PATTERN.matcher(code);
        if (m.matches()) {
          return stageDone(Integer.parseInt(m.group(1)));
        }
        throw new IllegalArgumentException("Unknown work status: " + code);
    }
  }

  /**
   * Value persisted in the {@code status} column.
   */
  String code();

  /** Initial state; pending for stage 1. */
  record Pending() implements WorkStatus {
    static final String CODE = "PENDING_STAGE_1";

    @Override
    public String code() {
      return CODE;
    }

    @Override
    public String toString() {
      return CODE;
    }
  }

  /** Leased to a worker. */
  record Processing() implements WorkStatus {
    static final String CODE = "PROCESSING";

    @Override
    public String code() {
      return CODE;
    }

    @Override
    public String toString() {
      return CODE;
    }
  }

  /**
   * Stage {@code stage} completed.
   *
   * @param stage 1-based stage number (must be &ge; 1)
   */
  record StageDone(int stage) implements WorkStatus {
    static final Pattern CODE_PATTERN = Pattern.compile("STAGE_([1-9][0-9]*)_DONE");

    public StageDone {
      if (stage < 1) {
        throw new IllegalArgumentException("stage must be >= 1, got: " + stage);
      }
    }

    @Override
    public String code() {
      return "STAGE_" + stage + "_DONE";
    }

    @Override
    public String toString() {
      return code();
    }
  }

  /** Terminal failure. */
  record Failed() implements WorkStatus {
    static final String CODE = "FAILED";

    @Override
    public String code() {
      return CODE;
    }

    @Override
    public String toString() {
      return CODE;
    }
  }
}

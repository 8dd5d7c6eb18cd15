package com.pervasivecode.utils.profiler;

import static com.google.common.base.Preconditions.checkState;
import java.time.Duration;
import com.google.auto.value.AutoValue;

/**
 * The accumulated timing of one action across all of its completed start/stop cycles.
 */
@AutoValue
public abstract class ActionSummary {
  protected ActionSummary() {}

  public abstract String actionName();

  /**
   * Get the sum of the elapsed times of every completed start/stop cycle of this action.
   *
   * @return The total elapsed time.
   */
  public abstract Duration totalElapsedTime();

  /**
   * Get the number of times this action has been started and then stopped.
   *
   * @return The number of start-then-stop cycles.
   */
  public abstract long numStartStopCycles();

  /**
   * Get the position of this action in the order in which actions first completed a cycle. The
   * first action to complete has index 0.
   *
   * @return The completion index.
   */
  public abstract int completionIndex();

  /**
   * Get the mean elapsed time of one cycle.
   *
   * @return The mean elapsed time, or {@link Duration#ZERO} if there were no cycles.
   */
  public Duration meanElapsedTime() {
    if (numStartStopCycles() == 0) {
      return Duration.ZERO;
    }
    return totalElapsedTime().dividedBy(numStartStopCycles());
  }

  public static ActionSummary.Builder builder() {
    return new AutoValue_ActionSummary.Builder();
  }

  /**
   * This object will build an {@link ActionSummary} instance. See {@link ActionSummary} for
   * explanations of what these values mean.
   */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract ActionSummary.Builder setActionName(String actionName);

    public abstract ActionSummary.Builder setTotalElapsedTime(Duration totalElapsedTime);

    public abstract ActionSummary.Builder setNumStartStopCycles(long numStartStopCycles);

    public abstract ActionSummary.Builder setCompletionIndex(int completionIndex);

    protected abstract ActionSummary buildInternal();

    public ActionSummary build() {
      ActionSummary summary = buildInternal();

      long cycles = summary.numStartStopCycles();
      Duration time = summary.totalElapsedTime();

      checkState(cycles >= 0, "numStartStopCycles must be nonnegative. Got: %s", cycles);
      checkState(!time.isNegative(), "totalElapsedTime must be nonnegative. Got: %s", time);
      checkState(summary.completionIndex() >= 0, "completionIndex must be nonnegative. Got: %s",
          summary.completionIndex());

      if (cycles == 0) {
        checkState(time.equals(Duration.ZERO),
            "Zero start-stop cycles must have a total elapsed time of zero. Elapsed: %s", time);
      }

      return summary;
    }
  }
}

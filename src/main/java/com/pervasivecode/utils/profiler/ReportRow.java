package com.pervasivecode.utils.profiler;

import static com.google.common.base.Preconditions.checkState;
import java.time.Duration;
import java.util.OptionalDouble;
import com.google.auto.value.AutoValue;

/**
 * One action's line in a {@link ProfileReport}.
 */
@AutoValue
public abstract class ReportRow {
  protected ReportRow() {}

  public abstract String actionName();

  public abstract Duration meanDuration();

  public abstract long numCalls();

  public abstract Duration totalDuration();

  /**
   * Get this action's total duration as a percentage of the report's total wall time.
   *
   * @return The percentage, or empty if the report's total wall time was not positive.
   */
  public abstract OptionalDouble percentage();

  /**
   * Get the position of this action in the order in which actions first completed a cycle.
   *
   * @return The completion index.
   */
  public abstract int completionIndex();

  public static ReportRow.Builder builder() {
    return new AutoValue_ReportRow.Builder();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract ReportRow.Builder setActionName(String actionName);

    public abstract ReportRow.Builder setMeanDuration(Duration meanDuration);

    public abstract ReportRow.Builder setNumCalls(long numCalls);

    public abstract ReportRow.Builder setTotalDuration(Duration totalDuration);

    public abstract ReportRow.Builder setPercentage(OptionalDouble percentage);

    public abstract ReportRow.Builder setCompletionIndex(int completionIndex);

    protected abstract ReportRow buildInternal();

    public ReportRow build() {
      ReportRow row = buildInternal();
      checkState(row.numCalls() > 0, "numCalls must be positive. Got: %s", row.numCalls());
      checkState(!row.totalDuration().isNegative(), "totalDuration must be nonnegative. Got: %s",
          row.totalDuration());
      return row;
    }
  }
}

package com.pervasivecode.utils.profiler;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import java.time.Duration;
import java.util.Comparator;
import java.util.HashSet;
import java.util.OptionalDouble;
import java.util.Set;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * A snapshot of a profiler's accumulated timings, with one row per action that completed at least
 * one cycle.
 * <p>
 * Rows are sorted by percentage of total wall time, largest first. Actions with equal percentages
 * appear in the order in which they first completed a cycle.
 * <p>
 * When the total wall time is zero or negative (for example, a report requested at the same tick as
 * the start time), percentages cannot be computed: every row's percentage is empty and the rows are
 * in completion order.
 */
@AutoValue
public abstract class ProfileReport {
  private static final Comparator<ReportRow> LARGEST_SHARE_FIRST =
      Comparator.<ReportRow>comparingDouble(row -> row.percentage().orElse(0.0d)).reversed()
          .thenComparingInt(ReportRow::completionIndex);

  protected ProfileReport() {}

  /**
   * Get the wall time from the profiler's start time until the report was built.
   *
   * @return The total wall time. May be zero or negative if the clock did not advance.
   */
  public abstract Duration totalDuration();

  public abstract ImmutableList<ReportRow> rows();

  /**
   * Can percentages of the total wall time be computed for this report?
   *
   * @return True if the total wall time is positive.
   */
  public boolean hasPercentages() {
    return !totalDuration().isNegative() && !totalDuration().isZero();
  }

  /**
   * Get the mean duration of one cycle of each action.
   *
   * @return Mean durations keyed by action name, in row order.
   */
  public ImmutableMap<String, Duration> meanDurationsByAction() {
    ImmutableMap.Builder<String, Duration> means = ImmutableMap.builder();
    for (ReportRow row : rows()) {
      means.put(row.actionName(), row.meanDuration());
    }
    return means.build();
  }

  /**
   * Build a report from accumulated action timings.
   *
   * @param summaries The accumulated timing of each action.
   * @param totalDuration The wall time that percentages are relative to.
   * @return The sorted report.
   * @throws IllegalArgumentException if two summaries share an action name or a completion index.
   */
  public static ProfileReport create(Iterable<ActionSummary> summaries, Duration totalDuration) {
    checkNotNull(summaries);
    checkNotNull(totalDuration);
    boolean canComputePercentages = !totalDuration.isNegative() && !totalDuration.isZero();

    Set<String> actionNames = new HashSet<>();
    Set<Integer> completionIndexes = new HashSet<>();
    ImmutableList.Builder<ReportRow> rows = ImmutableList.builder();
    for (ActionSummary summary : summaries) {
      checkArgument(actionNames.add(summary.actionName()), "Duplicate action name: '%s'",
          summary.actionName());
      checkArgument(completionIndexes.add(summary.completionIndex()),
          "Duplicate completion index %s (action '%s')", summary.completionIndex(),
          summary.actionName());
      if (summary.numStartStopCycles() == 0) {
        continue;
      }
      OptionalDouble percentage = OptionalDouble.empty();
      if (canComputePercentages) {
        percentage = OptionalDouble.of(
            100.0d * summary.totalElapsedTime().toNanos() / totalDuration.toNanos());
      }
      rows.add(ReportRow.builder() //
          .setActionName(summary.actionName()) //
          .setMeanDuration(summary.meanElapsedTime()) //
          .setNumCalls(summary.numStartStopCycles()) //
          .setTotalDuration(summary.totalElapsedTime()) //
          .setPercentage(percentage) //
          .setCompletionIndex(summary.completionIndex()) //
          .build());
    }

    return new AutoValue_ProfileReport(totalDuration,
        ImmutableList.sortedCopyOf(LARGEST_SHARE_FIRST, rows.build()));
  }
}

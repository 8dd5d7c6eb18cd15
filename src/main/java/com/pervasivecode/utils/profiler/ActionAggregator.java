package com.pervasivecode.utils.profiler;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import com.google.common.collect.ImmutableList;

/**
 * Accumulates the total elapsed time and the number of completed cycles of each action.
 * <p>
 * Records are created the first time an action completes, and the order of creation is kept in a
 * separate list, since the report breaks ties between actions by that order.
 * <p>
 * Not safe for use by multiple threads.
 */
final class ActionAggregator {
  private static final class MutableRecord {
    private final int completionIndex;
    private long totalNanos = 0L;
    private long numCycles = 0L;

    private MutableRecord(int completionIndex) {
      this.completionIndex = completionIndex;
    }
  }

  private final Map<String, MutableRecord> recordsByName = new HashMap<>();
  private final List<String> completionOrder = new ArrayList<>();

  /**
   * Add one completed cycle of an action.
   *
   * @param actionName The action that completed.
   * @param elapsed How long the cycle took.
   */
  void record(String actionName, Duration elapsed) {
    checkNotNull(actionName);
    checkNotNull(elapsed);
    checkArgument(!elapsed.isNegative(), "elapsed must be nonnegative. Got: %s", elapsed);

    MutableRecord record = recordsByName.get(actionName);
    if (record == null) {
      record = new MutableRecord(completionOrder.size());
      recordsByName.put(actionName, record);
      completionOrder.add(actionName);
    }

    long newTotal = record.totalNanos + elapsed.toNanos();
    checkState(newTotal >= record.totalNanos, "Overflowed nanos total for action '%s'. %s + %s",
        actionName, record.totalNanos, elapsed.toNanos());
    record.totalNanos = newTotal;
    record.numCycles++;
  }

  Optional<ActionSummary> summarize(String actionName) {
    MutableRecord record = recordsByName.get(checkNotNull(actionName));
    if (record == null) {
      return Optional.empty();
    }
    return Optional.of(toSummary(actionName, record));
  }

  /**
   * Get a snapshot of every record.
   *
   * @return One summary per action that has completed at least once, in completion order.
   */
  ImmutableList<ActionSummary> summaries() {
    ImmutableList.Builder<ActionSummary> summaries = ImmutableList.builder();
    for (String actionName : completionOrder) {
      summaries.add(toSummary(actionName, recordsByName.get(actionName)));
    }
    return summaries.build();
  }

  boolean isEmpty() {
    return completionOrder.isEmpty();
  }

  private static ActionSummary toSummary(String actionName, MutableRecord record) {
    return ActionSummary.builder() //
        .setActionName(actionName) //
        .setTotalElapsedTime(Duration.ofNanos(record.totalNanos)) //
        .setNumStartStopCycles(record.numCycles) //
        .setCompletionIndex(record.completionIndex) //
        .build();
  }
}

package com.pervasivecode.utils.profiler;

import static com.google.common.base.Preconditions.checkNotNull;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableSortedSet;

/**
 * Tracks the actions that have been started but not stopped yet. There is at most one running
 * timer per action name. Stopping a timer feeds its elapsed time to an {@link ActionAggregator}.
 * <p>
 * Not safe for use by multiple threads.
 */
final class ActiveTimerTable {
  private final Map<String, OneShotTimer> runningTimers = new HashMap<>();
  private final Ticker ticker;
  private final ActionAggregator aggregator;

  ActiveTimerTable(Ticker ticker, ActionAggregator aggregator) {
    this.ticker = checkNotNull(ticker);
    this.aggregator = checkNotNull(aggregator);
  }

  /**
   * Start a timer for the named action.
   *
   * @param actionName The action to start timing.
   * @throws DuplicateActionStartException if a timer for this action is already running.
   */
  void start(String actionName) {
    checkNotNull(actionName);
    if (runningTimers.containsKey(actionName)) {
      throw new DuplicateActionStartException(actionName);
    }

    OneShotTimer timer = OneShotTimer.createAndStart(ticker);
    timer.addStopListener(elapsed -> aggregator.record(actionName, elapsed));
    runningTimers.put(actionName, timer);
  }

  /**
   * Stop the running timer for the named action, and add its elapsed time to the aggregator.
   *
   * @param actionName The action to stop timing.
   * @return The elapsed time of this cycle.
   * @throws UnknownActionStopException if no timer for this action is running.
   */
  Duration stop(String actionName) {
    checkNotNull(actionName);
    OneShotTimer timer = runningTimers.remove(actionName);
    if (timer == null) {
      throw new UnknownActionStopException(actionName);
    }
    return timer.stopTimer();
  }

  boolean isActive(String actionName) {
    return runningTimers.containsKey(checkNotNull(actionName));
  }

  ImmutableSortedSet<String> activeActions() {
    return ImmutableSortedSet.copyOf(runningTimers.keySet());
  }
}

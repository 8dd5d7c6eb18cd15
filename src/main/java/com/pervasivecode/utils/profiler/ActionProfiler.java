package com.pervasivecode.utils.profiler;

import java.time.Duration;
import java.util.Optional;
import com.google.common.collect.ImmutableSortedSet;

/**
 * This profiler times named actions (regions of code), accumulating the total elapsed time and the
 * number of start/stop cycles of each action, and reports which actions used the largest share of
 * the wall time since the profiler was created.
 * <p>
 * Example: a program that loads data, trains a model and evaluates it:
 *
 * <pre>
 * ActionProfiler profiler = new SimpleActionProfiler();
 *
 * try (ActionScope scope = profiler.profile("load")) {
 *   loadData();
 * }
 *
 * for (Batch batch : batches) {
 *   profiler.start("train step");
 *   trainOn(batch);
 *   profiler.stop("train step");
 * }
 *
 * Callable&lt;Double&gt; evaluation = ProfiledCallables.wrap(profiler, "evaluate", model::evaluate);
 * double accuracy = evaluation.call();
 *
 * System.out.println(profiler.summary());
 * </pre>
 * <p>
 * At most one timer per action name can be running at a time. Implementations are not required to
 * be safe for use by multiple threads; callers sharing a profiler between threads must synchronize
 * access to it themselves.
 */
public interface ActionProfiler {
  /**
   * Start timing one cycle of the named action.
   *
   * @param actionName The action to time. Example: "load training data".
   * @throws DuplicateActionStartException if the action is already being timed.
   */
  public void start(String actionName);

  /**
   * Stop timing the named action, and add the elapsed time to its accumulated total.
   *
   * @param actionName The action to stop timing.
   * @return The elapsed time of this cycle of the action.
   * @throws UnknownActionStopException if the action is not being timed.
   */
  public Duration stop(String actionName);

  /**
   * Start timing the named action, returning a scope that stops it when closed.
   *
   * @param actionName The action to time.
   * @return A scope to close (typically via try-with-resources) when the action is complete.
   * @throws DuplicateActionStartException if the action is already being timed.
   */
  public ActionScope profile(String actionName);

  /**
   * Restart the wall-time clock that report percentages are relative to. Accumulated action timings
   * are kept.
   */
  public void resetStartTime();

  /**
   * Get the accumulated timing of one action.
   *
   * @param actionName The action to summarize.
   * @return The summary, or empty if the action has never completed a cycle.
   */
  public Optional<ActionSummary> summarize(String actionName);

  public boolean isActive(String actionName);

  /**
   * Get the names of all actions that are currently being timed.
   *
   * @return The running actions' names, in natural order.
   */
  public ImmutableSortedSet<String> activeActions();

  /**
   * Build a report of every action that has completed at least one cycle, ranked by its share of
   * the wall time since the start time.
   *
   * @return The report.
   */
  public ProfileReport report();

  /**
   * Build a report and format it as human-readable text.
   *
   * @return The formatted report.
   */
  public String summary();
}

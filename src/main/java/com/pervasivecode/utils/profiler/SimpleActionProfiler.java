package com.pervasivecode.utils.profiler;

import static com.google.common.base.Preconditions.checkNotNull;
import java.time.Duration;
import java.util.Optional;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableSortedSet;

/**
 * An {@link ActionProfiler} that keeps its running timers and accumulated totals in memory.
 * <p>
 * Each instance is an independent profiling session: its wall-time clock starts when it is
 * constructed (or when {@link #resetStartTime()} is called), and its accumulated totals are kept
 * until the instance is discarded.
 * <p>
 * Instances of SimpleActionProfiler are not safe for use by multiple threads. Unsynchronized
 * concurrent use can lose recorded cycles and misreport which actions are running.
 */
public final class SimpleActionProfiler implements ActionProfiler {
  private static final Logger LOG = LoggerFactory.getLogger(SimpleActionProfiler.class);

  private final Ticker ticker;
  private final ActionAggregator aggregator;
  private final ActiveTimerTable activeTimers;
  private final ProfileReportFormatter reportFormatter;
  private long startNanos;

  /**
   * Create an instance that reads time from the system ticker, and uses the default report format.
   */
  public SimpleActionProfiler() {
    this(ActionProfilerConfig.builder().build());
  }

  /**
   * Create an instance that uses the default report format.
   *
   * @param ticker A monotonic time source with nanoseconds precision.
   */
  public SimpleActionProfiler(@Nonnull Ticker ticker) {
    this(ActionProfilerConfig.builder().setTicker(ticker).build());
  }

  public SimpleActionProfiler(@Nonnull ActionProfilerConfig config) {
    checkNotNull(config);
    this.ticker = config.ticker();
    this.aggregator = new ActionAggregator();
    this.activeTimers = new ActiveTimerTable(ticker, aggregator);
    this.reportFormatter = new ProfileReportFormatter(config.reportFormat());
    this.startNanos = ticker.read();
  }

  @Override
  public void start(@Nonnull String actionName) {
    activeTimers.start(actionName);
    LOG.debug("Started action '{}'", actionName);
  }

  @Override
  public Duration stop(@Nonnull String actionName) {
    Duration elapsed = activeTimers.stop(actionName);
    LOG.debug("Stopped action '{}' after {}", actionName, elapsed);
    return elapsed;
  }

  @Override
  public ActionScope profile(@Nonnull String actionName) {
    start(actionName);
    return new ActionScope(this, actionName);
  }

  @Override
  public void resetStartTime() {
    startNanos = ticker.read();
    LOG.debug("Reset profiler start time");
  }

  @Override
  public Optional<ActionSummary> summarize(@Nonnull String actionName) {
    return aggregator.summarize(actionName);
  }

  @Override
  public boolean isActive(@Nonnull String actionName) {
    return activeTimers.isActive(actionName);
  }

  @Override
  public ImmutableSortedSet<String> activeActions() {
    return activeTimers.activeActions();
  }

  @Override
  public ProfileReport report() {
    Duration totalDuration = Duration.ofNanos(ticker.read() - startNanos);
    ProfileReport report = ProfileReport.create(aggregator.summaries(), totalDuration);
    if (!report.hasPercentages()) {
      LOG.trace("Report total duration is {}; percentages are not available", totalDuration);
    }
    return report;
  }

  @Override
  public String summary() {
    return reportFormatter.format(report());
  }
}

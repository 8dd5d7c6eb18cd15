package com.pervasivecode.utils.profiler;

import static com.google.common.base.Preconditions.checkNotNull;
import com.google.auto.value.AutoValue;
import com.google.common.base.Ticker;

/** This object holds configuration information for a {@link SimpleActionProfiler} instance. */
@AutoValue
public abstract class ActionProfilerConfig {
  protected ActionProfilerConfig() {}

  /**
   * Create an object that will build an {@link ActionProfilerConfig} instance. The builder starts
   * out with the system ticker and the default report format.
   *
   * @return a config builder.
   */
  public static ActionProfilerConfig.Builder builder() {
    return new AutoValue_ActionProfilerConfig.Builder() //
        .setTicker(Ticker.systemTicker()) //
        .setReportFormat(ReportFormat.defaultFormat());
  }

  /**
   * A monotonic time source with nanoseconds precision. All timers and the report's wall time are
   * read from it.
   *
   * @return the time source.
   */
  public abstract Ticker ticker();

  /**
   * The layout of the text produced by {@link ActionProfiler#summary()}.
   *
   * @return the report format.
   */
  public abstract ReportFormat reportFormat();

  /**
   * This object will build an {@link ActionProfilerConfig} instance. See
   * {@link ActionProfilerConfig} for explanations of what these values mean.
   */
  @AutoValue.Builder
  public static abstract class Builder {
    protected Builder() {}

    public abstract ActionProfilerConfig.Builder setTicker(Ticker ticker);

    public abstract ActionProfilerConfig.Builder setReportFormat(ReportFormat reportFormat);

    abstract ActionProfilerConfig buildInternal();

    public ActionProfilerConfig build() {
      ActionProfilerConfig config = buildInternal();

      checkNotNull(config.ticker(), "ticker must not be null.");
      checkNotNull(config.reportFormat(), "reportFormat must not be null.");

      return config;
    }
  }
}

package com.pervasivecode.utils.profiler;

import static com.google.common.base.Preconditions.checkArgument;
import com.google.auto.value.AutoValue;

/** This object holds the layout settings used by a {@link ProfileReportFormatter}. */
@AutoValue
public abstract class ReportFormat {
  public static final String DEFAULT_TITLE = "Profiler Report";
  public static final int DEFAULT_VALUE_COLUMN_WIDTH = 15;
  public static final int DEFAULT_DURATION_SIGNIFICANT_DIGITS = 5;
  public static final int DEFAULT_PERCENTAGE_SIGNIFICANT_DIGITS = 3;

  protected ReportFormat() {}

  /**
   * Create an object that will build a {@link ReportFormat} instance, prepopulated with the default
   * values.
   *
   * @return a config builder holding the defaults.
   */
  public static ReportFormat.Builder builder() {
    return new AutoValue_ReportFormat.Builder() //
        .setTitle(DEFAULT_TITLE) //
        .setValueColumnWidth(DEFAULT_VALUE_COLUMN_WIDTH) //
        .setDurationSignificantDigits(DEFAULT_DURATION_SIGNIFICANT_DIGITS) //
        .setPercentageSignificantDigits(DEFAULT_PERCENTAGE_SIGNIFICANT_DIGITS) //
        .setLineSeparator(System.lineSeparator());
  }

  public static ReportFormat defaultFormat() {
    return builder().build();
  }

  /**
   * The first line of the report.
   *
   * @return the title.
   */
  public abstract String title();

  /**
   * The minimum width of each column other than the Action column. Longer values are not
   * truncated.
   *
   * @return the column width, in characters.
   */
  public abstract int valueColumnWidth();

  /**
   * The number of significant digits used to show durations, which are shown in seconds.
   *
   * @return the number of significant digits.
   */
  public abstract int durationSignificantDigits();

  public abstract int percentageSignificantDigits();

  public abstract String lineSeparator();

  /**
   * This object will build a {@link ReportFormat} instance. See {@link ReportFormat} for
   * explanations of what these values mean.
   */
  @AutoValue.Builder
  public static abstract class Builder {
    protected Builder() {}

    public abstract ReportFormat.Builder setTitle(String title);

    public abstract ReportFormat.Builder setValueColumnWidth(int valueColumnWidth);

    public abstract ReportFormat.Builder setDurationSignificantDigits(int digits);

    public abstract ReportFormat.Builder setPercentageSignificantDigits(int digits);

    public abstract ReportFormat.Builder setLineSeparator(String lineSeparator);

    abstract ReportFormat buildInternal();

    public ReportFormat build() {
      ReportFormat format = buildInternal();

      checkArgument(!format.title().isEmpty(), "title must not be empty.");
      checkArgument(format.valueColumnWidth() > 0, "valueColumnWidth must be positive.");
      checkArgument(format.durationSignificantDigits() > 0,
          "durationSignificantDigits must be positive.");
      checkArgument(format.percentageSignificantDigits() > 0,
          "percentageSignificantDigits must be positive.");
      checkArgument(!format.lineSeparator().isEmpty(), "lineSeparator must not be empty.");

      return format;
    }
  }
}

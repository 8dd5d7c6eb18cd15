package com.pervasivecode.utils.profiler;

import static com.google.common.base.Preconditions.checkNotNull;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.OptionalDouble;
import com.google.common.base.Strings;

/**
 * Formats a {@link ProfileReport} as a plain-text table, such as:
 *
 * <pre>
 * Profiler Report
 * Action     |  Mean duration (s)  |  Num calls        |  Total time (s)     |  Percentage %       |
 * ---------------------------------------------------------------------------------------------
 * Total      |  -                  |  -                |  0.5                |  100 %              |
 * ---------------------------------------------------------------------------------------------
 * train step |  0.1                |  3                |  0.3                |  60 %               |
 * load       |  0.1                |  1                |  0.1                |  20 %               |
 * </pre>
 *
 * (Columns are separated by tabs, so the real alignment depends on the tab stops of the
 * terminal.)
 */
public class ProfileReportFormatter {
  private static final String ACTION_LABEL = "Action";
  private static final String MEAN_LABEL = "Mean duration (s)";
  private static final String NUM_CALLS_LABEL = "Num calls";
  private static final String TOTAL_LABEL = "Total time (s)";
  private static final String PERCENTAGE_LABEL = "Percentage %";
  private static final String TOTAL_ROW_NAME = "Total";
  private static final String NOT_APPLICABLE = "n/a";
  private static final String PERCENT_SUFFIX = " %";

  private final ReportFormat format;

  public ProfileReportFormatter() {
    this(ReportFormat.defaultFormat());
  }

  public ProfileReportFormatter(ReportFormat format) {
    this.format = checkNotNull(format);
  }

  public String format(ProfileReport report) {
    checkNotNull(report);
    String sep = format.lineSeparator();

    // Width of the longest recorded action name. With no rows there is nothing to size against.
    int actionColumnWidth = 0;
    if (!report.rows().isEmpty()) {
      actionColumnWidth =
          report.rows().stream().mapToInt(row -> row.actionName().length()).max().getAsInt();
    }

    String header = formatLine(actionColumnWidth, ACTION_LABEL, MEAN_LABEL, NUM_CALLS_LABEL,
        TOTAL_LABEL, PERCENTAGE_LABEL);
    String separator = Strings.repeat("-", header.length());

    StringBuilder sb = new StringBuilder();
    sb.append(format.title()).append(sep);
    sb.append(header).append(sep);
    sb.append(separator).append(sep);
    sb.append(formatLine(actionColumnWidth, TOTAL_ROW_NAME, "-", "-",
        formatSeconds(report.totalDuration()), "100" + PERCENT_SUFFIX)).append(sep);
    sb.append(separator).append(sep);

    for (ReportRow row : report.rows()) {
      sb.append(formatLine(actionColumnWidth, row.actionName(), formatSeconds(row.meanDuration()),
          Long.toString(row.numCalls()), formatSeconds(row.totalDuration()),
          formatPercentage(row.percentage()))).append(sep);
    }
    return sb.toString();
  }

  private String formatLine(int actionColumnWidth, String action, String mean, String numCalls,
      String total, String percentage) {
    int width = format.valueColumnWidth();
    return new StringBuilder() //
        .append(Strings.padEnd(action, actionColumnWidth, ' ')) //
        .append("\t|  ").append(Strings.padEnd(mean, width, ' ')) //
        .append("\t|  ").append(Strings.padEnd(numCalls, width, ' ')) //
        .append("\t|  ").append(Strings.padEnd(total, width, ' ')) //
        .append("\t|  ").append(Strings.padEnd(percentage, width, ' ')) //
        .append("\t|") //
        .toString();
  }

  String formatSeconds(Duration duration) {
    BigDecimal seconds = BigDecimal.valueOf(duration.toNanos(), 9);
    return toSignificantDigits(seconds, format.durationSignificantDigits());
  }

  String formatPercentage(OptionalDouble percentage) {
    if (!percentage.isPresent()) {
      return NOT_APPLICABLE;
    }
    BigDecimal value = BigDecimal.valueOf(percentage.getAsDouble());
    return toSignificantDigits(value, format.percentageSignificantDigits()) + PERCENT_SUFFIX;
  }

  private static String toSignificantDigits(BigDecimal value, int digits) {
    MathContext context = new MathContext(digits, RoundingMode.HALF_EVEN);
    return value.round(context).stripTrailingZeros().toPlainString();
  }
}

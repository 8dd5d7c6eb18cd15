package com.pervasivecode.utils.profiler;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import org.junit.Test;
import com.google.common.base.Ticker;
import com.google.common.testing.FakeTicker;

public class ReportFormatTest {
  private static final String EXPECTED_EXCEPTION_MESSAGE = "An exception should have been thrown.";

  private static void assertExceptionWhenBuilding(ReportFormat.Builder builder,
      String expectedMessageSubstring) {
    try {
      builder.build();
      assertWithMessage(EXPECTED_EXCEPTION_MESSAGE).fail();
    } catch (IllegalArgumentException iae) {
      assertThat(iae).hasMessageThat().contains(expectedMessageSubstring);
    }
  }

  @Test
  public void defaultFormat_shouldUseDefaults() {
    ReportFormat format = ReportFormat.defaultFormat();
    assertThat(format.title()).isEqualTo("Profiler Report");
    assertThat(format.valueColumnWidth()).isEqualTo(15);
    assertThat(format.durationSignificantDigits()).isEqualTo(5);
    assertThat(format.percentageSignificantDigits()).isEqualTo(3);
    assertThat(format.lineSeparator()).isEqualTo(System.lineSeparator());
  }

  @Test
  public void build_withEmptyTitle_shouldThrow() {
    assertExceptionWhenBuilding(ReportFormat.builder().setTitle(""), "title");
  }

  @Test
  public void build_withInvalidColumnWidth_shouldThrow() {
    assertExceptionWhenBuilding(ReportFormat.builder().setValueColumnWidth(0), "valueColumnWidth");
    assertExceptionWhenBuilding(ReportFormat.builder().setValueColumnWidth(-3),
        "valueColumnWidth");
  }

  @Test
  public void build_withInvalidDigits_shouldThrow() {
    assertExceptionWhenBuilding(ReportFormat.builder().setDurationSignificantDigits(0),
        "durationSignificantDigits");
    assertExceptionWhenBuilding(ReportFormat.builder().setPercentageSignificantDigits(-1),
        "percentageSignificantDigits");
  }

  @Test
  public void build_withEmptyLineSeparator_shouldThrow() {
    assertExceptionWhenBuilding(ReportFormat.builder().setLineSeparator(""), "lineSeparator");
  }

  // Null-checking for the setters is already done by the AutoValue-generated Builder class.

  @Test
  public void actionProfilerConfig_shouldDefaultToSystemTickerAndDefaultFormat() {
    ActionProfilerConfig config = ActionProfilerConfig.builder().build();
    assertThat(config.reportFormat()).isEqualTo(ReportFormat.defaultFormat());
    assertThat(config.ticker()).isSameInstanceAs(Ticker.systemTicker());
  }

  @Test(expected = NullPointerException.class)
  public void actionProfilerConfig_withNullTicker_shouldThrow() {
    ActionProfilerConfig.builder().setTicker(null);
  }

  @Test(expected = NullPointerException.class)
  public void actionProfilerConfig_withNullReportFormat_shouldThrow() {
    ActionProfilerConfig.builder().setReportFormat(null);
  }

  @Test
  public void actionProfilerConfig_withMissingValues_shouldThrow() {
    try {
      new AutoValue_ActionProfilerConfig.Builder().build();
      assertWithMessage(EXPECTED_EXCEPTION_MESSAGE).fail();
    } catch (IllegalStateException ise) {
      assertThat(ise).hasMessageThat().contains("ticker");
    }
  }

  @Test
  public void actionProfilerConfig_shouldKeepGivenValues() {
    FakeTicker ticker = new FakeTicker();
    ReportFormat format = ReportFormat.builder().setTitle("Timings").build();
    ActionProfilerConfig config =
        ActionProfilerConfig.builder().setTicker(ticker).setReportFormat(format).build();
    assertThat(config.ticker()).isSameInstanceAs(ticker);
    assertThat(config.reportFormat().title()).isEqualTo("Timings");
  }
}

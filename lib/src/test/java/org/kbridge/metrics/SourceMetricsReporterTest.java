package org.kbridge.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SourceMetricsReporterTest {

  @Test
  void shouldFormatRunnerMetrics() {
    // Arrange
    final var reports = new ArrayList<String>();
    final var metrics = Map.of(
      SourceMetricsReporter.METRIC_MESSAGES_RECEIVED,
      10L,
      SourceMetricsReporter.METRIC_MESSAGES_ACKED,
      7L,
      SourceMetricsReporter.METRIC_MESSAGES_FAILED,
      2L,
      SourceMetricsReporter.METRIC_UNACKED,
      1L,
      SourceMetricsReporter.METRIC_EVENTS_RECEIVED,
      3L
    );
    final var reporter = new SourceMetricsReporter(() -> metrics, () -> 1500L, reports::add);

    // Act
    reporter.reportMetrics();

    // Assert
    assertEquals(
      "Source metrics: messages received: 10, acked: 7, failed: 2, unacked: 1, events: 3, uptime: 1500 ms",
      reports.get(0)
    );
  }

  @Test
  void shouldDefaultMissingMetricsToZero() {
    // Arrange
    final var reports = new ArrayList<String>();
    final var reporter = new SourceMetricsReporter(
      () -> Map.of(SourceMetricsReporter.METRIC_MESSAGES_RECEIVED, 4L),
      () -> 0L,
      reports::add
    );

    // Act
    reporter.reportMetrics();

    // Assert
    assertEquals(
      "Source metrics: messages received: 4, acked: 0, failed: 0, unacked: 0, events: 0, uptime: 0 ms",
      reports.get(0)
    );
  }

  @Test
  void shouldSkipReportWhenNoMetricsAvailable() {
    // Arrange
    final var reports = new ArrayList<String>();
    final var reporter = new SourceMetricsReporter(Map::of, () -> 0L, reports::add);

    // Act
    reporter.reportMetrics();

    // Assert
    assertTrue(reports.isEmpty());
  }

  @Test
  void shouldNotPropagateSupplierFailures() {
    // Arrange
    final var reporter = new SourceMetricsReporter(
      () -> {
        throw new IllegalStateException("metrics unavailable");
      },
      () -> 0L,
      report -> fail("nothing should be reported")
    );

    // Act & Assert
    assertDoesNotThrow(reporter::reportMetrics);
  }

  @Test
  void shouldDefaultToLoggingReporter() {
    // Act
    final var reporter = new SourceMetricsReporter(Map::of, () -> 0L, null);

    // Assert
    assertNotNull(reporter.reporter());
  }
}

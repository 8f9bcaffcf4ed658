package org.kbridge.metrics;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Reports the metrics of a {@link org.kbridge.runner.SourceRunner}.
 *
 * <p>Basic usage with default logging:
 *
 * <pre>{@code
 * SourceMetricsReporter reporter = new SourceMetricsReporter(
 *     runner::getMetrics,
 *     runner::getUptimeMs,
 *     null
 * );
 * reporter.reportMetrics(); // logs at INFO
 * }</pre>
 *
 * @param metricsSupplier supplier of runner metrics
 * @param uptimeSupplier supplier of runner uptime in ms
 * @param reporter receives the formatted report (defaults to logger if null)
 */
public record SourceMetricsReporter(
  Supplier<Map<String, Long>> metricsSupplier,
  Supplier<Long> uptimeSupplier,
  Consumer<String> reporter
)
  implements MetricsReporter {
  private static final Logger LOGGER = System.getLogger(SourceMetricsReporter.class.getName());

  public static final String METRIC_MESSAGES_RECEIVED = "messagesReceived";
  public static final String METRIC_MESSAGES_ACKED = "messagesAcked";
  public static final String METRIC_MESSAGES_FAILED = "messagesFailed";
  public static final String METRIC_EVENTS_RECEIVED = "eventsReceived";
  public static final String METRIC_UNACKED = "unacked";

  public SourceMetricsReporter {
    reporter = reporter != null ? reporter : SourceMetricsReporter::logMetrics;
  }

  /**
   * Formats the current metrics and uptime and passes the report to the reporter. Nothing is
   * reported while no metrics are available. Failures are logged.
   */
  @Override
  public void reportMetrics() {
    try {
      final var metrics = metricsSupplier.get();
      if (metrics != null && !metrics.isEmpty()) {
        final var report =
          "Source metrics: messages received: %d, acked: %d, failed: %d, unacked: %d, events: %d, uptime: %d ms".formatted(
              metrics.getOrDefault(METRIC_MESSAGES_RECEIVED, 0L),
              metrics.getOrDefault(METRIC_MESSAGES_ACKED, 0L),
              metrics.getOrDefault(METRIC_MESSAGES_FAILED, 0L),
              metrics.getOrDefault(METRIC_UNACKED, 0L),
              metrics.getOrDefault(METRIC_EVENTS_RECEIVED, 0L),
              uptimeSupplier.get()
            );

        reporter.accept(report);
      }
    } catch (final Exception e) {
      LOGGER.log(Level.WARNING, "Error reporting source metrics", e);
    }
  }

  private static void logMetrics(final String metrics) {
    LOGGER.log(Level.INFO, metrics);
  }
}

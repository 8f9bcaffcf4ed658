package org.kbridge.metrics;

/**
 * Defines a metrics reporting component that collects and publishes runtime metrics.
 *
 * <p>Implementations can report metrics to different destinations such as logs or monitoring
 * systems. The core functionality is defined by {@link #reportMetrics()}, while the lifecycle
 * methods {@link #start()} and {@link #stop()} default to doing nothing.
 *
 * <pre>{@code
 * MetricsReporter reporter = new SourceMetricsReporter(runner::getMetrics, runner::getUptimeMs, null);
 * reporter.reportMetrics();
 * }</pre>
 */
public interface MetricsReporter {
  /** Reports collected metrics to the configured destination. */
  void reportMetrics();

  /** Starts the reporter. Default implementation does nothing. */
  default void start() {}

  /** Stops the reporter. Default implementation does nothing. */
  default void stop() {}
}

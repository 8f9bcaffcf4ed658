package org.kbridge.config;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Settings of the kbridge application that are not Kafka client settings. Kafka settings are read
 * separately through an {@link EnvConfigSource}.
 *
 * <p>Example usage with values from the environment:
 *
 * <pre>{@code
 * AppConfig config = AppConfig.fromEnv();
 * }</pre>
 *
 * @param appName the name of the application
 * @param shutdownTimeout how long a graceful shutdown may take
 * @param metricsInterval interval between metrics reports
 * @param sinkTopic topic to forward messages to, or null to log them instead
 */
public record AppConfig(String appName, Duration shutdownTimeout, Duration metricsInterval, String sinkTopic) {
  public static final String DEFAULT_APP_NAME = "kbridge";
  public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);
  public static final Duration DEFAULT_METRICS_INTERVAL = Duration.ofMinutes(1);

  public static final String ENV_APP_NAME = "KBRIDGE_APP_NAME";
  public static final String ENV_SHUTDOWN_TIMEOUT_SEC = "KBRIDGE_SHUTDOWN_TIMEOUT_SEC";
  public static final String ENV_METRICS_INTERVAL_SEC = "KBRIDGE_METRICS_INTERVAL_SEC";
  public static final String ENV_SINK_TOPIC = "KBRIDGE_SINK_TOPIC";

  public AppConfig {
    appName = Objects.requireNonNull(appName, "App name cannot be null");
    shutdownTimeout = validateDuration(shutdownTimeout, DEFAULT_SHUTDOWN_TIMEOUT, "Shutdown timeout");
    metricsInterval = validateDuration(metricsInterval, DEFAULT_METRICS_INTERVAL, "Metrics interval");
    sinkTopic = sinkTopic != null && !sinkTopic.isBlank() ? sinkTopic.trim() : null;
  }

  private static Duration validateDuration(final Duration duration, final Duration defaultValue, final String name) {
    final var result = duration != null ? duration : defaultValue;
    if (result.isNegative()) {
      throw new IllegalArgumentException(name + " cannot be negative");
    }
    return result;
  }

  /**
   * Returns whether messages are forwarded to a sink topic.
   *
   * @return true if a sink topic is configured
   */
  public boolean hasSinkTopic() {
    return sinkTopic != null;
  }

  /**
   * Creates a configuration from the process environment.
   *
   * @return the configuration
   */
  public static AppConfig fromEnv() {
    return fromEnv(System.getenv());
  }

  /**
   * Creates a configuration from the given environment, with defaults for unset or unparsable
   * values.
   *
   * @param env the environment variables
   * @return the configuration
   */
  public static AppConfig fromEnv(final Map<String, String> env) {
    return new AppConfig(
      getEnvOrDefault(env, ENV_APP_NAME, DEFAULT_APP_NAME),
      parseDurationWithFallback(getEnvOrDefault(env, ENV_SHUTDOWN_TIMEOUT_SEC, "30"), "30", Duration::ofSeconds),
      parseDurationWithFallback(getEnvOrDefault(env, ENV_METRICS_INTERVAL_SEC, "60"), "60", Duration::ofSeconds),
      env.get(ENV_SINK_TOPIC)
    );
  }

  private static Duration parseDurationWithFallback(
    final String value,
    final String defaultValue,
    final Function<Long, Duration> converter
  ) {
    try {
      return converter.apply(Long.parseLong(value.trim()));
    } catch (final NumberFormatException e) {
      return converter.apply(Long.parseLong(defaultValue));
    }
  }

  private static String getEnvOrDefault(final Map<String, String> env, final String name, final String defaultValue) {
    final var value = env.get(name);
    return value != null && !value.isEmpty() ? value : defaultValue;
  }
}

package org.kbridge.config;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Timing and default client settings of a Kafka source.
 *
 * <p>Null arguments fall back to the {@code DEFAULT_*} values.
 *
 * <pre>{@code
 * SourceSettings settings = new SourceSettings(
 *     Duration.ofSeconds(10),   // session timeout
 *     Duration.ofSeconds(5),    // metadata timeout
 *     Duration.ofSeconds(3),    // close grace period
 *     Duration.ofMillis(100),   // poll interval
 *     null);                    // default client settings
 * }</pre>
 *
 * @param sessionTimeout the consumer group session timeout, also written to {@code
 *     session.timeout.ms} in the default client settings
 * @param metadataTimeout how long a topic metadata lookup may take
 * @param closeGrace how long {@code close} waits for the consume loop to finish
 * @param pollInterval how often the consume loop re-checks the stop signal while idle
 * @param kafkaDefaults client settings applied before user supplied values
 */
public record SourceSettings(
  Duration sessionTimeout,
  Duration metadataTimeout,
  Duration closeGrace,
  Duration pollInterval,
  Map<String, Object> kafkaDefaults
) {
  public static final Duration DEFAULT_SESSION_TIMEOUT = Duration.ofMillis(6000);
  public static final Duration DEFAULT_CLOSE_GRACE = Duration.ofSeconds(3);
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

  public SourceSettings {
    sessionTimeout = validateDuration(sessionTimeout, DEFAULT_SESSION_TIMEOUT, "Session timeout");
    metadataTimeout = validateDuration(metadataTimeout, sessionTimeout, "Metadata timeout");
    closeGrace = validateDuration(closeGrace, DEFAULT_CLOSE_GRACE, "Close grace period");
    pollInterval = validateDuration(pollInterval, DEFAULT_POLL_INTERVAL, "Poll interval");
    kafkaDefaults = kafkaDefaults != null ? Map.copyOf(kafkaDefaults) : sourceDefaults(sessionTimeout);
  }

  /**
   * Returns settings with every value at its default.
   *
   * @return the default settings
   */
  public static SourceSettings defaults() {
    return new SourceSettings(null, null, null, null, null);
  }

  /**
   * Returns a copy of these settings with a different close grace period.
   *
   * @param closeGrace the new grace period
   * @return the updated settings
   */
  public SourceSettings withCloseGrace(final Duration closeGrace) {
    return new SourceSettings(sessionTimeout, metadataTimeout, closeGrace, pollInterval, kafkaDefaults);
  }

  private static Map<String, Object> sourceDefaults(final Duration sessionTimeout) {
    final var defaults = new HashMap<>(Role.SOURCE.defaults());
    defaults.put("session.timeout.ms", (int) sessionTimeout.toMillis());
    return Map.copyOf(defaults);
  }

  private static Duration validateDuration(final Duration duration, final Duration defaultValue, final String name) {
    final var result = duration != null ? duration : defaultValue;
    if (result.isNegative() || result.isZero()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
    return result;
  }
}

package org.kbridge.client;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import org.kbridge.config.ConfigValidationException;

/**
 * Settings read by {@link KafkaBrokerClient} itself rather than by the Kafka consumer.
 *
 * @param eventQueueSize how many native events may be buffered ahead of the consume loop
 * @param rebalanceEnabled whether rebalances are reported and assigned partitions wait for {@link
 *     BrokerClient#assign}
 * @param partitionEofEnabled whether reaching the end of a partition is reported
 * @param autoCommitEnabled whether consumed offsets are committed periodically
 * @param autoCommitInterval the period between commits
 * @param pollTimeout how long a single poll waits for records
 * @param closeTimeout how long {@link KafkaBrokerClient#close()} waits for the poll thread
 */
public record ClientOptions(
  int eventQueueSize,
  boolean rebalanceEnabled,
  boolean partitionEofEnabled,
  boolean autoCommitEnabled,
  Duration autoCommitInterval,
  Duration pollTimeout,
  Duration closeTimeout
) {
  public static final String EVENTS_CHANNEL_ENABLE = "events.channel.enable";
  public static final String EVENTS_CHANNEL_SIZE = "events.channel.size";
  public static final String REBALANCE_ENABLE = "application.rebalance.enable";
  public static final String PARTITION_EOF_ENABLE = "enable.partition.eof";
  public static final String AUTO_COMMIT_ENABLE = "enable.auto.commit";
  public static final String AUTO_COMMIT_INTERVAL = "auto.commit.interval.ms";

  /** Keys removed from the configuration before it reaches the Kafka consumer. */
  public static final Set<String> ADAPTER_KEYS = Set.of(
    EVENTS_CHANNEL_ENABLE,
    EVENTS_CHANNEL_SIZE,
    REBALANCE_ENABLE,
    PARTITION_EOF_ENABLE,
    AUTO_COMMIT_ENABLE
  );

  public static final int DEFAULT_EVENT_QUEUE_SIZE = 100;
  public static final Duration DEFAULT_AUTO_COMMIT_INTERVAL = Duration.ofMillis(5000);
  public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(100);
  public static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(10);

  public ClientOptions {
    if (eventQueueSize <= 0) {
      throw new IllegalArgumentException("Event queue size must be positive");
    }
    autoCommitInterval = autoCommitInterval != null ? autoCommitInterval : DEFAULT_AUTO_COMMIT_INTERVAL;
    pollTimeout = pollTimeout != null ? pollTimeout : DEFAULT_POLL_TIMEOUT;
    closeTimeout = closeTimeout != null ? closeTimeout : DEFAULT_CLOSE_TIMEOUT;
  }

  /**
   * Reads the options from a client configuration. Absent keys take the Kafka defaults: no
   * rebalance reporting, no end-of-partition reporting, auto-commit every five seconds.
   *
   * @param config the client configuration
   * @return the options
   * @throws ConfigValidationException if a value cannot be parsed
   */
  public static ClientOptions from(final Map<String, Object> config) {
    return new ClientOptions(
      intValue(config, EVENTS_CHANNEL_SIZE, DEFAULT_EVENT_QUEUE_SIZE),
      booleanValue(config, REBALANCE_ENABLE, false),
      booleanValue(config, PARTITION_EOF_ENABLE, false),
      booleanValue(config, AUTO_COMMIT_ENABLE, true),
      Duration.ofMillis(intValue(config, AUTO_COMMIT_INTERVAL, (int) DEFAULT_AUTO_COMMIT_INTERVAL.toMillis())),
      DEFAULT_POLL_TIMEOUT,
      DEFAULT_CLOSE_TIMEOUT
    );
  }

  private static boolean booleanValue(final Map<String, Object> config, final String key, final boolean defaultValue) {
    final var value = config.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Boolean b) {
      return b;
    }
    final var text = String.valueOf(value).trim();
    if (!text.equalsIgnoreCase("true") && !text.equalsIgnoreCase("false")) {
      throw new ConfigValidationException("%s must be true or false, got '%s'".formatted(key, text));
    }
    return Boolean.parseBoolean(text);
  }

  private static int intValue(final Map<String, Object> config, final String key, final int defaultValue) {
    final var value = config.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number n) {
      return n.intValue();
    }
    try {
      return Integer.parseInt(String.valueOf(value).trim());
    } catch (final NumberFormatException e) {
      throw new ConfigValidationException("%s must be an integer, got '%s'".formatted(key, value), e);
    }
  }
}

package org.kbridge.config;

import java.util.List;
import java.util.Map;

/**
 * The side of the broker a configuration is built for. Each role has its own required keys and
 * default client settings.
 */
public enum Role {
  /** Consumer side. Needs brokers, topics and a consumer group. */
  SOURCE(
    "Source",
    List.of(ConfigKeys.KAFKA_BROKERS, ConfigKeys.KAFKA_TOPICS, ConfigKeys.KAFKA_CONSUMER_GROUP),
    Map.of(
      "session.timeout.ms",
      (int) SourceSettings.DEFAULT_SESSION_TIMEOUT.toMillis(),
      "events.channel.enable",
      true,
      "events.channel.size",
      100,
      "application.rebalance.enable",
      true,
      "auto.offset.reset",
      "earliest",
      "queued.max.messages.kbytes",
      16384
    )
  ),

  /** Producer side. Needs brokers only. */
  SINK("Sink", List.of(ConfigKeys.KAFKA_BROKERS), Map.of("queued.max.messages.kbytes", 16384));

  private final String displayName;
  private final List<String> requiredKeys;
  private final Map<String, Object> defaults;

  Role(final String displayName, final List<String> requiredKeys, final Map<String, Object> defaults) {
    this.displayName = displayName;
    this.requiredKeys = requiredKeys;
    this.defaults = defaults;
  }

  public String displayName() {
    return displayName;
  }

  /**
   * Returns the keys that must be set for this role.
   *
   * @return the required configuration keys
   */
  public List<String> requiredKeys() {
    return requiredKeys;
  }

  /**
   * Returns the client settings applied before any user supplied value.
   *
   * @return an unmodifiable map of default settings
   */
  public Map<String, Object> defaults() {
    return defaults;
  }
}

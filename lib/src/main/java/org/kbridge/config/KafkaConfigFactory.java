package org.kbridge.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Builds Kafka client configuration from a {@link ConfigSource}.
 *
 * <p>Settings are layered, later layers winning:
 *
 * <ol>
 *   <li>the role defaults
 *   <li>the file named by {@link ConfigKeys#KAFKA_CONFIG_FILE}
 *   <li>the free-form pairs in {@link ConfigKeys#KAFKA_CONFIG}
 *   <li>the named fields: {@code bootstrap.servers}, {@code group.id} for sources and {@code
 *       compression.type} for sinks
 *   <li>an optional customizer
 * </ol>
 *
 * <p>Usage examples:
 *
 * <pre>{@code
 * // Source configuration
 * Map<String, Object> props = KafkaConfigFactory.sourceConfig(new MapConfigSource(Map.of(
 *     ConfigKeys.KAFKA_BROKERS, "localhost:9092",
 *     ConfigKeys.KAFKA_TOPICS, "orders",
 *     ConfigKeys.KAFKA_CONSUMER_GROUP, "billing",
 *     ConfigKeys.KAFKA_CONFIG, "fetch.min.bytes=1024")));
 *
 * // Sink configuration with a customizer
 * Map<String, Object> sinkProps = KafkaConfigFactory.buildConfig(
 *     config,
 *     Role.SINK,
 *     Role.SINK.defaults(),
 *     KafkaConfigFactory.withProperty("acks", "all"));
 * }</pre>
 */
public final class KafkaConfigFactory {

  public static final String BOOTSTRAP_SERVERS = "bootstrap.servers";
  public static final String GROUP_ID = "group.id";
  public static final String COMPRESSION_TYPE = "compression.type";

  private KafkaConfigFactory() {}

  /**
   * Builds a consumer configuration with the {@link Role#SOURCE} defaults.
   *
   * @param config the configuration source
   * @return an unmodifiable client configuration
   * @throws ConfigValidationException if the configuration is incomplete or invalid
   */
  public static Map<String, Object> sourceConfig(final ConfigSource config) {
    return buildConfig(config, Role.SOURCE);
  }

  /**
   * Builds a producer configuration with the {@link Role#SINK} defaults.
   *
   * @param config the configuration source
   * @return an unmodifiable client configuration
   * @throws ConfigValidationException if the configuration is incomplete or invalid
   */
  public static Map<String, Object> sinkConfig(final ConfigSource config) {
    return buildConfig(config, Role.SINK);
  }

  /**
   * Builds a client configuration with the defaults of the role.
   *
   * @param config the configuration source
   * @param role the role to build for
   * @return an unmodifiable client configuration
   * @throws ConfigValidationException if the configuration is incomplete or invalid
   */
  public static Map<String, Object> buildConfig(final ConfigSource config, final Role role) {
    return buildConfig(config, role, role.defaults(), null);
  }

  /**
   * Builds a client configuration.
   *
   * @param config the configuration source
   * @param role the role to build for, selecting the required keys and named fields
   * @param defaults the settings to start from
   * @param customizer applied to the merged settings last, may be null
   * @return an unmodifiable client configuration
   * @throws MissingRequiredFieldException if a required key is missing
   * @throws ConfigFileException if the override file cannot be used
   * @throws ConfigValidationException if the free-form settings are malformed
   */
  public static Map<String, Object> buildConfig(
    final ConfigSource config,
    final Role role,
    final Map<String, Object> defaults,
    final UnaryOperator<Map<String, Object>> customizer
  ) {
    final var missing = role
      .requiredKeys()
      .stream()
      .filter(key -> !config.isSet(key) || config.getStringList(key).isEmpty())
      .toList();
    if (!missing.isEmpty()) {
      throw new MissingRequiredFieldException(role, missing);
    }

    final var props = new HashMap<String, Object>(defaults);

    if (config.isSet(ConfigKeys.KAFKA_CONFIG_FILE)) {
      props.putAll(ConfigFileLoader.load(configFilePath(config.getString(ConfigKeys.KAFKA_CONFIG_FILE))));
    }

    if (config.isSet(ConfigKeys.KAFKA_CONFIG)) {
      props.putAll(config.getStringMap(ConfigKeys.KAFKA_CONFIG));
    }

    props.put(BOOTSTRAP_SERVERS, String.join(",", config.getStringList(ConfigKeys.KAFKA_BROKERS)));
    switch (role) {
      case SOURCE -> props.put(GROUP_ID, config.getString(ConfigKeys.KAFKA_CONSUMER_GROUP));
      case SINK -> {
        if (config.isSet(ConfigKeys.KAFKA_COMPRESSION)) {
          props.put(COMPRESSION_TYPE, config.getString(ConfigKeys.KAFKA_COMPRESSION));
        }
      }
    }

    return Map.copyOf(customizer != null ? customizer.apply(props) : props);
  }

  private static Path configFilePath(final String location) {
    try {
      return Path.of(location);
    } catch (final InvalidPathException e) {
      throw new ConfigValidationException("invalid %s '%s'".formatted(ConfigKeys.KAFKA_CONFIG_FILE, location), e);
    }
  }

  /**
   * Creates a customizer that sets a single setting.
   *
   * @param key the setting name
   * @param value the setting value
   * @return a function that adds the setting to a configuration
   */
  public static UnaryOperator<Map<String, Object>> withProperty(final String key, final Object value) {
    return props -> {
      final var newProps = new HashMap<>(props);
      newProps.put(key, value);
      return newProps;
    };
  }
}

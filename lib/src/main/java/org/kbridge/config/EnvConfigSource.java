package org.kbridge.config;

import java.util.Locale;
import java.util.Map;

/**
 * {@link ConfigSource} reading environment variables. A key is looked up under its upper-case form,
 * so {@code kafka_brokers} reads {@code KAFKA_BROKERS}.
 *
 * <pre>{@code
 * // KAFKA_BROKERS=broker-1:9092,broker-2:9092 KAFKA_TOPICS=orders KAFKA_CONSUMER_GROUP=billing
 * Source source = KafkaSource.start(new EnvConfigSource());
 * }</pre>
 */
public class EnvConfigSource extends AbstractConfigSource {

  private final Map<String, String> env;

  /** Creates a source over the process environment. */
  public EnvConfigSource() {
    this(System.getenv());
  }

  /**
   * Creates a source over the given variables.
   *
   * @param env the environment variables
   */
  public EnvConfigSource(final Map<String, String> env) {
    this.env = Map.copyOf(env);
  }

  @Override
  protected Object lookup(final String key) {
    return env.get(key.toUpperCase(Locale.ROOT));
  }
}

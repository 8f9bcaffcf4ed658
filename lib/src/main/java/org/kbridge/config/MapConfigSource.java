package org.kbridge.config;

import java.util.HashMap;
import java.util.Map;

/**
 * {@link ConfigSource} backed by an in-memory map. Values may be strings, collections or maps.
 *
 * <pre>{@code
 * ConfigSource config = new MapConfigSource(Map.of(
 *     ConfigKeys.KAFKA_BROKERS, "localhost:9092",
 *     ConfigKeys.KAFKA_TOPICS, List.of("orders", "payments"),
 *     ConfigKeys.KAFKA_CONSUMER_GROUP, "billing"));
 * }</pre>
 */
public class MapConfigSource extends AbstractConfigSource {

  private final Map<String, Object> values;

  public MapConfigSource(final Map<String, ?> values) {
    this.values = new HashMap<>(values);
  }

  @Override
  protected Object lookup(final String key) {
    return values.get(key);
  }
}

package org.kbridge.config;

/** Keys understood by the source and sink configuration builders. */
public final class ConfigKeys {

  private ConfigKeys() {}

  /** Broker addresses, as a list or a comma separated string. */
  public static final String KAFKA_BROKERS = "kafka_brokers";

  /** Topics to subscribe to. Source only. */
  public static final String KAFKA_TOPICS = "kafka_topics";

  /** Consumer group identifier. Source only. */
  public static final String KAFKA_CONSUMER_GROUP = "kafka_consumer_group";

  /** Producer compression codec. Sink only. */
  public static final String KAFKA_COMPRESSION = "kafka_compression";

  /** Free-form client settings, e.g. {@code "linger.ms=1000 fetch.min.bytes=1"}. */
  public static final String KAFKA_CONFIG = "kafka_config";

  /** Path to a {@code .properties} or {@code .json} file with client settings. */
  public static final String KAFKA_CONFIG_FILE = "kafka_config_file";
}

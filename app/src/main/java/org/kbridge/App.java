package org.kbridge;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import org.kbridge.config.AppConfig;
import org.kbridge.config.ConfigSource;
import org.kbridge.config.EnvConfigSource;
import org.kbridge.handler.LoggingMessageHandler;
import org.kbridge.messaging.Msg;
import org.kbridge.metrics.SourceMetricsReporter;
import org.kbridge.runner.SourceRunner;
import org.kbridge.sink.KafkaSink;
import org.kbridge.source.KafkaSource;

/**
 * Application that consumes messages from Kafka topics and either logs them or forwards them to
 * another topic.
 *
 * <p>Kafka settings come from the environment ({@code KAFKA_BROKERS}, {@code KAFKA_TOPICS}, {@code
 * KAFKA_CONSUMER_GROUP}, {@code KAFKA_CONFIG}, ...), application settings from {@link AppConfig}.
 */
public class App implements AutoCloseable {

  private static final Logger LOGGER = System.getLogger(App.class.getName());

  private final KafkaSink sink;
  private final SourceRunner runner;

  /**
   * Main entry point for the kbridge application.
   *
   * @param args Command line arguments
   */
  public static void main(final String[] args) {
    final var config = AppConfig.fromEnv();

    try (final App app = new App(config, new EnvConfigSource())) {
      app.start();
      final var normalShutdown = app.awaitShutdown();
      if (!normalShutdown) {
        LOGGER.log(Level.WARNING, "Application didn't shut down cleanly");
      }
    } catch (final Exception e) {
      LOGGER.log(Level.ERROR, "Fatal error in kbridge application", e);
      System.exit(1);
    }
  }

  /**
   * Creates the application: the sink, if a sink topic is configured, then the source.
   *
   * @param config the application configuration
   * @param kafkaConfig the Kafka settings
   */
  public App(final AppConfig config, final ConfigSource kafkaConfig) {
    this.sink = config.hasSinkTopic() ? KafkaSink.create(kafkaConfig) : null;

    final KafkaSource source;
    try {
      source = KafkaSource.start(kafkaConfig);
    } catch (final RuntimeException e) {
      if (sink != null) {
        sink.close();
      }
      throw e;
    }

    final var startTime = System.currentTimeMillis();
    final var metricsReporter = new SourceMetricsReporter(
      this::runnerMetrics,
      () -> System.currentTimeMillis() - startTime,
      null
    );

    this.runner =
      SourceRunner
        .builder(source)
        .withProcessor(sink != null ? forwardTo(sink, config.sinkTopic()) : new LoggingMessageHandler())
        .withMetricsReporters(List.of(metricsReporter))
        .withMetricsInterval(config.metricsInterval().toMillis())
        .withShutdownTimeout(config.shutdownTimeout().toMillis())
        .withShutdownHook(true)
        .build();
    LOGGER.log(Level.INFO, "{0} consuming {1}", config.appName(), source.getTopics());
  }

  /**
   * Creates a processor forwarding each message to a topic. A message is accepted only once the
   * broker confirmed the forwarded record; a failed delivery throws, so the runner fails the
   * message.
   *
   * @param sink the sink to send to
   * @param topic the destination topic
   * @return a processor accepting every message the sink delivered
   */
  static Predicate<Msg> forwardTo(final KafkaSink sink, final String topic) {
    return msg -> {
      sink.sendAndWait(msg, topic);
      return true;
    };
  }

  private Map<String, Long> runnerMetrics() {
    return runner.getMetrics();
  }

  private void start() {
    runner.start();
  }

  private boolean awaitShutdown() {
    return runner.awaitShutdown();
  }

  @Override
  public void close() {
    try {
      runner.close();
    } finally {
      if (sink != null) {
        sink.close();
      }
    }
  }
}

package org.kbridge.source;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;
import org.kbridge.channel.BlockingChannel;
import org.kbridge.channel.ReceiveChannel;
import org.kbridge.client.BrokerClient;
import org.kbridge.client.KafkaBrokerClient;
import org.kbridge.client.TopicMetadata;
import org.kbridge.config.ConfigKeys;
import org.kbridge.config.ConfigSource;
import org.kbridge.config.KafkaConfigFactory;
import org.kbridge.config.Role;
import org.kbridge.config.SourceSettings;
import org.kbridge.messaging.ConnectivityException;
import org.kbridge.messaging.Event;
import org.kbridge.messaging.Msg;
import org.kbridge.messaging.Source;
import org.kbridge.messaging.StopNotCalledException;
import org.kbridge.messaging.TopicUnavailableException;
import org.kbridge.messaging.UnAckedTracker;
import org.kbridge.messaging.UnackedMessagesRemainException;
import org.kbridge.source.enums.SourceState;

/**
 * A {@link Source} reading from Kafka topics as a member of a consumer group.
 *
 * <p>Starting a source builds the client configuration, verifies that every topic is reachable and
 * has partitions, subscribes and spawns the consume loop ({@link EventMultiplexer}). A source that
 * fails any of these steps releases its broker client and is never returned.
 *
 * <p>Messages and events are handed over on unbuffered channels: the consume loop waits until the
 * application takes each item. Each delivery gets a fresh identifier, so redelivery of an offset
 * after a rebalance or restart is a new message.
 *
 * <p>{@link #fail(Msg)} does not trigger redelivery: it settles the message exactly like {@link
 * #ack(Msg)}. Offsets are committed periodically by the broker client regardless of settlement.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * final var source = KafkaSource.builder()
 *     .withConfig(new EnvConfigSource())
 *     .withSettings(SourceSettings.defaults().withCloseGrace(Duration.ofSeconds(5)))
 *     .start();
 *
 * final var msg = source.receive().receive();
 * process(msg);
 * source.ack(msg);
 *
 * source.stop();
 * source.close();
 * }</pre>
 */
public class KafkaSource implements Source {

  private static final Logger LOGGER = System.getLogger(KafkaSource.class.getName());

  private final BrokerClient client;
  private final List<String> topics;
  private final SourceSettings settings;
  private final Supplier<String> idGenerator;
  private final UnAckedTracker tracker = new UnAckedTracker();
  private final BlockingChannel<Msg> messages = BlockingChannel.unbuffered();
  private final BlockingChannel<Event> events = BlockingChannel.unbuffered();
  private final CountDownLatch quit = new CountDownLatch(1);
  private final CountDownLatch done = new CountDownLatch(1);
  private final AtomicReference<SourceState> state = new AtomicReference<>(SourceState.CREATED);
  private final AtomicReference<Thread> loopThread = new AtomicReference<>();

  /**
   * Starts a source with default settings.
   *
   * @param config the configuration source
   * @return a running source
   * @throws org.kbridge.config.ConfigValidationException if the configuration is invalid
   * @throws ConnectivityException if the topics cannot be reached or subscribed to
   */
  public static KafkaSource start(final ConfigSource config) {
    return builder().withConfig(config).start();
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link KafkaSource}. */
  public static class Builder {

    private ConfigSource config;
    private SourceSettings settings = SourceSettings.defaults();
    private Function<Map<String, Object>, BrokerClient> clientFactory = KafkaBrokerClient::create;
    private Supplier<String> idGenerator = () -> UUID.randomUUID().toString();

    private Builder() {}

    /**
     * Sets the configuration source.
     *
     * @param config the configuration source
     * @return this builder
     */
    public Builder withConfig(final ConfigSource config) {
      this.config = Objects.requireNonNull(config, "Configuration source cannot be null");
      return this;
    }

    /**
     * Sets the timing and default client settings.
     *
     * @param settings the source settings
     * @return this builder
     */
    public Builder withSettings(final SourceSettings settings) {
      this.settings = Objects.requireNonNull(settings, "Settings cannot be null");
      return this;
    }

    /**
     * Sets the factory creating the broker client from the built client configuration.
     *
     * @param clientFactory the client factory
     * @return this builder
     */
    public Builder withClientFactory(final Function<Map<String, Object>, BrokerClient> clientFactory) {
      this.clientFactory = Objects.requireNonNull(clientFactory, "Client factory cannot be null");
      return this;
    }

    /**
     * Sets the generator of message identifiers. Identifiers must be unique per delivery.
     *
     * @param idGenerator the identifier generator
     * @return this builder
     */
    public Builder withIdGenerator(final Supplier<String> idGenerator) {
      this.idGenerator = Objects.requireNonNull(idGenerator, "Id generator cannot be null");
      return this;
    }

    /**
     * Builds the source and starts consuming.
     *
     * @return a running source
     * @throws NullPointerException if no configuration source was set
     * @throws org.kbridge.config.ConfigValidationException if the configuration is invalid
     * @throws ConnectivityException if the topics cannot be reached or subscribed to
     */
    public KafkaSource start() {
      Objects.requireNonNull(config, "Configuration source must be set");
      final var kafkaConfig = KafkaConfigFactory.buildConfig(config, Role.SOURCE, settings.kafkaDefaults(), null);
      final var topics = config.getStringList(ConfigKeys.KAFKA_TOPICS);
      final var client = Objects.requireNonNull(clientFactory.apply(kafkaConfig), "Client factory returned null");
      final var source = new KafkaSource(client, topics, settings, idGenerator);
      source.open();
      return source;
    }
  }

  private KafkaSource(
    final BrokerClient client,
    final List<String> topics,
    final SourceSettings settings,
    final Supplier<String> idGenerator
  ) {
    this.client = client;
    this.topics = List.copyOf(topics);
    this.settings = settings;
    this.idGenerator = idGenerator;
  }

  private void open() {
    try {
      ping();
    } catch (final TopicUnavailableException e) {
      releaseAfterFailure(e);
      throw new ConnectivityException("unable to retrieve kafka metadata", e);
    }

    try {
      client.subscribe(topics);
    } catch (final RuntimeException e) {
      releaseAfterFailure(e);
      throw new ConnectivityException("unable to subscribe to topics %s".formatted(topics), e);
    }

    final var multiplexer = new EventMultiplexer(
      client,
      tracker,
      messages,
      events,
      quit,
      done,
      state,
      idGenerator,
      settings.pollInterval()
    );
    final var thread = new Thread(multiplexer, "kbridge-source-%s".formatted(UUID.randomUUID().toString().substring(0, 8)));
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler((t, throwable) ->
      LOGGER.log(Level.ERROR, "Uncaught exception in consume loop: " + t.getName(), throwable)
    );
    loopThread.set(thread);
    state.set(SourceState.RUNNING);
    thread.start();
    LOGGER.log(Level.INFO, "Source started for topics {0}", topics);
  }

  private void releaseAfterFailure(final RuntimeException failure) {
    try {
      client.close();
    } catch (final RuntimeException e) {
      failure.addSuppressed(e);
    }
    state.set(SourceState.CLOSED);
  }

  @Override
  public ReceiveChannel<Msg> receive() {
    return messages;
  }

  @Override
  public ReceiveChannel<Event> events() {
    return events;
  }

  @Override
  public void ack(final Msg msg) {
    tracker.remove(msg);
  }

  @Override
  public void fail(final Msg msg) {
    tracker.remove(msg);
    LOGGER.log(Level.DEBUG, "Message {0} failed, it will not be redelivered", msg.id());
  }

  @Override
  public List<Msg> unAcked() {
    return tracker.list();
  }

  /**
   * Stops the consume loop. The loop exits after delivering the item it is currently pushing, if
   * any. Calling it again has no effect.
   */
  @Override
  public void stop() {
    if (quit.getCount() == 0) {
      LOGGER.log(Level.DEBUG, "Stop already requested");
      return;
    }
    state.compareAndSet(SourceState.RUNNING, SourceState.STOPPING);
    quit.countDown();
    LOGGER.log(Level.INFO, "Source stop requested");
  }

  /**
   * Closes the source.
   *
   * <p>Waits up to the close grace period for the consume loop to exit. A source with unsettled
   * messages stays open, so close can be retried once they are settled.
   *
   * @throws StopNotCalledException if the consume loop is still running
   * @throws UnackedMessagesRemainException if delivered messages are unsettled
   * @throws IllegalStateException if the source is already closed
   * @throws org.apache.kafka.common.KafkaException if the broker client fails to close
   */
  @Override
  public void close() {
    if (state.get() == SourceState.CLOSED) {
      throw new IllegalStateException("Source is already closed");
    }

    try {
      if (!done.await(settings.closeGrace().toMillis(), TimeUnit.MILLISECONDS)) {
        throw new StopNotCalledException("kafka source: need to call stop() before close()");
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StopNotCalledException("kafka source: interrupted while waiting for the consume loop");
    }

    final var remaining = tracker.count();
    if (remaining > 0) {
      throw new UnackedMessagesRemainException(remaining);
    }

    if (state.getAndSet(SourceState.CLOSED) == SourceState.CLOSED) {
      throw new IllegalStateException("Source is already closed");
    }
    messages.close();
    events.close();
    client.close();
    LOGGER.log(Level.INFO, "Source closed");
  }

  /**
   * Checks every configured topic against the broker.
   *
   * @throws TopicUnavailableException if the metadata of a topic cannot be retrieved, reports an
   *     error or lists no partitions
   */
  @Override
  public void ping() {
    for (final var topic : topics) {
      final TopicMetadata metadata;
      try {
        metadata = client.getMetadata(topic, settings.metadataTimeout());
      } catch (final RuntimeException e) {
        throw new TopicUnavailableException(topic, "unable to retrieve metadata for topic %s".formatted(topic), e);
      }

      if (metadata.hasError()) {
        throw new TopicUnavailableException(
          topic,
          "topic %s has error: %s".formatted(topic, metadata.error().getMessage()),
          metadata.error()
        );
      }
      if (metadata.partitions().isEmpty()) {
        throw new TopicUnavailableException(topic, "configured topic %s has no partitions".formatted(topic));
      }
    }
  }

  /**
   * Returns the lifecycle state of this source.
   *
   * @return the current state
   */
  public SourceState getState() {
    return state.get();
  }

  /**
   * Returns the topics this source consumes.
   *
   * @return the topic names
   */
  public List<String> getTopics() {
    return topics;
  }
}

package org.kbridge.sink;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.kbridge.channel.BlockingChannel;
import org.kbridge.channel.ChannelClosedException;
import org.kbridge.channel.ReceiveChannel;
import org.kbridge.config.ConfigSource;
import org.kbridge.config.KafkaConfigFactory;
import org.kbridge.messaging.Event;
import org.kbridge.messaging.Eventer;
import org.kbridge.messaging.Msg;
import org.kbridge.messaging.Sink;

/**
 * A {@link Sink} producing messages to Kafka topics.
 *
 * <p>Sends are asynchronous. Delivery failures are logged and reported as {@link
 * Event.BrokerError} on {@link #events()}; the event buffer is bounded and failures arriving while
 * it is full are only logged. {@link #sendAndWait(Msg, String)} blocks until the broker confirms
 * the record and throws on failure instead.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * final var sink = KafkaSink.create(new EnvConfigSource());
 * sink.send(msg, "orders-enriched");
 * // Later when finished
 * sink.close();
 * }</pre>
 */
public class KafkaSink implements Sink, Eventer {

  private static final Logger LOGGER = System.getLogger(KafkaSink.class.getName());

  public static final int DEFAULT_EVENT_BUFFER_SIZE = 100;
  public static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(5);
  public static final Duration DEFAULT_DELIVERY_TIMEOUT = Duration.ofSeconds(30);

  private final Producer<byte[], byte[]> producer;
  private final BlockingChannel<Event> events;
  private final Duration closeTimeout;
  private final Duration deliveryTimeout;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * Creates a sink with default settings.
   *
   * @param config the configuration source
   * @return a new sink
   * @throws org.kbridge.config.ConfigValidationException if the configuration is invalid
   */
  public static KafkaSink create(final ConfigSource config) {
    return builder().withConfig(config).build();
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link KafkaSink}. */
  public static class Builder {

    private ConfigSource config;
    private Function<Map<String, Object>, Producer<byte[], byte[]>> producerFactory = props ->
      new KafkaProducer<>(props, new ByteArraySerializer(), new ByteArraySerializer());
    private int eventBufferSize = DEFAULT_EVENT_BUFFER_SIZE;
    private Duration closeTimeout = DEFAULT_CLOSE_TIMEOUT;
    private Duration deliveryTimeout = DEFAULT_DELIVERY_TIMEOUT;

    private Builder() {}

    public Builder withConfig(final ConfigSource config) {
      this.config = Objects.requireNonNull(config, "Configuration source cannot be null");
      return this;
    }

    /**
     * Sets the factory creating the producer from the built client configuration.
     *
     * @param producerFactory the producer factory
     * @return this builder
     */
    public Builder withProducerFactory(final Function<Map<String, Object>, Producer<byte[], byte[]>> producerFactory) {
      this.producerFactory = Objects.requireNonNull(producerFactory, "Producer factory cannot be null");
      return this;
    }

    public Builder withEventBufferSize(final int eventBufferSize) {
      this.eventBufferSize = eventBufferSize;
      return this;
    }

    public Builder withCloseTimeout(final Duration closeTimeout) {
      this.closeTimeout = Objects.requireNonNull(closeTimeout, "Close timeout cannot be null");
      return this;
    }

    /**
     * Sets how long {@link KafkaSink#sendAndWait(Msg, String)} waits for the broker to confirm a
     * record.
     *
     * @param deliveryTimeout the confirmation timeout
     * @return this builder
     */
    public Builder withDeliveryTimeout(final Duration deliveryTimeout) {
      this.deliveryTimeout = Objects.requireNonNull(deliveryTimeout, "Delivery timeout cannot be null");
      return this;
    }

    /**
     * Builds the sink.
     *
     * @return a new sink
     * @throws NullPointerException if no configuration source was set
     * @throws org.kbridge.config.ConfigValidationException if the configuration is invalid
     */
    public KafkaSink build() {
      Objects.requireNonNull(config, "Configuration source must be set");
      final var producer = producerFactory.apply(KafkaConfigFactory.sinkConfig(config));
      return new KafkaSink(producer, eventBufferSize, closeTimeout, deliveryTimeout);
    }
  }

  private KafkaSink(
    final Producer<byte[], byte[]> producer,
    final int eventBufferSize,
    final Duration closeTimeout,
    final Duration deliveryTimeout
  ) {
    this.producer = Objects.requireNonNull(producer, "Producer cannot be null");
    this.events = BlockingChannel.buffered(eventBufferSize);
    this.closeTimeout = closeTimeout;
    this.deliveryTimeout = deliveryTimeout;
  }

  /**
   * Sends the payload of a message, keeping its timestamp.
   *
   * @param msg the message to send
   * @param topic the destination topic
   * @throws IllegalStateException if the sink is closed
   * @throws KafkaException if the producer rejects the record
   */
  @Override
  public void send(final Msg msg, final String topic) {
    producer.send(
      toRecord(msg, topic),
      (metadata, exception) -> {
        if (exception != null) {
          onDeliveryFailure(msg, topic, exception);
        }
      }
    );
  }

  /**
   * Sends the payload of a message and waits until the broker confirms it. Delivery failures are
   * thrown, not reported on {@link #events()}.
   *
   * @param msg the message to send
   * @param topic the destination topic
   * @throws IllegalStateException if the sink is closed
   * @throws KafkaException if the record is rejected or its delivery fails
   * @throws TimeoutException if delivery is not confirmed within the delivery timeout
   * @throws InterruptException if interrupted while waiting
   */
  public void sendAndWait(final Msg msg, final String topic) {
    final var future = producer.send(toRecord(msg, topic));
    try {
      future.get(deliveryTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final ExecutionException e) {
      final var cause = e.getCause();
      LOGGER.log(Level.WARNING, "Failed to deliver message %s to %s".formatted(msg.id(), topic), cause);
      throw cause instanceof KafkaException kafkaException
        ? kafkaException
        : new KafkaException("Failed to deliver message %s to %s".formatted(msg.id(), topic), cause);
    } catch (final java.util.concurrent.TimeoutException e) {
      throw new TimeoutException(
        "Delivery of message %s to %s not confirmed within %s".formatted(msg.id(), topic, deliveryTimeout)
      );
    } catch (final InterruptedException e) {
      throw new InterruptException(e);
    }
  }

  private ProducerRecord<byte[], byte[]> toRecord(final Msg msg, final String topic) {
    Objects.requireNonNull(msg, "Message cannot be null");
    Objects.requireNonNull(topic, "Topic cannot be null");
    if (closed.get()) {
      throw new IllegalStateException("Sink is closed");
    }
    return new ProducerRecord<>(topic, null, Math.max(0L, msg.timestamp().toEpochMilli()), null, msg.data());
  }

  @Override
  public ReceiveChannel<Event> events() {
    return events;
  }

  /**
   * Flushes pending sends and closes the producer.
   *
   * @throws IllegalStateException if the sink is already closed
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      throw new IllegalStateException("Sink is already closed");
    }
    try {
      producer.flush();
    } finally {
      producer.close(closeTimeout);
      events.close();
      LOGGER.log(Level.INFO, "Sink closed");
    }
  }

  private void onDeliveryFailure(final Msg msg, final String topic, final Exception exception) {
    LOGGER.log(Level.WARNING, "Failed to deliver message %s to %s".formatted(msg.id(), topic), exception);
    try {
      if (!events.trySend(new Event.BrokerError(exception))) {
        LOGGER.log(Level.WARNING, "Event buffer full, dropping delivery failure of message {0}", msg.id());
      }
    } catch (final ChannelClosedException e) {
      LOGGER.log(Level.DEBUG, "Sink closed, dropping delivery failure of message {0}", msg.id());
    }
  }
}

package org.kbridge.client;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.ApiException;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.kbridge.channel.BlockingChannel;
import org.kbridge.channel.ChannelClosedException;
import org.kbridge.channel.ReceiveChannel;
import org.kbridge.client.enums.ClientState;

/**
 * {@link BrokerClient} backed by a Kafka consumer.
 *
 * <p>A dedicated poll thread owns the consumer. It executes queued {@link ClientCommand}s, commits
 * consumed offsets periodically, polls records and publishes everything it observes, in order, to
 * a bounded event channel. When the channel is full the poll thread blocks, which stops fetching
 * until the consume loop catches up.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * final var client = KafkaBrokerClient.create(KafkaConfigFactory.sourceConfig(config));
 * client.subscribe(List.of("orders"));
 * final var event = client.events().receive();
 * // Later when finished
 * client.close();
 * }</pre>
 */
public class KafkaBrokerClient implements BrokerClient {

  private static final Logger LOGGER = System.getLogger(KafkaBrokerClient.class.getName());

  private final Consumer<byte[], byte[]> consumer;
  private final ClientOptions options;
  private final BlockingChannel<NativeEvent> events;
  private final Queue<ClientCommand> commandQueue = new ConcurrentLinkedQueue<>();
  private final Set<TopicPartition> awaitingAssignment = new HashSet<>();
  private final AtomicReference<ClientState> state = new AtomicReference<>(ClientState.CREATED);
  private final AtomicReference<Thread> pollThread = new AtomicReference<>();
  private final AtomicReference<RuntimeException> closeFailure = new AtomicReference<>();
  private long lastCommitNanos = System.nanoTime();

  /**
   * Creates a client from a source configuration as produced by {@code
   * KafkaConfigFactory.sourceConfig}. Keys interpreted by the client are removed before the rest is
   * handed to the Kafka consumer, and the consumer's own auto-commit is disabled in favor of the
   * client's periodic commit.
   *
   * @param config the client configuration
   * @return a new client, not yet subscribed
   */
  public static KafkaBrokerClient create(final Map<String, Object> config) {
    Objects.requireNonNull(config, "Configuration cannot be null");
    final var options = ClientOptions.from(config);
    final var consumerConfig = new HashMap<>(config);
    ClientOptions.ADAPTER_KEYS.forEach(consumerConfig::remove);
    consumerConfig.put(ClientOptions.AUTO_COMMIT_ENABLE, false);
    return new KafkaBrokerClient(
      new KafkaConsumer<>(consumerConfig, new ByteArrayDeserializer(), new ByteArrayDeserializer()),
      options
    );
  }

  /**
   * Constructs a client around an existing consumer.
   *
   * @param consumer the consumer, owned by the client from now on
   * @param options the client options
   */
  public KafkaBrokerClient(final Consumer<byte[], byte[]> consumer, final ClientOptions options) {
    this.consumer = Objects.requireNonNull(consumer, "Consumer cannot be null");
    this.options = Objects.requireNonNull(options, "Options cannot be null");
    this.events = BlockingChannel.buffered(options.eventQueueSize());
  }

  @Override
  public void subscribe(final List<String> topics) {
    if (state.get() != ClientState.CREATED) {
      throw new IllegalStateException("Broker client already subscribed or closed");
    }

    consumer.subscribe(
      topics,
      new EventingRebalanceListener(consumer, options.rebalanceEnabled(), awaitingAssignment, this::publish)
    );

    if (!state.compareAndSet(ClientState.CREATED, ClientState.RUNNING)) {
      throw new IllegalStateException("Broker client closed during subscribe");
    }

    final var thread = new Thread(this::runPollLoop, "kbridge-poll-%s".formatted(UUID.randomUUID().toString().substring(0, 8)));
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler((t, throwable) ->
      LOGGER.log(Level.ERROR, "Uncaught exception in poll thread: " + t.getName(), throwable)
    );
    pollThread.set(thread);
    thread.start();
    LOGGER.log(Level.INFO, "Broker client subscribed to {0}", topics);
  }

  @Override
  public ReceiveChannel<NativeEvent> events() {
    return events;
  }

  @Override
  public void assign(final Collection<TopicPartition> partitions) {
    submit(ClientCommand.assign(partitions));
  }

  @Override
  public void unassign() {
    submit(ClientCommand.unassign());
  }

  @Override
  public TopicMetadata getMetadata(final String topic, final Duration timeout) {
    Objects.requireNonNull(topic, "Topic cannot be null");
    final var current = state.get();
    if (current == ClientState.CREATED) {
      return lookupMetadata(topic, timeout);
    }
    if (current != ClientState.RUNNING) {
      throw new IllegalStateException("Broker client is closed");
    }

    final var reply = new CompletableFuture<TopicMetadata>();
    submit(ClientCommand.metadata(topic, timeout, reply));
    try {
      return reply.get(timeout.plus(options.pollTimeout()).toMillis(), TimeUnit.MILLISECONDS);
    } catch (final java.util.concurrent.TimeoutException e) {
      throw new TimeoutException("Metadata lookup for topic %s timed out after %s".formatted(topic, timeout));
    } catch (final ExecutionException e) {
      if (e.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new KafkaException("Metadata lookup for topic %s failed".formatted(topic), e.getCause());
    } catch (final InterruptedException e) {
      throw new InterruptException(e);
    }
  }

  /**
   * Closes the client. The event channel is closed first so that a poll thread blocked on a full
   * channel is released, then the poll thread is woken up and awaited. Closing a client that is
   * already closed has no effect.
   *
   * @throws KafkaException if the consumer could not be closed
   */
  @Override
  public void close() {
    final var previous = state.getAndSet(ClientState.CLOSING);
    if (previous == ClientState.CLOSING || previous == ClientState.CLOSED) {
      state.set(previous);
      return;
    }

    events.close();
    final var thread = pollThread.get();
    if (thread == null) {
      closeConsumer();
    } else {
      consumer.wakeup();
      try {
        thread.join(options.closeTimeout().toMillis());
        if (thread.isAlive()) {
          LOGGER.log(Level.WARNING, "Poll thread did not terminate within {0}", options.closeTimeout());
        }
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        LOGGER.log(Level.WARNING, "Interrupted while waiting for poll thread");
      }
    }

    final var failure = closeFailure.get();
    if (failure != null) {
      throw failure;
    }
  }

  /**
   * Returns the current state of the client.
   *
   * @return the state
   */
  public ClientState getState() {
    return state.get();
  }

  private void submit(final ClientCommand command) {
    if (state.get() != ClientState.RUNNING) {
      LOGGER.log(Level.DEBUG, "Ignoring {0} command, client is not running", command.kind());
      return;
    }
    commandQueue.offer(command);
    consumer.wakeup();
  }

  private void runPollLoop() {
    try {
      while (state.get() == ClientState.RUNNING && !Thread.currentThread().isInterrupted()) {
        processCommands();
        commitIfDue();

        final var records = pollRecords();
        if (records != null && !records.isEmpty()) {
          publishRecords(records);
        }
      }
    } catch (final ChannelClosedException e) {
      LOGGER.log(Level.DEBUG, "Event channel closed, stopping poll thread");
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.log(Level.INFO, "Poll thread interrupted");
    } finally {
      commitOnClose();
      closeConsumer();
      failPendingCommands();
    }
  }

  private void processCommands() {
    ClientCommand command;
    while ((command = commandQueue.poll()) != null) {
      try {
        switch (command.kind()) {
          case ASSIGN -> {
            final var assigned = consumer.assignment();
            final var toResume = command.partitions().stream().filter(assigned::contains).collect(Collectors.toSet());
            awaitingAssignment.removeAll(command.partitions());
            consumer.resume(toResume);
            LOGGER.log(Level.INFO, "Partitions accepted: %s".formatted(toResume));
          }
          case UNASSIGN -> {
            awaitingAssignment.clear();
            LOGGER.log(Level.DEBUG, "Partitions released");
          }
          case METADATA -> {
            try {
              command.reply().complete(lookupMetadata(command.topic(), command.timeout()));
            } catch (final RuntimeException e) {
              command.reply().completeExceptionally(e);
            }
          }
        }
      } catch (final KafkaException | IllegalStateException e) {
        LOGGER.log(Level.WARNING, "Error processing client command: {0}", command.kind());
        publish(new NativeEvent.BrokerError(e));
      }
    }
  }

  private TopicMetadata lookupMetadata(final String topic, final Duration timeout) {
    try {
      return fetchMetadata(topic, timeout);
    } catch (final WakeupException e) {
      // A wakeup meant for poll() fires in the next blocking call when the poll thread was elsewhere
      LOGGER.log(Level.DEBUG, "Metadata lookup for {0} woken up, retrying", topic);
      return fetchMetadata(topic, timeout);
    }
  }

  private TopicMetadata fetchMetadata(final String topic, final Duration timeout) {
    try {
      final var partitions = Optional
        .ofNullable(consumer.partitionsFor(topic, timeout))
        .orElse(List.of())
        .stream()
        .map(PartitionInfo::partition)
        .sorted()
        .toList();
      return new TopicMetadata(topic, partitions, null);
    } catch (final TimeoutException e) {
      throw e;
    } catch (final ApiException e) {
      return new TopicMetadata(topic, List.of(), e);
    }
  }

  private void commitIfDue() {
    if (!options.autoCommitEnabled()) return;
    final var now = System.nanoTime();
    if (now - lastCommitNanos < options.autoCommitInterval().toNanos()) return;
    lastCommitNanos = now;
    try {
      consumer.commitAsync(this::onCommitComplete);
    } catch (final KafkaException e) {
      LOGGER.log(Level.WARNING, "Failed to start offset commit", e);
      publish(new NativeEvent.OffsetsCommitted(Map.of(), e));
    }
  }

  private void onCommitComplete(final Map<TopicPartition, OffsetAndMetadata> offsets, final Exception error) {
    if (error != null) {
      LOGGER.log(Level.WARNING, "Offset commit failed", error);
    }
    publish(new NativeEvent.OffsetsCommitted(offsets, error));
  }

  private ConsumerRecords<byte[], byte[]> pollRecords() throws InterruptedException {
    try {
      return consumer.poll(options.pollTimeout());
    } catch (final WakeupException e) {
      // Raised by close and by command submission
      return null;
    } catch (final InterruptException e) {
      Thread.currentThread().interrupt();
      return null;
    } catch (final KafkaException e) {
      if (state.get() == ClientState.RUNNING) {
        LOGGER.log(Level.WARNING, "Error during Kafka poll operation", e);
        events.send(new NativeEvent.BrokerError(e));
      }
      return null;
    }
  }

  private void publishRecords(final ConsumerRecords<byte[], byte[]> records) throws InterruptedException {
    for (final ConsumerRecord<byte[], byte[]> record : records) {
      events.send(
        new NativeEvent.Message(
          record.topic(),
          record.partition(),
          record.offset(),
          record.value(),
          Instant.ofEpochMilli(record.timestamp())
        )
      );
    }

    if (!options.partitionEofEnabled()) return;
    for (final TopicPartition partition : records.partitions()) {
      final var lag = consumer.currentLag(partition);
      if (lag.isPresent() && lag.getAsLong() == 0) {
        final var partitionRecords = records.records(partition);
        final var nextOffset = partitionRecords.get(partitionRecords.size() - 1).offset() + 1;
        events.send(new NativeEvent.PartitionEof(partition, nextOffset));
      }
    }
  }

  /** Publishes from consumer callbacks, which cannot propagate checked exceptions. */
  private void publish(final NativeEvent event) {
    try {
      events.send(event);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.log(Level.WARNING, "Interrupted while publishing {0}", event);
    } catch (final ChannelClosedException e) {
      LOGGER.log(Level.DEBUG, "Event channel closed, dropping {0}", event);
    }
  }

  private void commitOnClose() {
    if (!options.autoCommitEnabled()) return;
    try {
      try {
        consumer.commitSync(options.closeTimeout());
      } catch (final WakeupException e) {
        // A pending wakeup aborts the first blocking call
        consumer.commitSync(options.closeTimeout());
      }
    } catch (final Exception e) {
      LOGGER.log(Level.WARNING, "Failed to commit offsets on close", e);
    }
  }

  private void closeConsumer() {
    try {
      consumer.close();
      LOGGER.log(Level.INFO, "Broker client closed");
    } catch (final RuntimeException e) {
      LOGGER.log(Level.WARNING, "Error closing Kafka consumer", e);
      closeFailure.set(e);
    } finally {
      state.set(ClientState.CLOSED);
    }
  }

  private void failPendingCommands() {
    ClientCommand command;
    while ((command = commandQueue.poll()) != null) {
      if (command.reply() != null) {
        command.reply().completeExceptionally(new IllegalStateException("Broker client is closed"));
      }
    }
  }
}

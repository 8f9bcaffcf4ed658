package org.kbridge.source;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.kbridge.client.NativeEvent;
import org.kbridge.client.TopicMetadata;
import org.kbridge.config.ConfigKeys;
import org.kbridge.config.MapConfigSource;
import org.kbridge.config.MissingRequiredFieldException;
import org.kbridge.config.SourceSettings;
import org.kbridge.messaging.ConnectivityException;
import org.kbridge.messaging.Event;
import org.kbridge.messaging.MessageNotFoundException;
import org.kbridge.messaging.StopNotCalledException;
import org.kbridge.messaging.TopicUnavailableException;
import org.kbridge.messaging.UnackedMessagesRemainException;
import org.kbridge.source.enums.SourceState;

class KafkaSourceTest {

  private static final String TOPIC = "topic.0";
  private static final Duration WAIT = Duration.ofSeconds(5);
  private static final SourceSettings SETTINGS = new SourceSettings(
    null,
    null,
    Duration.ofMillis(300),
    Duration.ofMillis(20),
    null
  );

  private final TopicPartition partition0 = new TopicPartition(TOPIC, 0);
  private final AtomicInteger ids = new AtomicInteger();

  private FakeBrokerClient client;
  private KafkaSource source;

  @BeforeEach
  void setUp() {
    client = new FakeBrokerClient().withTopic(TOPIC, 0, 1);
  }

  @AfterEach
  void tearDown() {
    if (source != null && source.getState() != SourceState.CLOSED) {
      source.stop();
      source.unAcked().forEach(source::ack);
    }
  }

  @Test
  void shouldStartWithBuiltConfig() {
    // Arrange
    final var captured = new AtomicReference<Map<String, Object>>();

    // Act
    source =
      KafkaSource
        .builder()
        .withConfig(validConfig())
        .withSettings(SETTINGS)
        .withClientFactory(config -> {
          captured.set(config);
          return client;
        })
        .start();

    // Assert
    assertEquals(SourceState.RUNNING, source.getState());
    assertEquals(List.of(TOPIC), client.subscribedTopics);
    assertEquals("0.0.0.0:9092", captured.get().get("bootstrap.servers"));
    assertEquals("cg-123", captured.get().get("group.id"));
    assertEquals(6000, captured.get().get("session.timeout.ms"));
  }

  @Test
  void shouldTrackMessagesUntilAcked() throws Exception {
    // Arrange
    source = start();
    client.emit(message(0L, "hello"));

    // Act
    final var msg = source.receive().receive(WAIT).orElseThrow();

    // Assert
    assertArrayEquals("hello".getBytes(), msg.data());
    assertEquals(Instant.ofEpochMilli(1000), msg.timestamp());
    assertEquals(List.of(msg), source.unAcked());

    source.ack(msg);
    assertTrue(source.unAcked().isEmpty());
    assertThrows(MessageNotFoundException.class, () -> source.ack(msg));
  }

  @Test
  void shouldTreatFailAsRemovalWithoutRedelivery() throws Exception {
    // Arrange
    source = start();
    client.emit(message(0L, "hello"));
    final var msg = source.receive().receive(WAIT).orElseThrow();

    // Act
    source.fail(msg);

    // Assert
    assertTrue(source.unAcked().isEmpty());
    assertThrows(MessageNotFoundException.class, () -> source.fail(msg));
    assertThrows(MessageNotFoundException.class, () -> source.ack(msg));
    assertTrue(source.receive().receive(Duration.ofMillis(200)).isEmpty());
  }

  @Test
  void shouldDeliverMessagesInOrderWithFreshIds() throws Exception {
    // Arrange
    source = start();
    client.emit(message(0L, "first"));
    client.emit(message(1L, "second"));
    client.emit(message(1L, "second"));

    // Act
    final var first = source.receive().receive(WAIT).orElseThrow();
    final var second = source.receive().receive(WAIT).orElseThrow();
    final var redelivered = source.receive().receive(WAIT).orElseThrow();

    // Assert
    assertEquals("first", new String(first.data()));
    assertEquals("second", new String(second.data()));
    assertEquals("second", new String(redelivered.data()));
    assertEquals(3, new HashSet<>(List.of(first.id(), second.id(), redelivered.id())).size());
    assertEquals(3, source.unAcked().size());
    List.of(first, second, redelivered).forEach(source::ack);
  }

  @Test
  void shouldAssignPartitionsBeforeReportingThem() throws Exception {
    // Arrange
    source = start();

    // Act
    client.emit(new NativeEvent.AssignedPartitions(Set.of(partition0)));
    final var event = source.events().receive(WAIT).orElseThrow();

    // Assert
    assertEquals(new Event.PartitionsAssigned(Set.of(partition0)), event);
    assertEquals(1, client.assignCalls.size());
    assertEquals(Set.of(partition0), Set.copyOf(client.assignCalls.get(0)));
  }

  @Test
  void shouldUnassignBeforeReportingRevocation() throws Exception {
    // Arrange
    source = start();

    // Act
    client.emit(new NativeEvent.RevokedPartitions(Set.of(partition0)));
    final var event = source.events().receive(WAIT).orElseThrow();

    // Assert
    assertEquals(new Event.PartitionsRevoked(Set.of(partition0)), event);
    assertEquals(1, client.unassignCalls.get());
  }

  @Test
  void shouldReportAssignFailureAndKeepRunning() throws Exception {
    // Arrange
    source = start();
    client.failAssign.set(true);

    // Act
    client.emit(new NativeEvent.AssignedPartitions(Set.of(partition0)));
    final var first = source.events().receive(WAIT).orElseThrow();
    final var second = source.events().receive(WAIT).orElseThrow();

    // Assert
    final var error = assertInstanceOf(Event.BrokerError.class, first);
    assertEquals("assign failed", error.error().getMessage());
    assertEquals(new Event.PartitionsAssigned(Set.of(partition0)), second);
    assertEquals(SourceState.RUNNING, source.getState());
  }

  @Test
  void shouldReportOnlyFailedCommits() throws Exception {
    // Arrange
    source = start();
    final var failure = new KafkaException("commit failed");

    // Act
    client.emit(new NativeEvent.OffsetsCommitted(Map.of(partition0, new OffsetAndMetadata(5L)), null));
    client.emit(new NativeEvent.OffsetsCommitted(Map.of(), failure));
    final var event = source.events().receive(WAIT).orElseThrow();

    // Assert
    assertEquals(new Event.CommitError(failure), event);
  }

  @Test
  void shouldForwardBrokerErrorsAndUnrecognizedEvents() throws Exception {
    // Arrange
    source = start();
    final var failure = new KafkaException("broker down");

    // Act
    client.emit(new NativeEvent.PartitionEof(partition0, 10L));
    client.emit(new NativeEvent.BrokerError(failure));
    client.emit(new NativeEvent.Unrecognized("throttle"));
    final var first = source.events().receive(WAIT).orElseThrow();
    final var second = source.events().receive(WAIT).orElseThrow();

    // Assert
    assertEquals(new Event.BrokerError(failure), first);
    assertEquals(new Event.BrokerEvent("throttle"), second);
  }

  @Test
  void shouldRefuseToCloseBeforeStop() {
    // Arrange
    source = start();

    // Act & Assert
    assertThrows(StopNotCalledException.class, () -> source.close());
    assertFalse(client.isClosed());
    assertEquals(SourceState.RUNNING, source.getState());
  }

  @Test
  void shouldRefuseToCloseWhileLoopIsPushing() throws Exception {
    // Arrange
    source = start();
    client.emit(message(0L, "pending"));
    Thread.sleep(100);

    // Act
    source.stop();

    // Assert
    assertThrows(StopNotCalledException.class, () -> source.close());
    final var msg = source.receive().receive(WAIT).orElseThrow();
    source.ack(msg);
    source.close();
    assertEquals(SourceState.CLOSED, source.getState());
  }

  @Test
  void shouldCloseAfterStopWhenMessageArrivesLate() throws Exception {
    // Arrange
    source = start();
    source.stop();

    // Act
    client.emit(message(0L, "late"));
    source.close();

    // Assert
    assertTrue(source.unAcked().isEmpty());
    assertEquals(SourceState.CLOSED, source.getState());
    assertTrue(client.isClosed());
  }

  @Test
  void shouldRefuseToCloseWithUnackedMessages() throws Exception {
    // Arrange
    source = start();
    client.emit(message(0L, "hello"));
    final var msg = source.receive().receive(WAIT).orElseThrow();
    source.stop();

    // Act & Assert
    final var exception = assertThrows(UnackedMessagesRemainException.class, () -> source.close());
    assertEquals(1, exception.getRemaining());
    assertFalse(source.receive().isClosed());
    assertFalse(source.events().isClosed());
    assertFalse(client.isClosed());

    source.ack(msg);
    source.close();
    assertTrue(client.isClosed());
  }

  @Test
  void shouldCloseExactlyOnce() {
    // Arrange
    source = start();
    source.stop();

    // Act
    source.close();

    // Assert
    assertEquals(SourceState.CLOSED, source.getState());
    assertTrue(source.receive().isClosed());
    assertTrue(source.events().isClosed());
    assertEquals(1, client.closeCalls.get());
    assertThrows(IllegalStateException.class, () -> source.close());
    assertEquals(1, client.closeCalls.get());
  }

  @Test
  void shouldIgnoreRepeatedStop() {
    // Arrange
    source = start();

    // Act
    source.stop();
    source.stop();

    // Assert
    source.close();
    assertEquals(SourceState.CLOSED, source.getState());
  }

  @Test
  void shouldPropagateClientCloseFailure() {
    // Arrange
    source = start();
    source.stop();
    client.closeFailure = new KafkaException("close failed");

    // Act & Assert
    assertThrows(KafkaException.class, () -> source.close());
  }

  @Test
  void shouldFailStartWhenTopicReportsError() {
    // Arrange
    client.metadata.put(
      TOPIC,
      new TopicMetadata(TOPIC, List.of(), new UnknownTopicOrPartitionException("unknown topic"))
    );

    // Act & Assert
    final var exception = assertThrows(ConnectivityException.class, this::start);
    assertEquals("unable to retrieve kafka metadata", exception.getMessage());
    assertInstanceOf(TopicUnavailableException.class, exception.getCause());
    assertTrue(client.isClosed());
    assertTrue(client.subscribedTopics.isEmpty());
  }

  @Test
  void shouldFailStartWhenTopicHasNoPartitions() {
    // Arrange
    client.withTopic(TOPIC);

    // Act & Assert
    final var exception = assertThrows(ConnectivityException.class, this::start);
    assertEquals("configured topic topic.0 has no partitions", exception.getCause().getMessage());
    assertTrue(client.isClosed());
  }

  @Test
  void shouldFailStartWhenMetadataLookupFails() {
    // Arrange
    client.metadataFailure = new TimeoutException("metadata timed out");

    // Act & Assert
    final var exception = assertThrows(ConnectivityException.class, this::start);
    final var cause = assertInstanceOf(TopicUnavailableException.class, exception.getCause());
    assertEquals(TOPIC, cause.getTopic());
    assertInstanceOf(TimeoutException.class, cause.getCause());
    assertTrue(client.isClosed());
  }

  @Test
  void shouldFailStartWhenSubscribeFails() {
    // Arrange
    client.subscribeFailure = new KafkaException("subscribe failed");

    // Act & Assert
    final var exception = assertThrows(ConnectivityException.class, this::start);
    assertInstanceOf(KafkaException.class, exception.getCause());
    assertTrue(client.isClosed());
  }

  @Test
  void shouldRejectIncompleteConfigBeforeCreatingClient() {
    // Arrange
    final var factoryCalls = new AtomicInteger();
    final var builder = KafkaSource
      .builder()
      .withConfig(new MapConfigSource(Map.of(ConfigKeys.KAFKA_BROKERS, "0.0.0.0:9092")))
      .withClientFactory(config -> {
        factoryCalls.incrementAndGet();
        return client;
      });

    // Act & Assert
    assertThrows(MissingRequiredFieldException.class, builder::start);
    assertEquals(0, factoryCalls.get());
  }

  @Test
  void shouldPingConfiguredTopics() {
    // Arrange
    source = start();

    // Act & Assert
    assertDoesNotThrow(() -> source.ping());

    client.withTopic(TOPIC);
    final var exception = assertThrows(TopicUnavailableException.class, () -> source.ping());
    assertEquals(TOPIC, exception.getTopic());
  }

  private KafkaSource start() {
    return KafkaSource
      .builder()
      .withConfig(validConfig())
      .withSettings(SETTINGS)
      .withClientFactory(config -> client)
      .withIdGenerator(() -> "msg-" + ids.incrementAndGet())
      .start();
  }

  private static MapConfigSource validConfig() {
    return new MapConfigSource(
      Map.of(
        ConfigKeys.KAFKA_BROKERS,
        "0.0.0.0:9092",
        ConfigKeys.KAFKA_TOPICS,
        TOPIC,
        ConfigKeys.KAFKA_CONSUMER_GROUP,
        "cg-123"
      )
    );
  }

  private static NativeEvent.Message message(final long offset, final String value) {
    return new NativeEvent.Message(TOPIC, 0, offset, value.getBytes(), Instant.ofEpochMilli(1000));
  }
}

package org.kbridge.source;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.kbridge.channel.BlockingChannel;
import org.kbridge.channel.ReceiveChannel;
import org.kbridge.client.BrokerClient;
import org.kbridge.client.NativeEvent;
import org.kbridge.client.TopicMetadata;

/** In-memory {@link BrokerClient} whose native events are pushed by the test. */
class FakeBrokerClient implements BrokerClient {

  final BlockingChannel<NativeEvent> nativeEvents = BlockingChannel.buffered(100);
  final Map<String, TopicMetadata> metadata = new ConcurrentHashMap<>();
  final List<String> subscribedTopics = new CopyOnWriteArrayList<>();
  final List<Collection<TopicPartition>> assignCalls = new CopyOnWriteArrayList<>();
  final AtomicInteger unassignCalls = new AtomicInteger();
  final AtomicInteger closeCalls = new AtomicInteger();
  final AtomicBoolean failAssign = new AtomicBoolean();
  volatile RuntimeException metadataFailure;
  volatile RuntimeException subscribeFailure;
  volatile RuntimeException closeFailure;

  FakeBrokerClient withTopic(final String topic, final Integer... partitions) {
    metadata.put(topic, new TopicMetadata(topic, List.of(partitions), null));
    return this;
  }

  void emit(final NativeEvent event) throws InterruptedException {
    nativeEvents.send(event);
  }

  boolean isClosed() {
    return closeCalls.get() > 0;
  }

  @Override
  public void subscribe(final List<String> topics) {
    if (subscribeFailure != null) {
      throw subscribeFailure;
    }
    subscribedTopics.addAll(topics);
  }

  @Override
  public ReceiveChannel<NativeEvent> events() {
    return nativeEvents;
  }

  @Override
  public void assign(final Collection<TopicPartition> partitions) {
    if (failAssign.get()) {
      throw new KafkaException("assign failed");
    }
    assignCalls.add(partitions);
  }

  @Override
  public void unassign() {
    unassignCalls.incrementAndGet();
  }

  @Override
  public TopicMetadata getMetadata(final String topic, final Duration timeout) {
    if (metadataFailure != null) {
      throw metadataFailure;
    }
    return metadata.getOrDefault(topic, new TopicMetadata(topic, List.of(), null));
  }

  @Override
  public void close() {
    closeCalls.incrementAndGet();
    nativeEvents.close();
    if (closeFailure != null) {
      throw closeFailure;
    }
  }
}

package org.kbridge.client;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import org.apache.kafka.common.TopicPartition;
import org.kbridge.channel.ReceiveChannel;

/**
 * The consumer-side broker capabilities a source relies on.
 *
 * <p>Messages, rebalances, commit results and errors all arrive on one ordered stream, {@link
 * #events()}. The client is owned by a single source: it is used by the source's consume loop and,
 * before the loop starts or after it stopped, by the source lifecycle.
 */
public interface BrokerClient {
  /**
   * Subscribes to the topics and starts producing events.
   *
   * @param topics the topics to consume
   * @throws IllegalStateException if the client is already subscribed or closed
   * @throws org.apache.kafka.common.KafkaException if the subscription is rejected
   */
  void subscribe(List<String> topics);

  /**
   * Returns the stream of native events.
   *
   * @return a receive-only event channel
   */
  ReceiveChannel<NativeEvent> events();

  /**
   * Takes ownership of partitions reported by a {@link NativeEvent.AssignedPartitions} event.
   *
   * @param partitions the partitions to consume
   */
  void assign(Collection<TopicPartition> partitions);

  /** Releases partitions reported by a {@link NativeEvent.RevokedPartitions} event. */
  void unassign();

  /**
   * Looks up topic metadata.
   *
   * @param topic the topic
   * @param timeout the maximum time to wait for the broker
   * @return the metadata, carrying any topic level error
   * @throws org.apache.kafka.common.KafkaException if the lookup itself fails
   */
  TopicMetadata getMetadata(String topic, Duration timeout);

  /**
   * Stops the client and releases its connections.
   *
   * @throws org.apache.kafka.common.KafkaException if the release fails
   */
  void close();
}

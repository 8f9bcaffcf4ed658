package org.kbridge.client;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;

/**
 * Event produced by a {@link BrokerClient} on its event stream.
 *
 * <p>One case exists per kind of notification the client reports, plus {@link Unrecognized} for
 * anything else.
 */
public sealed interface NativeEvent
  permits
    NativeEvent.AssignedPartitions,
    NativeEvent.RevokedPartitions,
    NativeEvent.Message,
    NativeEvent.PartitionEof,
    NativeEvent.OffsetsCommitted,
    NativeEvent.BrokerError,
    NativeEvent.Unrecognized {
  /**
   * The group coordinator assigned partitions to this consumer. Consumption of these partitions
   * starts once the application calls {@link BrokerClient#assign}.
   *
   * @param partitions the assigned partitions
   */
  record AssignedPartitions(Set<TopicPartition> partitions) implements NativeEvent {
    public AssignedPartitions {
      partitions = Set.copyOf(partitions);
    }
  }

  /**
   * Partitions were revoked from this consumer.
   *
   * @param partitions the revoked partitions
   */
  record RevokedPartitions(Set<TopicPartition> partitions) implements NativeEvent {
    public RevokedPartitions {
      partitions = Set.copyOf(partitions);
    }
  }

  /**
   * A decoded message.
   *
   * @param topic the source topic
   * @param partition the source partition
   * @param offset the message offset
   * @param value the payload, empty for null values
   * @param timestamp the message timestamp
   */
  record Message(String topic, int partition, long offset, byte[] value, Instant timestamp) implements NativeEvent {
    public Message {
      value = value != null ? value : new byte[0];
    }

    @Override
    public String toString() {
      return "Message[topic=%s, partition=%d, offset=%d, size=%d]".formatted(topic, partition, offset, value.length);
    }
  }

  /**
   * The consumer reached the end of a partition.
   *
   * @param partition the partition
   * @param offset the next offset to be written
   */
  record PartitionEof(TopicPartition partition, long offset) implements NativeEvent {}

  /**
   * Result of an offset commit.
   *
   * @param offsets the offsets that were committed
   * @param error the commit failure, or null if the commit succeeded
   */
  record OffsetsCommitted(Map<TopicPartition, OffsetAndMetadata> offsets, Exception error) implements NativeEvent {
    public OffsetsCommitted {
      offsets = offsets != null ? Map.copyOf(offsets) : Map.of();
    }

    public boolean failed() {
      return error != null;
    }
  }

  /**
   * An error raised by the client.
   *
   * @param error the failure
   */
  record BrokerError(Exception error) implements NativeEvent {
    public BrokerError {
      Objects.requireNonNull(error, "Broker error cannot be null");
    }
  }

  /**
   * A notification with no dedicated case.
   *
   * @param payload the original notification
   */
  record Unrecognized(Object payload) implements NativeEvent {}
}

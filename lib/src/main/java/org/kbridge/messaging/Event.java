package org.kbridge.messaging;

import java.util.Objects;
import java.util.Set;
import org.apache.kafka.common.TopicPartition;

/**
 * Asynchronous notification reported by a {@link Source} or {@link Sink} alongside its messages.
 *
 * <p>Events cover broker lifecycle changes and data-plane failures that do not belong to a single
 * message:
 *
 * <ul>
 *   <li>{@link PartitionsAssigned} - the consumer group handed partitions to this member
 *   <li>{@link PartitionsRevoked} - partitions were taken away during a rebalance
 *   <li>{@link CommitError} - an offset commit failed
 *   <li>{@link BrokerError} - the broker client reported an error
 *   <li>{@link BrokerEvent} - any other broker notification, passed through unchanged
 * </ul>
 */
public sealed interface Event
  permits Event.PartitionsAssigned, Event.PartitionsRevoked, Event.CommitError, Event.BrokerError, Event.BrokerEvent {
  /**
   * Partitions assigned to this consumer.
   *
   * @param partitions the newly assigned partitions
   */
  record PartitionsAssigned(Set<TopicPartition> partitions) implements Event {
    public PartitionsAssigned {
      partitions = Set.copyOf(partitions);
    }
  }

  /**
   * Partitions revoked from this consumer.
   *
   * @param partitions the revoked partitions
   */
  record PartitionsRevoked(Set<TopicPartition> partitions) implements Event {
    public PartitionsRevoked {
      partitions = Set.copyOf(partitions);
    }
  }

  /**
   * An offset commit that completed with an error.
   *
   * @param error the commit failure
   */
  record CommitError(Exception error) implements Event {
    public CommitError {
      Objects.requireNonNull(error, "Commit error cannot be null");
    }
  }

  /**
   * An error reported by the broker client.
   *
   * @param error the broker failure
   */
  record BrokerError(Exception error) implements Event {
    public BrokerError {
      Objects.requireNonNull(error, "Broker error cannot be null");
    }
  }

  /**
   * A broker notification with no dedicated event type.
   *
   * @param payload the original notification
   */
  record BrokerEvent(Object payload) implements Event {}
}

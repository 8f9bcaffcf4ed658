package org.kbridge.client;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Collection;
import java.util.Set;
import java.util.function.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.common.TopicPartition;

/**
 * Rebalance listener that reports partition assignments and revocations as {@link NativeEvent}s.
 *
 * <p>Newly assigned partitions are paused and recorded as awaiting the application, so that no
 * record of a partition is fetched before the application accepted the assignment through {@link
 * BrokerClient#assign}. Revoked partitions are forgotten.
 *
 * <p>When rebalance reporting is disabled the listener does nothing and the consumer keeps its
 * default behavior of consuming assigned partitions immediately.
 *
 * <p>Callbacks run on the consumer's poll thread, as do all accesses to the awaiting set.
 */
public class EventingRebalanceListener implements ConsumerRebalanceListener {

  private static final Logger LOGGER = System.getLogger(EventingRebalanceListener.class.getName());

  private final org.apache.kafka.clients.consumer.Consumer<?, ?> consumer;
  private final boolean rebalanceEnabled;
  private final Set<TopicPartition> awaitingAssignment;
  private final Consumer<NativeEvent> publisher;

  /**
   * Constructs a new EventingRebalanceListener.
   *
   * @param consumer the Kafka consumer whose partitions are paused on assignment
   * @param rebalanceEnabled whether rebalances are reported
   * @param awaitingAssignment partitions assigned by the coordinator but not yet by the application
   * @param publisher receives the rebalance events
   */
  public EventingRebalanceListener(
    final org.apache.kafka.clients.consumer.Consumer<?, ?> consumer,
    final boolean rebalanceEnabled,
    final Set<TopicPartition> awaitingAssignment,
    final Consumer<NativeEvent> publisher
  ) {
    this.consumer = consumer;
    this.rebalanceEnabled = rebalanceEnabled;
    this.awaitingAssignment = awaitingAssignment;
    this.publisher = publisher;
  }

  @Override
  public void onPartitionsAssigned(final Collection<TopicPartition> partitions) {
    if (!rebalanceEnabled || partitions.isEmpty()) return;
    LOGGER.log(Level.INFO, "Partitions assigned: %s".formatted(partitions));

    awaitingAssignment.addAll(partitions);
    consumer.pause(partitions);
    publisher.accept(new NativeEvent.AssignedPartitions(Set.copyOf(partitions)));
  }

  @Override
  public void onPartitionsRevoked(final Collection<TopicPartition> partitions) {
    if (!rebalanceEnabled || partitions.isEmpty()) return;
    LOGGER.log(Level.INFO, "Partitions revoked: %s".formatted(partitions));

    awaitingAssignment.removeAll(partitions);
    publisher.accept(new NativeEvent.RevokedPartitions(Set.copyOf(partitions)));
  }

  @Override
  public void onPartitionsLost(final Collection<TopicPartition> partitions) {
    onPartitionsRevoked(partitions);
  }
}

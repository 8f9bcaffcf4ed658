package org.kbridge.client;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.common.TopicPartition;

/**
 * Work handed to the poll thread of a {@link KafkaBrokerClient}. The Kafka consumer is not safe for
 * multithreaded access, so every call made on behalf of other threads travels through a command.
 *
 * @param kind what to do
 * @param partitions the partitions of an {@link Kind#ASSIGN} command
 * @param topic the topic of a {@link Kind#METADATA} command
 * @param timeout the lookup timeout of a {@link Kind#METADATA} command
 * @param reply completed with the result of a {@link Kind#METADATA} command
 */
record ClientCommand(
  Kind kind,
  List<TopicPartition> partitions,
  String topic,
  Duration timeout,
  CompletableFuture<TopicMetadata> reply
) {
  enum Kind {
    /** Resume partitions paused on assignment. */
    ASSIGN,

    /** Forget partitions still waiting for the application. */
    UNASSIGN,

    /** Look up topic metadata. */
    METADATA,
  }

  static ClientCommand assign(final Collection<TopicPartition> partitions) {
    return new ClientCommand(Kind.ASSIGN, List.copyOf(partitions), null, null, null);
  }

  static ClientCommand unassign() {
    return new ClientCommand(Kind.UNASSIGN, List.of(), null, null, null);
  }

  static ClientCommand metadata(
    final String topic,
    final Duration timeout,
    final CompletableFuture<TopicMetadata> reply
  ) {
    return new ClientCommand(Kind.METADATA, List.of(), topic, timeout, reply);
  }
}

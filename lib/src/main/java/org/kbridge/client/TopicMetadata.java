package org.kbridge.client;

import java.util.List;

/**
 * Broker metadata of a topic.
 *
 * @param topic the topic name
 * @param partitions the partition ids, empty if the topic has none or is unknown
 * @param error the error the broker reported for the topic, or null
 */
public record TopicMetadata(String topic, List<Integer> partitions, Exception error) {
  public TopicMetadata {
    partitions = partitions != null ? List.copyOf(partitions) : List.of();
  }

  public boolean hasError() {
    return error != null;
  }
}

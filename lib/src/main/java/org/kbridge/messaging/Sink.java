package org.kbridge.messaging;

/** A destination for messages. */
public interface Sink {
  /**
   * Sends a message to a destination.
   *
   * @param msg the message to send
   * @param destination the destination name, e.g. a topic
   */
  void send(Msg msg, String destination);

  /** Flushes pending sends and releases the underlying resources. */
  void close();
}

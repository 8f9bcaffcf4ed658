package org.kbridge.messaging;

import org.kbridge.channel.ReceiveChannel;

/** A component that reports asynchronous {@link Event}s. */
public interface Eventer {
  /**
   * Returns the channel on which events are delivered.
   *
   * @return a receive-only event channel
   */
  ReceiveChannel<Event> events();
}

package org.kbridge.messaging;

import java.time.Instant;

/**
 * A single delivery handed to application code by a {@link Source}.
 *
 * <p>The identifier is unique per delivery. A broker redelivering the same offset produces a
 * message with a new identifier.
 */
public interface Msg {
  /**
   * Returns the identifier of this delivery.
   *
   * @return the delivery identifier
   */
  String id();

  /**
   * Returns the message payload.
   *
   * @return the payload bytes, never null
   */
  byte[] data();

  /**
   * Returns the broker timestamp of the message.
   *
   * @return the message timestamp
   */
  Instant timestamp();
}

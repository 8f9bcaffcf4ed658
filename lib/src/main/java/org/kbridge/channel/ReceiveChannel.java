package org.kbridge.channel;

import java.time.Duration;
import java.util.Optional;

/**
 * The receiving side of a {@link BlockingChannel}.
 *
 * <p>Once the channel is closed, items already buffered can still be received. After that every
 * receive fails with {@link ChannelClosedException}.
 *
 * @param <T> the type of items carried by the channel
 */
public interface ReceiveChannel<T> {
  /**
   * Receives the next item, waiting until one is available.
   *
   * @return the next item
   * @throws InterruptedException if interrupted while waiting
   * @throws ChannelClosedException if the channel is closed and drained
   */
  T receive() throws InterruptedException;

  /**
   * Receives the next item, waiting up to the given timeout.
   *
   * @param timeout the maximum time to wait
   * @return the next item, or empty if none arrived in time
   * @throws InterruptedException if interrupted while waiting
   * @throws ChannelClosedException if the channel is closed and drained
   */
  Optional<T> receive(Duration timeout) throws InterruptedException;

  /**
   * Returns whether the channel has been closed.
   *
   * @return {@code true} once {@link BlockingChannel#close()} was called
   */
  boolean isClosed();
}

package org.kbridge.channel;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;

/**
 * A closable channel between threads backed by a {@link BlockingQueue}.
 *
 * <p>An {@link #unbuffered()} channel hands each item directly from sender to receiver: {@link
 * #send(Object)} returns only once a receiver took the item. A {@link #buffered(int)} channel
 * accepts up to {@code capacity} items before senders block.
 *
 * <p>Blocked senders and receivers re-check the closed flag every 50 ms,
 * so {@link #close()} releases them promptly.
 *
 * <pre>{@code
 * BlockingChannel<Msg> channel = BlockingChannel.unbuffered();
 * // producer thread
 * channel.send(msg);
 * // consumer thread
 * Msg msg = channel.receive();
 * }</pre>
 *
 * @param <T> the type of items carried by the channel
 */
public final class BlockingChannel<T> implements ReceiveChannel<T> {

  static final long CHECK_INTERVAL_MS = 50;

  private final BlockingQueue<T> queue;
  private volatile boolean closed;

  private BlockingChannel(final BlockingQueue<T> queue) {
    this.queue = queue;
  }

  /**
   * Creates a channel with no buffering.
   *
   * @param <T> the item type
   * @return a new unbuffered channel
   */
  public static <T> BlockingChannel<T> unbuffered() {
    return new BlockingChannel<>(new SynchronousQueue<>());
  }

  /**
   * Creates a channel that buffers up to {@code capacity} items.
   *
   * @param capacity the buffer size
   * @param <T> the item type
   * @return a new buffered channel
   * @throws IllegalArgumentException if capacity is not positive
   */
  public static <T> BlockingChannel<T> buffered(final int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("Channel capacity must be positive");
    }
    return new BlockingChannel<>(new LinkedBlockingQueue<>(capacity));
  }

  /**
   * Sends an item, waiting until the channel accepts it.
   *
   * @param item the item to send
   * @throws InterruptedException if interrupted while waiting
   * @throws ChannelClosedException if the channel is or becomes closed before the item is accepted
   */
  public void send(final T item) throws InterruptedException {
    Objects.requireNonNull(item, "Channel items cannot be null");
    while (!closed) {
      if (queue.offer(item, CHECK_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
        return;
      }
    }
    throw new ChannelClosedException();
  }

  /**
   * Sends an item only if the channel can accept it without waiting.
   *
   * @param item the item to send
   * @return {@code true} if the item was accepted
   * @throws ChannelClosedException if the channel is closed
   */
  public boolean trySend(final T item) {
    Objects.requireNonNull(item, "Channel items cannot be null");
    if (closed) {
      throw new ChannelClosedException();
    }
    return queue.offer(item);
  }

  @Override
  public T receive() throws InterruptedException {
    while (true) {
      final var item = queue.poll(CHECK_INTERVAL_MS, TimeUnit.MILLISECONDS);
      if (item != null) {
        return item;
      }
      if (closed) {
        throw new ChannelClosedException();
      }
    }
  }

  @Override
  public Optional<T> receive(final Duration timeout) throws InterruptedException {
    final var deadline = System.nanoTime() + timeout.toNanos();
    while (true) {
      final var remaining = deadline - System.nanoTime();
      final var wait = Math.max(0, Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(CHECK_INTERVAL_MS)));
      final var item = queue.poll(wait, TimeUnit.NANOSECONDS);
      if (item != null) {
        return Optional.of(item);
      }
      if (closed) {
        throw new ChannelClosedException();
      }
      if (remaining <= 0) {
        return Optional.empty();
      }
    }
  }

  /** Closes the channel. Calling it again has no effect. */
  public void close() {
    closed = true;
  }

  @Override
  public boolean isClosed() {
    return closed;
  }
}

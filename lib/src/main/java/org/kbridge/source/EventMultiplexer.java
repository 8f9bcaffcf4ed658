package org.kbridge.source;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.kbridge.channel.BlockingChannel;
import org.kbridge.channel.ChannelClosedException;
import org.kbridge.client.BrokerClient;
import org.kbridge.client.NativeEvent;
import org.kbridge.messaging.Event;
import org.kbridge.messaging.Msg;
import org.kbridge.messaging.SimpleMsg;
import org.kbridge.messaging.UnAckedTracker;
import org.kbridge.source.enums.SourceState;

/**
 * The consume loop of a {@link KafkaSource}.
 *
 * <p>Takes native events from the broker client one at a time and routes them:
 *
 * <ul>
 *   <li>messages get a fresh identifier, are tracked as unacknowledged and pushed to the message
 *       channel
 *   <li>partition assignments and revocations are applied to the client, then reported
 *   <li>commit failures, broker errors and any other notification are reported as events
 *   <li>end-of-partition notices and successful commits are dropped
 * </ul>
 *
 * <p>Pushes wait until a receiver takes the item, which is the only backpressure between the
 * broker and the application. The quit signal is checked before and after each wait for a native
 * event: an event arriving once stop was requested is discarded, while an event already being
 * dispatched runs to completion. On exit, for whatever reason, the loop marks the source {@link
 * SourceState#STOPPED} and releases the done latch.
 */
final class EventMultiplexer implements Runnable {

  private static final Logger LOGGER = System.getLogger(EventMultiplexer.class.getName());

  private final BrokerClient client;
  private final UnAckedTracker tracker;
  private final BlockingChannel<Msg> messages;
  private final BlockingChannel<Event> events;
  private final CountDownLatch quit;
  private final CountDownLatch done;
  private final AtomicReference<SourceState> state;
  private final Supplier<String> idGenerator;
  private final Duration pollInterval;

  EventMultiplexer(
    final BrokerClient client,
    final UnAckedTracker tracker,
    final BlockingChannel<Msg> messages,
    final BlockingChannel<Event> events,
    final CountDownLatch quit,
    final CountDownLatch done,
    final AtomicReference<SourceState> state,
    final Supplier<String> idGenerator,
    final Duration pollInterval
  ) {
    this.client = client;
    this.tracker = tracker;
    this.messages = messages;
    this.events = events;
    this.quit = quit;
    this.done = done;
    this.state = state;
    this.idGenerator = idGenerator;
    this.pollInterval = pollInterval;
  }

  @Override
  public void run() {
    try {
      final var nativeEvents = client.events();
      while (quit.getCount() > 0) {
        final var next = nativeEvents.receive(pollInterval);
        if (next.isEmpty()) {
          continue;
        }
        if (quit.getCount() == 0) {
          LOGGER.log(Level.DEBUG, "Stop requested, discarding {0}", next.get());
          break;
        }
        dispatch(next.get());
      }
      LOGGER.log(Level.INFO, "Consume loop stopped");
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.log(Level.INFO, "Consume loop interrupted");
    } catch (final ChannelClosedException e) {
      LOGGER.log(Level.WARNING, "Channel closed under the consume loop, exiting", e);
    } finally {
      state.updateAndGet(current -> current == SourceState.CLOSED ? current : SourceState.STOPPED);
      done.countDown();
    }
  }

  void dispatch(final NativeEvent event) throws InterruptedException {
    if (event instanceof NativeEvent.Message message) {
      handleMessage(message);
    } else if (event instanceof NativeEvent.AssignedPartitions assigned) {
      try {
        client.assign(assigned.partitions());
      } catch (final RuntimeException e) {
        LOGGER.log(Level.WARNING, "Failed to assign partitions %s".formatted(assigned.partitions()), e);
        events.send(new Event.BrokerError(e));
      }
      events.send(new Event.PartitionsAssigned(assigned.partitions()));
    } else if (event instanceof NativeEvent.RevokedPartitions revoked) {
      try {
        client.unassign();
      } catch (final RuntimeException e) {
        LOGGER.log(Level.WARNING, "Failed to unassign partitions %s".formatted(revoked.partitions()), e);
        events.send(new Event.BrokerError(e));
      }
      events.send(new Event.PartitionsRevoked(revoked.partitions()));
    } else if (event instanceof NativeEvent.PartitionEof eof) {
      LOGGER.log(Level.DEBUG, "Reached end of {0} at offset {1}", eof.partition(), eof.offset());
    } else if (event instanceof NativeEvent.OffsetsCommitted committed) {
      if (committed.failed()) {
        events.send(new Event.CommitError(committed.error()));
      }
    } else if (event instanceof NativeEvent.BrokerError error) {
      events.send(new Event.BrokerError(error.error()));
    } else {
      final var payload = event instanceof NativeEvent.Unrecognized unrecognized ? unrecognized.payload() : event;
      events.send(new Event.BrokerEvent(payload));
    }
  }

  private void handleMessage(final NativeEvent.Message message) throws InterruptedException {
    final var msg = new SimpleMsg(idGenerator.get(), message.value(), message.timestamp());
    tracker.add(msg);
    LOGGER.log(
      Level.DEBUG,
      "Delivering {0} from {1}-{2} at offset {3}",
      msg.id(),
      message.topic(),
      message.partition(),
      message.offset()
    );
    try {
      messages.send(msg);
    } catch (final InterruptedException | ChannelClosedException e) {
      // Never handed out, so nobody can settle it
      tracker.remove(msg);
      throw e;
    }
  }
}

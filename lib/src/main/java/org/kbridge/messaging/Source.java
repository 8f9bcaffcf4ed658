package org.kbridge.messaging;

import java.util.List;
import org.kbridge.channel.ReceiveChannel;

/**
 * A source of messages following the receive, process, acknowledge model.
 *
 * <p>Every message taken from {@link #receive()} must be settled exactly once with {@link #ack(Msg)}
 * or {@link #fail(Msg)}. Until then it is reported by {@link #unAcked()} and blocks {@link
 * #close()}.
 *
 * <p>Shutdown is a two-step protocol: {@link #stop()} stops intake, {@link #close()} releases
 * resources once intake has ended and nothing is left unacknowledged.
 *
 * <pre>{@code
 * Source source = KafkaSource.start(config);
 * Msg msg = source.receive().receive();
 * process(msg);
 * source.ack(msg);
 *
 * source.stop();
 * source.close();
 * }</pre>
 */
public interface Source extends Eventer {
  /**
   * Returns the channel on which received messages are delivered.
   *
   * @return a receive-only message channel
   */
  ReceiveChannel<Msg> receive();

  /**
   * Acknowledges a message.
   *
   * @param msg the message to acknowledge
   * @throws MessageNotFoundException if the message is not awaiting acknowledgement
   */
  void ack(Msg msg);

  /**
   * Marks a message as failed.
   *
   * @param msg the message that failed processing
   * @throws MessageNotFoundException if the message is not awaiting acknowledgement
   */
  void fail(Msg msg);

  /**
   * Returns a snapshot of the messages delivered but not yet settled.
   *
   * @return the unacknowledged messages, in no particular order
   */
  List<Msg> unAcked();

  /** Stops delivering new messages. Must be called before {@link #close()}. */
  void stop();

  /**
   * Releases the underlying resources.
   *
   * @throws StopNotCalledException if intake has not ended within the close grace period
   * @throws UnackedMessagesRemainException if delivered messages are still unsettled
   */
  void close();

  /**
   * Verifies that the broker is reachable and every configured topic is usable.
   *
   * @throws TopicUnavailableException if a topic cannot be used
   */
  void ping();
}

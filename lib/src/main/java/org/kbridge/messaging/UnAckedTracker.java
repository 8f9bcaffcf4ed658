package org.kbridge.messaging;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks messages that were delivered to application code but not yet acknowledged or failed.
 *
 * <p>The tracker is shared between the thread that delivers messages and the threads that settle
 * them, so all operations are safe for concurrent use. Messages are keyed by {@link Msg#id()}.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * UnAckedTracker tracker = new UnAckedTracker();
 * tracker.add(msg);          // before handing the message out
 * tracker.remove(msg);       // on ack or fail
 * tracker.remove(msg);       // throws MessageNotFoundException
 * }</pre>
 */
public class UnAckedTracker {

  private final Map<String, Msg> inFlight = new ConcurrentHashMap<>();

  /**
   * Starts tracking a message. Adding a message whose identifier is already tracked has no effect.
   *
   * @param msg the delivered message
   */
  public void add(final Msg msg) {
    Objects.requireNonNull(msg, "Message cannot be null");
    inFlight.putIfAbsent(msg.id(), msg);
  }

  /**
   * Stops tracking a message.
   *
   * @param msg the settled message
   * @throws MessageNotFoundException if the message is not tracked
   */
  public void remove(final Msg msg) {
    Objects.requireNonNull(msg, "Message cannot be null");
    if (inFlight.remove(msg.id()) == null) {
      throw new MessageNotFoundException(msg.id());
    }
  }

  /**
   * Returns the number of tracked messages.
   *
   * @return the in-flight message count
   */
  public int count() {
    return inFlight.size();
  }

  /**
   * Returns a snapshot of the tracked messages.
   *
   * @return the tracked messages, in no particular order
   */
  public List<Msg> list() {
    return List.copyOf(inFlight.values());
  }
}

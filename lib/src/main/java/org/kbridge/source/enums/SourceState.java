package org.kbridge.source.enums;

/**
 * Represents the lifecycle states of a Kafka source.
 *
 * <p>The state transitions follow this sequence:
 *
 * <ul>
 *   <li>CREATED - Initial state while the source pings the broker and subscribes
 *   <li>RUNNING - The consume loop delivers messages and events
 *   <li>STOPPING - Stop was requested, the consume loop has not exited yet
 *   <li>STOPPED - The consume loop exited, the source can be closed
 *   <li>CLOSED - Final state, channels and the broker client are released
 * </ul>
 */
public enum SourceState {
  /** Created but not started. No messages are delivered in this state. */
  CREATED,

  /** The consume loop is running. */
  RUNNING,

  /**
   * Stop was requested. A message or event taken before the request is still delivered, no further
   * native events are taken.
   */
  STOPPING,

  /** The consume loop exited. Closing succeeds once every delivered message is settled. */
  STOPPED,

  /** All resources have been released and no operations can be performed. */
  CLOSED,
}

package org.kbridge.client.enums;

/**
 * Operational states of a broker client.
 *
 * <ul>
 *   <li>{@code CREATED} - constructed, not subscribed
 *   <li>{@code RUNNING} - subscribed, the poll thread is producing events
 *   <li>{@code CLOSING} - close requested, the poll thread is shutting down
 *   <li>{@code CLOSED} - the underlying consumer is closed
 * </ul>
 */
public enum ClientState {
  CREATED,
  RUNNING,
  CLOSING,
  CLOSED,
}

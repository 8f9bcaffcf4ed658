package org.kbridge.channel;

/** Raised when sending to, or receiving from a drained, closed channel. */
public class ChannelClosedException extends IllegalStateException {

  public ChannelClosedException() {
    super("channel is closed");
  }
}

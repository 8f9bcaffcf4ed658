package org.kbridge.messaging;

/** Raised by {@link Source#close()} while delivered messages are still unsettled. */
public class UnackedMessagesRemainException extends MessagingException {

  private final int remaining;

  public UnackedMessagesRemainException(final int remaining) {
    super("%d unacknowledged messages remain".formatted(remaining));
    this.remaining = remaining;
  }

  public int getRemaining() {
    return remaining;
  }
}

package org.kbridge.messaging;

/**
 * Raised when a message is settled that is not awaiting acknowledgement, either because it was
 * already acknowledged or failed, or because it was never delivered by this source.
 */
public class MessageNotFoundException extends MessagingException {

  private final String messageId;

  public MessageNotFoundException(final String messageId) {
    super("message %s is not awaiting acknowledgement".formatted(messageId));
    this.messageId = messageId;
  }

  public String getMessageId() {
    return messageId;
  }
}

package org.kbridge.messaging;

/** Raised when a configured topic cannot be used: metadata lookup failed, it reports an error, or it has no partitions. */
public class TopicUnavailableException extends MessagingException {

  private final String topic;

  public TopicUnavailableException(final String topic, final String message) {
    super(message);
    this.topic = topic;
  }

  public TopicUnavailableException(final String topic, final String message, final Throwable cause) {
    super(message, cause);
    this.topic = topic;
  }

  public String getTopic() {
    return topic;
  }
}

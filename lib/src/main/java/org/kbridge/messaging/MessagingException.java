package org.kbridge.messaging;

/** Base class of the errors raised by sources, sinks and their configuration. */
public class MessagingException extends RuntimeException {

  public MessagingException(final String message) {
    super(message);
  }

  public MessagingException(final String message, final Throwable cause) {
    super(message, cause);
  }
}

package org.kbridge.messaging;

/** Raised when a source cannot establish its subscription against the broker. */
public class ConnectivityException extends MessagingException {

  public ConnectivityException(final String message, final Throwable cause) {
    super(message, cause);
  }
}

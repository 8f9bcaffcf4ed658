package org.kbridge.config;

import org.kbridge.messaging.MessagingException;

/** Raised when configuration cannot be turned into a client configuration. */
public class ConfigValidationException extends MessagingException {

  public ConfigValidationException(final String message) {
    super(message);
  }

  public ConfigValidationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}

package org.kbridge.messaging;

/** Raised by {@link Source#close()} when intake did not end, i.e. {@link Source#stop()} was not called. */
public class StopNotCalledException extends MessagingException {

  public StopNotCalledException(final String message) {
    super(message);
  }
}

package org.kbridge.messaging;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable {@link Msg} implementation.
 *
 * <p>Equality is based on the identifier only, so two deliveries with identical payloads are never
 * considered equal.
 *
 * @param id the delivery identifier
 * @param data the payload bytes
 * @param timestamp the broker timestamp
 */
public record SimpleMsg(String id, byte[] data, Instant timestamp) implements Msg {
  public SimpleMsg {
    Objects.requireNonNull(id, "Message id cannot be null");
    data = data != null ? data : new byte[0];
    timestamp = timestamp != null ? timestamp : Instant.EPOCH;
  }

  @Override
  public boolean equals(final Object o) {
    return this == o || (o instanceof SimpleMsg other && id.equals(other.id));
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    return "SimpleMsg[id=%s, size=%d, timestamp=%s]".formatted(id, data.length, timestamp);
  }
}

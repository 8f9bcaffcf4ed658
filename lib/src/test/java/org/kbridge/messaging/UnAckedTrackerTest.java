package org.kbridge.messaging;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class UnAckedTrackerTest {

  private final UnAckedTracker tracker = new UnAckedTracker();

  @Test
  void shouldTrackUntilRemoved() {
    // Arrange
    final var msg = new SimpleMsg("id-1", "payload".getBytes(), Instant.now());

    // Act
    tracker.add(msg);

    // Assert
    assertEquals(1, tracker.count());
    assertEquals(List.of(msg), tracker.list());

    tracker.remove(msg);
    assertEquals(0, tracker.count());
    assertTrue(tracker.list().isEmpty());
  }

  @Test
  void shouldIgnoreDuplicateAdds() {
    // Arrange
    final var msg = new SimpleMsg("id-1", null, null);

    // Act
    tracker.add(msg);
    tracker.add(msg);

    // Assert
    assertEquals(1, tracker.count());
  }

  @Test
  void shouldFailToRemoveUnknownMessage() {
    // Arrange
    final var msg = new SimpleMsg("id-1", null, null);
    tracker.add(msg);
    tracker.remove(msg);

    // Act & Assert
    final var exception = assertThrows(MessageNotFoundException.class, () -> tracker.remove(msg));
    assertEquals("id-1", exception.getMessageId());
  }

  @Test
  void shouldReturnSnapshot() {
    // Arrange
    final var msg = new SimpleMsg("id-1", null, null);
    tracker.add(msg);

    // Act
    final var snapshot = tracker.list();
    tracker.remove(msg);

    // Assert
    assertEquals(1, snapshot.size());
    assertThrows(UnsupportedOperationException.class, () -> snapshot.add(msg));
  }

  @Test
  void shouldHandleConcurrentUpdates() {
    // Arrange
    final var messages = IntStream.range(0, 1000).mapToObj(i -> new SimpleMsg("id-" + i, null, null)).toList();

    // Act
    CompletableFuture
      .allOf(
        messages.stream().map(msg -> CompletableFuture.runAsync(() -> tracker.add(msg))).toArray(CompletableFuture[]::new)
      )
      .join();
    CompletableFuture
      .allOf(
        messages
          .stream()
          .limit(600)
          .map(msg -> CompletableFuture.runAsync(() -> tracker.remove(msg)))
          .toArray(CompletableFuture[]::new)
      )
      .join();

    // Assert
    assertEquals(400, tracker.count());
  }
}

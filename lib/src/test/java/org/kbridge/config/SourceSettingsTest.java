package org.kbridge.config;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class SourceSettingsTest {

  @Test
  void shouldUseDefaults() {
    // Act
    final var settings = SourceSettings.defaults();

    // Assert
    assertEquals(Duration.ofMillis(6000), settings.sessionTimeout());
    assertEquals(settings.sessionTimeout(), settings.metadataTimeout());
    assertEquals(Duration.ofSeconds(3), settings.closeGrace());
    assertEquals(Duration.ofMillis(100), settings.pollInterval());
    assertEquals(Role.SOURCE.defaults(), settings.kafkaDefaults());
  }

  @Test
  void shouldDeriveSessionTimeoutDefaults() {
    // Act
    final var settings = new SourceSettings(Duration.ofSeconds(10), null, null, null, null);

    // Assert
    assertEquals(Duration.ofSeconds(10), settings.metadataTimeout());
    assertEquals(10000, settings.kafkaDefaults().get("session.timeout.ms"));
    assertEquals("earliest", settings.kafkaDefaults().get("auto.offset.reset"));
  }

  @Test
  void shouldRejectNonPositiveDurations() {
    // Act & Assert
    assertThrows(IllegalArgumentException.class, () -> new SourceSettings(Duration.ZERO, null, null, null, null));
    assertThrows(
      IllegalArgumentException.class,
      () -> new SourceSettings(null, null, Duration.ofSeconds(-1), null, null)
    );
  }

  @Test
  void shouldReplaceCloseGrace() {
    // Act
    final var settings = SourceSettings.defaults().withCloseGrace(Duration.ofMillis(200));

    // Assert
    assertEquals(Duration.ofMillis(200), settings.closeGrace());
    assertEquals(Duration.ofMillis(6000), settings.sessionTimeout());
  }
}

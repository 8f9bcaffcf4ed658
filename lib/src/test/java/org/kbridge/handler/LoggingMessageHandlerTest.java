package org.kbridge.handler;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.kbridge.messaging.SimpleMsg;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LoggingMessageHandlerTest {

  @Mock
  private Logger mockLogger;

  @Captor
  private ArgumentCaptor<String> messageCaptor;

  private LoggingMessageHandler handler;

  @BeforeEach
  void setUp() {
    handler = new LoggingMessageHandler(mockLogger, Level.INFO);
  }

  @Test
  void shouldLogMessageAsJsonAndAccept() {
    // Arrange
    when(mockLogger.isLoggable(any(Level.class))).thenReturn(true);
    final var msg = new SimpleMsg("msg-1", "hello".getBytes(StandardCharsets.UTF_8), Instant.ofEpochMilli(0));

    // Act
    final var accepted = handler.test(msg);

    // Assert
    assertTrue(accepted);
    verify(mockLogger).log(eq(Level.INFO), messageCaptor.capture());
    assertEquals(
      """
      {"id":"msg-1","timestamp":"1970-01-01T00:00:00Z","size":5,"payload":"hello"}""",
      messageCaptor.getValue()
    );
  }

  @Test
  void shouldAcceptWithoutLoggingWhenLevelIsNotLoggable() {
    // Arrange
    when(mockLogger.isLoggable(any(Level.class))).thenReturn(false);
    final var msg = new SimpleMsg("msg-1", "hello".getBytes(StandardCharsets.UTF_8), Instant.now());

    // Act
    final var accepted = handler.test(msg);

    // Assert
    assertTrue(accepted);
    verify(mockLogger, never()).log(eq(Level.INFO), anyString());
  }

  @Test
  void shouldUseCustomLogLevel() {
    // Arrange
    when(mockLogger.isLoggable(any(Level.class))).thenReturn(true);
    final var customHandler = new LoggingMessageHandler(mockLogger, Level.WARNING);

    // Act
    customHandler.test(new SimpleMsg("msg-1", new byte[0], Instant.now()));

    // Assert
    verify(mockLogger).log(eq(Level.WARNING), anyString());
    verify(mockLogger, never()).log(eq(Level.INFO), anyString());
  }

  @Test
  void shouldCollapseJsonPayload() {
    // Arrange
    final var json = """
      {
        "name": "kbridge"
      }""";

    // Act
    final var formatted = handler.formatPayload(json.getBytes(StandardCharsets.UTF_8));

    // Assert
    assertEquals("{\"name\":\"kbridge\"}", formatted);
  }

  @Test
  void shouldKeepTextPayload() {
    // Act
    final var formatted = handler.formatPayload("Hello, world!".getBytes(StandardCharsets.UTF_8));

    // Assert
    assertEquals("Hello, world!", formatted);
  }

  @Test
  void shouldKeepMalformedJsonAsText() {
    // Act
    final var formatted = handler.formatPayload("{not json}".getBytes(StandardCharsets.UTF_8));

    // Assert
    assertEquals("{not json}", formatted);
  }

  @Test
  void shouldEncodeBinaryPayloadAsBase64() {
    // Arrange
    final var binary = new byte[] { (byte) 0xC3, (byte) 0x28, (byte) 0xFF };

    // Act
    final var formatted = handler.formatPayload(binary);

    // Assert
    assertEquals(Base64.getEncoder().encodeToString(binary), formatted);
  }

  @Test
  void shouldDescribeEmptyPayload() {
    // Act & Assert
    assertEquals("empty", handler.formatPayload(new byte[0]));
  }
}

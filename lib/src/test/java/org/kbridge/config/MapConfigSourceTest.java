package org.kbridge.config;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MapConfigSourceTest {

  @Test
  void shouldSplitStringListsOnCommasAndWhitespace() {
    // Arrange
    final var config = new MapConfigSource(Map.of("kafka_topics", "orders, payments  refunds"));

    // Act
    final var topics = config.getStringList("kafka_topics");

    // Assert
    assertEquals(List.of("orders", "payments", "refunds"), topics);
  }

  @Test
  void shouldReadCollectionsElementWise() {
    // Arrange
    final var config = new MapConfigSource(Map.of("kafka_topics", List.of("orders", "payments")));

    // Act & Assert
    assertEquals(List.of("orders", "payments"), config.getStringList("kafka_topics"));
    assertEquals("orders,payments", config.getString("kafka_topics"));
  }

  @Test
  void shouldReportUnsetKeys() {
    // Arrange
    final var config = new MapConfigSource(Map.of("blank", "   ", "empty", List.of()));

    // Act & Assert
    assertFalse(config.isSet("missing"));
    assertFalse(config.isSet("blank"));
    assertFalse(config.isSet("empty"));
    assertEquals("", config.getString("missing"));
    assertEquals(List.of(), config.getStringList("missing"));
    assertEquals(Map.of(), config.getStringMap("missing"));
  }

  @Test
  void shouldReadMapValues() {
    // Arrange
    final var config = new MapConfigSource(Map.of("kafka_config", Map.of("linger.ms", 5)));

    // Act
    final var settings = config.getStringMap("kafka_config");

    // Assert
    assertEquals(Map.of("linger.ms", "5"), settings);
  }

  @Test
  void shouldParsePairStrings() {
    // Arrange
    final var config = new MapConfigSource(Map.of("kafka_config", "  linger.ms=5\tacks=all  "));

    // Act
    final var settings = config.getStringMap("kafka_config");

    // Assert
    assertEquals(Map.of("linger.ms", "5", "acks", "all"), settings);
  }

  @Test
  void shouldKeepEmptyValuesInPairs() {
    // Act
    final var settings = AbstractConfigSource.parsePairs("kafka_config", "client.rack=");

    // Assert
    assertEquals(Map.of("client.rack", ""), settings);
  }
}

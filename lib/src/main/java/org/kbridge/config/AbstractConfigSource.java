package org.kbridge.config;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Base {@link ConfigSource} that converts raw values to strings, lists and maps. Subclasses only
 * provide the lookup.
 */
public abstract class AbstractConfigSource implements ConfigSource {

  private static final Pattern LIST_SEPARATOR = Pattern.compile("[,\\s]+");
  private static final Pattern PAIR_SEPARATOR = Pattern.compile("\\s+");

  /**
   * Looks up the raw value of a key.
   *
   * @param key the configuration key
   * @return the raw value, or null if absent
   */
  protected abstract Object lookup(String key);

  @Override
  public boolean isSet(final String key) {
    final var value = lookup(key);
    if (value == null) {
      return false;
    }
    if (value instanceof Collection<?> collection) {
      return !collection.isEmpty();
    }
    if (value instanceof Map<?, ?> map) {
      return !map.isEmpty();
    }
    return !String.valueOf(value).isBlank();
  }

  @Override
  public String getString(final String key) {
    final var value = lookup(key);
    if (value == null) {
      return "";
    }
    if (value instanceof Collection<?> collection) {
      return collection.stream().map(String::valueOf).collect(Collectors.joining(","));
    }
    return String.valueOf(value).trim();
  }

  @Override
  public List<String> getStringList(final String key) {
    final var value = lookup(key);
    if (value == null) {
      return List.of();
    }
    final Stream<String> elements = value instanceof Collection<?> collection
      ? collection.stream().map(String::valueOf).flatMap(LIST_SEPARATOR::splitAsStream)
      : LIST_SEPARATOR.splitAsStream(String.valueOf(value));
    return elements.map(String::trim).filter(s -> !s.isEmpty()).toList();
  }

  @Override
  public Map<String, String> getStringMap(final String key) {
    final var value = lookup(key);
    if (value == null) {
      return Map.of();
    }
    if (value instanceof Map<?, ?> map) {
      final var result = new LinkedHashMap<String, String>();
      map.forEach((k, v) -> result.put(String.valueOf(k), String.valueOf(v)));
      return result;
    }
    return parsePairs(key, String.valueOf(value));
  }

  /**
   * Parses whitespace separated {@code key=value} pairs. Each pair is split on its first {@code =},
   * so values may contain further {@code =} characters.
   *
   * @param key the configuration key the pairs were read from, for error messages
   * @param pairs the raw string
   * @return the parsed entries in declaration order
   * @throws ConfigValidationException if a pair has no {@code =} or an empty name
   */
  static Map<String, String> parsePairs(final String key, final String pairs) {
    final var result = new LinkedHashMap<String, String>();
    Arrays
      .stream(PAIR_SEPARATOR.split(pairs.trim()))
      .filter(token -> !token.isEmpty())
      .forEach(token -> {
        final var separator = token.indexOf('=');
        if (separator <= 0) {
          throw new ConfigValidationException("malformed entry '%s' in %s, expected key=value".formatted(token, key));
        }
        result.put(token.substring(0, separator), token.substring(separator + 1));
      });
    return result;
  }
}

package org.kbridge.config;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of externally supplied key/value configuration.
 *
 * <p>Implementations decide where values come from (a map, the process environment, ...). Missing
 * keys never cause an exception; they read as empty values and {@link #isSet(String)} reports
 * {@code false}.
 */
public interface ConfigSource {
  /**
   * Returns whether a non-blank value exists for the key.
   *
   * @param key the configuration key
   * @return {@code true} if the key has a value
   */
  boolean isSet(String key);

  /**
   * Returns the value of the key as a string.
   *
   * @param key the configuration key
   * @return the value, or an empty string if not set
   */
  String getString(String key);

  /**
   * Returns the value of the key as a list. String values are split on commas and whitespace.
   *
   * @param key the configuration key
   * @return the non-blank list elements, or an empty list if not set
   */
  List<String> getStringList(String key);

  /**
   * Returns the value of the key as a map. String values are read as whitespace separated {@code
   * key=value} pairs, each split on its first {@code =}.
   *
   * @param key the configuration key
   * @return the entries, or an empty map if not set
   * @throws ConfigValidationException if a pair is malformed
   */
  Map<String, String> getStringMap(String key);
}

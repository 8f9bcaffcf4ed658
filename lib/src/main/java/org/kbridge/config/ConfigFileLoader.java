package org.kbridge.config;

import com.dslplatform.json.DslJson;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads client settings from an override file. Supported types are {@code .yaml}/{@code .yml},
 * {@code .json} and {@code .properties}. YAML and JSON files must hold a flat mapping of scalar
 * values.
 */
final class ConfigFileLoader {

  private static final DslJson<Object> DSL_JSON = new DslJson<>();

  private ConfigFileLoader() {}

  /**
   * Loads the settings in a file.
   *
   * @param path the file to read
   * @return the settings in file order
   * @throws ConfigFileException if the file is missing, unreadable, malformed or of an unknown type
   */
  static Map<String, Object> load(final Path path) {
    if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
      throw new ConfigFileException(path, "file does not exist or is not readable");
    }

    final var name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(".properties")) {
      return loadProperties(path);
    }
    if (name.endsWith(".json")) {
      return loadJson(path);
    }
    if (name.endsWith(".yaml") || name.endsWith(".yml")) {
      return loadYaml(path);
    }
    throw new ConfigFileException(path, "unsupported file type, expected .yaml, .yml, .json or .properties");
  }

  private static Map<String, Object> loadProperties(final Path path) {
    final var properties = new Properties();
    try (final var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      properties.load(reader);
    } catch (final IOException | IllegalArgumentException e) {
      throw new ConfigFileException(path, "unable to read properties", e);
    }
    final var result = new LinkedHashMap<String, Object>();
    properties.stringPropertyNames().forEach(key -> result.put(key, properties.getProperty(key)));
    return result;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> loadJson(final Path path) {
    final Map<String, Object> parsed;
    try (final var in = Files.newInputStream(path)) {
      parsed = DSL_JSON.deserialize(Map.class, in);
    } catch (final IOException e) {
      throw new ConfigFileException(path, "unable to parse json", e);
    }
    if (parsed == null) {
      throw new ConfigFileException(path, "expected a json object");
    }
    return scalarSettings(path, parsed);
  }

  private static Map<String, Object> loadYaml(final Path path) {
    final Object parsed;
    try (final var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      parsed = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (final IOException | YAMLException e) {
      throw new ConfigFileException(path, "unable to parse yaml", e);
    }
    if (!(parsed instanceof Map<?, ?> mapping)) {
      throw new ConfigFileException(path, "expected a yaml mapping");
    }
    return scalarSettings(path, mapping);
  }

  private static Map<String, Object> scalarSettings(final Path path, final Map<?, ?> parsed) {
    final var result = new LinkedHashMap<String, Object>();
    parsed.forEach((key, value) -> {
      if (value == null || value instanceof Map || value instanceof Collection) {
        throw new ConfigFileException(path, "setting '%s' must be a string, number or boolean".formatted(key));
      }
      result.put(String.valueOf(key), value);
    });
    return result;
  }
}

package org.kbridge.config;

import java.nio.file.Path;

/** Raised when a configured override file is missing, unreadable, malformed or of an unsupported type. */
public class ConfigFileException extends ConfigValidationException {

  private final Path path;

  public ConfigFileException(final Path path, final String message) {
    super("config file %s: %s".formatted(path, message));
    this.path = path;
  }

  public ConfigFileException(final Path path, final String message, final Throwable cause) {
    super("config file %s: %s".formatted(path, message), cause);
    this.path = path;
  }

  public Path getPath() {
    return path;
  }
}

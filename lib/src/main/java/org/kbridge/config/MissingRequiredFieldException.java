package org.kbridge.config;

import java.util.List;

/** Raised when required configuration keys are absent or empty. */
public class MissingRequiredFieldException extends ConfigValidationException {

  private final List<String> missingKeys;

  public MissingRequiredFieldException(final Role role, final List<String> missingKeys) {
    super("%s must be set for kafka %s".formatted(String.join(", ", missingKeys), role.displayName()));
    this.missingKeys = List.copyOf(missingKeys);
  }

  public List<String> getMissingKeys() {
    return missingKeys;
  }
}

package com.intentregistry.domain.intents;

import java.util.Objects;

/**
 * Base type for every rejected registry operation. A rejection never leaves partial state
 * behind; callers decide whether to resubmit.
 */
public abstract class RegistryException extends RuntimeException {
  private final RegistryErrorCode code;

  protected RegistryException(
      RegistryErrorCode code, ErrorCategory expectedCategory, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code must not be null");
    if (code.category() != expectedCategory) {
      throw new IllegalArgumentException(
          "Error code " + code + " does not belong to category " + expectedCategory);
    }
  }

  public RegistryErrorCode code() {
    return code;
  }

  public ErrorCategory category() {
    return code.category();
  }

  public static RegistryException of(RegistryErrorCode code, String message) {
    return switch (code.category()) {
      case VALIDATION -> new RegistryValidationException(code, message);
      case STATE -> new RegistryStateException(code, message);
      case AUTHORIZATION -> new RegistryAuthorizationException(code, message);
      case CAPACITY -> new RegistryCapacityException(code, message);
      case FUNDS -> new RegistryFundsException(code, message);
    };
  }
}

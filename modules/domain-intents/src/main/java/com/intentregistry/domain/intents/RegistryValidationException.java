package com.intentregistry.domain.intents;

public class RegistryValidationException extends RegistryException {
  public RegistryValidationException(RegistryErrorCode code, String message) {
    super(code, ErrorCategory.VALIDATION, message);
  }
}

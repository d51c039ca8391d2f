package com.intentregistry.domain.intents;

public class RegistryStateException extends RegistryException {
  public RegistryStateException(RegistryErrorCode code, String message) {
    super(code, ErrorCategory.STATE, message);
  }
}

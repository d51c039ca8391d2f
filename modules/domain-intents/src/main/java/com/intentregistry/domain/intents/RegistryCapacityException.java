package com.intentregistry.domain.intents;

public class RegistryCapacityException extends RegistryException {
  public RegistryCapacityException(RegistryErrorCode code, String message) {
    super(code, ErrorCategory.CAPACITY, message);
  }
}

package com.intentregistry.domain.intents;

public class RegistryAuthorizationException extends RegistryException {
  public RegistryAuthorizationException(RegistryErrorCode code, String message) {
    super(code, ErrorCategory.AUTHORIZATION, message);
  }
}

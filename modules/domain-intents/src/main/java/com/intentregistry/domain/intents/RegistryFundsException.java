package com.intentregistry.domain.intents;

public class RegistryFundsException extends RegistryException {
  public RegistryFundsException(RegistryErrorCode code, String message) {
    super(code, ErrorCategory.FUNDS, message);
  }
}

package com.intentregistry.domain.intents;

public enum RegistryErrorCode {
  INVALID_SIDE(ErrorCategory.VALIDATION),
  ZERO_AMOUNT(ErrorCategory.VALIDATION),
  AMOUNT_OUT_OF_BOUNDS(ErrorCategory.VALIDATION),
  BOUNDS_INVALID(ErrorCategory.VALIDATION),
  ZERO_ADDRESS(ErrorCategory.VALIDATION),
  INVALID_ADDRESS(ErrorCategory.VALIDATION),
  INVALID_SYMBOL(ErrorCategory.VALIDATION),
  FEE_TOO_HIGH(ErrorCategory.VALIDATION),

  NOT_FOUND(ErrorCategory.STATE),
  ALREADY_EXECUTED(ErrorCategory.STATE),
  ALREADY_CANCELLED(ErrorCategory.STATE),
  PAUSED(ErrorCategory.STATE),
  REENTRANT_CALL(ErrorCategory.STATE),

  UNAUTHORIZED(ErrorCategory.AUTHORIZATION),
  NOT_OWNER(ErrorCategory.AUTHORIZATION),
  NOT_CONTROLLER(ErrorCategory.AUTHORIZATION),
  NOT_KEEPER(ErrorCategory.AUTHORIZATION),

  CAPACITY_EXCEEDED(ErrorCategory.CAPACITY),
  BULK_QUERY_TOO_LARGE(ErrorCategory.CAPACITY),

  INSUFFICIENT_FEE(ErrorCategory.FUNDS),
  TRANSFER_FAILED(ErrorCategory.FUNDS);

  private final ErrorCategory category;

  RegistryErrorCode(ErrorCategory category) {
    this.category = category;
  }

  public ErrorCategory category() {
    return category;
  }
}

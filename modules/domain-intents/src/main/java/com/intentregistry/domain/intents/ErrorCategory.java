package com.intentregistry.domain.intents;

public enum ErrorCategory {
  VALIDATION,
  STATE,
  AUTHORIZATION,
  CAPACITY,
  FUNDS
}

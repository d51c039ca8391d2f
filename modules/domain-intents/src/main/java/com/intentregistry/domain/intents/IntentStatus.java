package com.intentregistry.domain.intents;

public enum IntentStatus {
  PENDING,
  EXECUTED,
  CANCELLED;

  public boolean isTerminal() {
    return this == EXECUTED || this == CANCELLED;
  }
}

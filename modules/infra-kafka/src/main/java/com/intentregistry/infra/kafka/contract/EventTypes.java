package com.intentregistry.infra.kafka.contract;

public final class EventTypes {
  public static final String INTENT_SUBMITTED = "IntentSubmitted";
  public static final String INTENT_EXECUTED = "IntentExecuted";
  public static final String INTENT_CANCELLED = "IntentCancelled";
  public static final String CONFIG_CHANGED = "ConfigChanged";
  public static final String PAUSE_TOGGLED = "Paused";
  public static final String TREASURY_TOPPED = "TreasuryTopped";
  public static final String TREASURY_WITHDRAWN = "TreasuryWithdrawn";

  private EventTypes() {}
}

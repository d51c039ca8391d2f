package com.intentregistry.infra.kafka.topics;

import java.util.List;

public final class TopicNames {
  public static final String INTENTS_SUBMITTED_V1 = "registry.intents.submitted.v1";
  public static final String INTENTS_EXECUTED_V1 = "registry.intents.executed.v1";
  public static final String INTENTS_CANCELLED_V1 = "registry.intents.cancelled.v1";
  public static final String CONFIG_CHANGED_V1 = "registry.config.changed.v1";
  public static final String TREASURY_MOVEMENTS_V1 = "registry.treasury.movements.v1";

  private TopicNames() {}

  public static List<String> all() {
    return List.of(
        INTENTS_SUBMITTED_V1,
        INTENTS_EXECUTED_V1,
        INTENTS_CANCELLED_V1,
        CONFIG_CHANGED_V1,
        TREASURY_MOVEMENTS_V1);
  }
}

package com.intentregistry.infra.kafka.producer;

import com.intentregistry.infra.kafka.contract.EventEnvelope;
import com.intentregistry.infra.kafka.contract.EventTypes;
import com.intentregistry.infra.kafka.contract.payload.IntentCancelledV1;
import com.intentregistry.infra.kafka.contract.payload.IntentExecutedV1;
import com.intentregistry.infra.kafka.contract.payload.IntentSubmittedV1;
import com.intentregistry.infra.kafka.topics.TopicNames;
import java.util.concurrent.CompletableFuture;
import org.springframework.kafka.support.SendResult;

/** Intent lifecycle events, keyed by intent id so one intent's history stays on one partition. */
public class IntentEventProducer {
  private static final int EVENT_VERSION_V1 = 1;

  private final EventPublisher eventPublisher;
  private final String producerName;

  public IntentEventProducer(EventPublisher eventPublisher, String producerName) {
    this.eventPublisher = eventPublisher;
    this.producerName = producerName;
  }

  public CompletableFuture<SendResult<String, String>> publishIntentSubmitted(
      IntentSubmittedV1 payload) {
    String key = requireKey(payload.intentId(), "payload.intentId");
    EventEnvelope<IntentSubmittedV1> envelope =
        EventEnvelope.of(
            EventTypes.INTENT_SUBMITTED, EVENT_VERSION_V1, payload.seq(), producerName, key, payload);
    return eventPublisher.publish(TopicNames.INTENTS_SUBMITTED_V1, key, envelope);
  }

  public CompletableFuture<SendResult<String, String>> publishIntentExecuted(
      IntentExecutedV1 payload) {
    String key = requireKey(payload.intentId(), "payload.intentId");
    EventEnvelope<IntentExecutedV1> envelope =
        EventEnvelope.of(
            EventTypes.INTENT_EXECUTED, EVENT_VERSION_V1, payload.seq(), producerName, key, payload);
    return eventPublisher.publish(TopicNames.INTENTS_EXECUTED_V1, key, envelope);
  }

  public CompletableFuture<SendResult<String, String>> publishIntentCancelled(
      IntentCancelledV1 payload) {
    String key = requireKey(payload.intentId(), "payload.intentId");
    EventEnvelope<IntentCancelledV1> envelope =
        EventEnvelope.of(
            EventTypes.INTENT_CANCELLED, EVENT_VERSION_V1, payload.seq(), producerName, key, payload);
    return eventPublisher.publish(TopicNames.INTENTS_CANCELLED_V1, key, envelope);
  }

  private static String requireKey(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " must not be blank");
    }
    return value;
  }
}

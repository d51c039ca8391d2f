package com.intentregistry.infra.kafka.producer;

import com.intentregistry.infra.kafka.contract.EventEnvelope;
import com.intentregistry.infra.kafka.contract.EventTypes;
import com.intentregistry.infra.kafka.contract.payload.TreasuryToppedV1;
import com.intentregistry.infra.kafka.contract.payload.TreasuryWithdrawnV1;
import com.intentregistry.infra.kafka.topics.TopicNames;
import java.util.concurrent.CompletableFuture;
import org.springframework.kafka.support.SendResult;

public class TreasuryEventProducer {
  private static final int EVENT_VERSION_V1 = 1;
  private static final String TREASURY_KEY = "treasury";

  private final EventPublisher eventPublisher;
  private final String producerName;

  public TreasuryEventProducer(EventPublisher eventPublisher, String producerName) {
    this.eventPublisher = eventPublisher;
    this.producerName = producerName;
  }

  public CompletableFuture<SendResult<String, String>> publishTreasuryTopped(
      TreasuryToppedV1 payload) {
    EventEnvelope<TreasuryToppedV1> envelope =
        EventEnvelope.of(
            EventTypes.TREASURY_TOPPED,
            EVENT_VERSION_V1,
            payload.seq(),
            producerName,
            TREASURY_KEY,
            payload);
    return eventPublisher.publish(TopicNames.TREASURY_MOVEMENTS_V1, TREASURY_KEY, envelope);
  }

  public CompletableFuture<SendResult<String, String>> publishTreasuryWithdrawn(
      TreasuryWithdrawnV1 payload) {
    EventEnvelope<TreasuryWithdrawnV1> envelope =
        EventEnvelope.of(
            EventTypes.TREASURY_WITHDRAWN,
            EVENT_VERSION_V1,
            payload.seq(),
            producerName,
            TREASURY_KEY,
            payload);
    return eventPublisher.publish(TopicNames.TREASURY_MOVEMENTS_V1, TREASURY_KEY, envelope);
  }
}

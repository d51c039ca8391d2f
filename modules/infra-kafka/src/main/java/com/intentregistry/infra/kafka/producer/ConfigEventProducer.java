package com.intentregistry.infra.kafka.producer;

import com.intentregistry.infra.kafka.contract.EventEnvelope;
import com.intentregistry.infra.kafka.contract.EventTypes;
import com.intentregistry.infra.kafka.contract.payload.ConfigChangedV1;
import com.intentregistry.infra.kafka.contract.payload.PauseToggledV1;
import com.intentregistry.infra.kafka.topics.TopicNames;
import java.util.concurrent.CompletableFuture;
import org.springframework.kafka.support.SendResult;

public class ConfigEventProducer {
  private static final int EVENT_VERSION_V1 = 1;
  private static final String CONFIG_KEY = "registry-config";

  private final EventPublisher eventPublisher;
  private final String producerName;

  public ConfigEventProducer(EventPublisher eventPublisher, String producerName) {
    this.eventPublisher = eventPublisher;
    this.producerName = producerName;
  }

  public CompletableFuture<SendResult<String, String>> publishConfigChanged(
      ConfigChangedV1 payload) {
    if (payload.setting() == null || payload.setting().isBlank()) {
      throw new IllegalArgumentException("payload.setting must not be blank");
    }
    EventEnvelope<ConfigChangedV1> envelope =
        EventEnvelope.of(
            EventTypes.CONFIG_CHANGED,
            EVENT_VERSION_V1,
            payload.seq(),
            producerName,
            CONFIG_KEY,
            payload);
    return eventPublisher.publish(TopicNames.CONFIG_CHANGED_V1, CONFIG_KEY, envelope);
  }

  public CompletableFuture<SendResult<String, String>> publishPauseToggled(PauseToggledV1 payload) {
    EventEnvelope<PauseToggledV1> envelope =
        EventEnvelope.of(
            EventTypes.PAUSE_TOGGLED,
            EVENT_VERSION_V1,
            payload.seq(),
            producerName,
            CONFIG_KEY,
            payload);
    return eventPublisher.publish(TopicNames.CONFIG_CHANGED_V1, CONFIG_KEY, envelope);
  }
}

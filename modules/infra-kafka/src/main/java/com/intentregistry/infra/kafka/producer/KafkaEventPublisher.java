package com.intentregistry.infra.kafka.producer;

import com.intentregistry.infra.kafka.contract.EventEnvelope;
import com.intentregistry.infra.kafka.contract.EventHeaders;
import com.intentregistry.infra.kafka.observability.KafkaTelemetry;
import com.intentregistry.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.intentregistry.infra.kafka.topics.TopicNameValidator;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

public class KafkaEventPublisher implements EventPublisher {
  private static final Logger log = LoggerFactory.getLogger(KafkaEventPublisher.class);

  private final KafkaTemplate<String, String> kafkaTemplate;
  private final EventEnvelopeJsonCodec codec;
  private final KafkaTelemetry telemetry;
  private final Duration sendTimeout;

  public KafkaEventPublisher(
      KafkaTemplate<String, String> kafkaTemplate,
      EventEnvelopeJsonCodec codec,
      KafkaTelemetry telemetry,
      Duration sendTimeout) {
    this.kafkaTemplate = kafkaTemplate;
    this.codec = codec;
    this.telemetry = telemetry;
    this.sendTimeout = sendTimeout == null ? Duration.ZERO : sendTimeout;
  }

  @Override
  public <T> CompletableFuture<SendResult<String, String>> publish(
      String topic, String key, EventEnvelope<T> envelope) {
    TopicNameValidator.assertValid(topic);
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("Kafka key must not be blank");
    }

    long started = System.nanoTime();
    ProducerRecord<String, String> record =
        new ProducerRecord<>(topic, key, codec.encode(envelope));
    addHeaders(record, envelope);

    CompletableFuture<SendResult<String, String>> sendFuture = kafkaTemplate.send(record);
    if (!sendTimeout.isZero() && !sendTimeout.isNegative()) {
      sendFuture = sendFuture.orTimeout(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    CompletableFuture<SendResult<String, String>> result = new CompletableFuture<>();
    sendFuture.whenComplete(
        (sendResult, throwable) -> {
          if (throwable == null) {
            telemetry.onPublishSuccess(
                topic, key, envelope.eventType(), System.nanoTime() - started);
            result.complete(sendResult);
            return;
          }

          KafkaPublishException publishException =
              wrapPublishException(topic, key, envelope, throwable);
          log.warn(
              "Kafka publish failed topic={} key={} eventType={} seq={}",
              topic,
              key,
              envelope.eventType(),
              envelope.sequence(),
              publishException.getCause());
          telemetry.onPublishFailure(topic, key, envelope.eventType(), publishException);
          result.completeExceptionally(publishException);
        });
    return result;
  }

  private static KafkaPublishException wrapPublishException(
      String topic, String key, EventEnvelope<?> envelope, Throwable throwable) {
    Throwable cause = throwable;
    if (throwable instanceof CompletionException completionException
        && completionException.getCause() != null) {
      cause = completionException.getCause();
    }
    if (cause instanceof KafkaPublishException existing) {
      return existing;
    }

    String verb = cause instanceof TimeoutException ? "Timed out publishing" : "Failed to publish";
    String message =
        String.format(
            "%s %s seq=%d to Kafka topic=%s key=%s",
            verb, envelope.eventType(), envelope.sequence(), topic, key);
    return new KafkaPublishException(topic, key, envelope.eventType(), message, cause);
  }

  private static void addHeaders(ProducerRecord<String, String> record, EventEnvelope<?> envelope) {
    addHeader(record, EventHeaders.X_EVENT_TYPE, envelope.eventType());
    addHeader(record, EventHeaders.X_EVENT_VERSION, Integer.toString(envelope.eventVersion()));
    addHeader(record, EventHeaders.X_CORRELATION_ID, envelope.correlationId());
    addHeader(record, EventHeaders.X_SEQUENCE, Long.toString(envelope.sequence()));
    addHeader(record, EventHeaders.CONTENT_TYPE, EventHeaders.APPLICATION_JSON);
  }

  private static void addHeader(ProducerRecord<String, String> record, String name, String value) {
    record.headers().add(name, value.getBytes(StandardCharsets.UTF_8));
  }
}

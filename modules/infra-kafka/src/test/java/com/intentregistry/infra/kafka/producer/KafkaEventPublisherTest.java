package com.intentregistry.infra.kafka.producer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.intentregistry.infra.kafka.contract.EventEnvelope;
import com.intentregistry.infra.kafka.contract.EventHeaders;
import com.intentregistry.infra.kafka.contract.EventTypes;
import com.intentregistry.infra.kafka.contract.payload.IntentSubmittedV1;
import com.intentregistry.infra.kafka.observability.KafkaTelemetry;
import com.intentregistry.infra.kafka.observability.NoOpKafkaTelemetry;
import com.intentregistry.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.intentregistry.infra.kafka.serde.EventObjectMapperFactory;
import com.intentregistry.infra.kafka.topics.TopicNames;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

class KafkaEventPublisherTest {
  private final EventEnvelopeJsonCodec codec =
      new EventEnvelopeJsonCodec(EventObjectMapperFactory.create());

  @Test
  void shouldPublishWithRequiredHeadersAndKey() throws Exception {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);
    KafkaEventPublisher publisher =
        new KafkaEventPublisher(kafkaTemplate, codec, new NoOpKafkaTelemetry(), Duration.ZERO);

    ProducerRecord<String, String> mockedResultRecord =
        new ProducerRecord<>(TopicNames.INTENTS_SUBMITTED_V1, "42", "{}");
    CompletableFuture<SendResult<String, String>> sendFuture =
        CompletableFuture.completedFuture(new SendResult<>(mockedResultRecord, null));
    when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(sendFuture);

    publisher.publish(TopicNames.INTENTS_SUBMITTED_V1, "42", submittedEnvelope()).get();

    @SuppressWarnings("unchecked")
    ArgumentCaptor<ProducerRecord<String, String>> captor =
        ArgumentCaptor.forClass(ProducerRecord.class);
    verify(kafkaTemplate).send(captor.capture());
    ProducerRecord<String, String> actualRecord = captor.getValue();

    assertEquals(TopicNames.INTENTS_SUBMITTED_V1, actualRecord.topic());
    assertEquals("42", actualRecord.key());
    assertTrue(actualRecord.value().contains("\"amount\":\"1000000000000000\""));
    assertEquals(EventTypes.INTENT_SUBMITTED, headerValue(actualRecord, EventHeaders.X_EVENT_TYPE));
    assertEquals("1", headerValue(actualRecord, EventHeaders.X_EVENT_VERSION));
    assertEquals("7", headerValue(actualRecord, EventHeaders.X_SEQUENCE));
    assertEquals(
        "IntentSubmitted:7", headerValue(actualRecord, EventHeaders.X_CORRELATION_ID));
    assertEquals(
        EventHeaders.APPLICATION_JSON, headerValue(actualRecord, EventHeaders.CONTENT_TYPE));
  }

  @Test
  void shouldWrapPublishFailureWithKafkaPublishException() {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);
    KafkaEventPublisher publisher =
        new KafkaEventPublisher(kafkaTemplate, codec, new NoOpKafkaTelemetry(), Duration.ZERO);

    CompletableFuture<SendResult<String, String>> failedFuture = new CompletableFuture<>();
    failedFuture.completeExceptionally(new IllegalStateException("broker unavailable"));
    when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(failedFuture);

    ExecutionException ex =
        assertThrows(
            ExecutionException.class,
            () ->
                publisher
                    .publish(TopicNames.INTENTS_SUBMITTED_V1, "42", submittedEnvelope())
                    .get());
    assertEquals(KafkaPublishException.class, ex.getCause().getClass());
    KafkaPublishException publishException = (KafkaPublishException) ex.getCause();
    assertEquals(TopicNames.INTENTS_SUBMITTED_V1, publishException.getTopic());
    assertEquals(EventTypes.INTENT_SUBMITTED, publishException.getEventType());
  }

  @Test
  void shouldReportFailureToTelemetryWhenSendFails() {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);
    KafkaTelemetry telemetry = mock(KafkaTelemetry.class);
    KafkaEventPublisher publisher =
        new KafkaEventPublisher(kafkaTemplate, codec, telemetry, Duration.ZERO);

    CompletableFuture<SendResult<String, String>> failedFuture = new CompletableFuture<>();
    failedFuture.completeExceptionally(new IllegalStateException("broker unavailable"));
    when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(failedFuture);

    CompletableFuture<SendResult<String, String>> result =
        publisher.publish(TopicNames.INTENTS_SUBMITTED_V1, "42", submittedEnvelope());

    assertTrue(result.isCompletedExceptionally());
    verify(telemetry)
        .onPublishFailure(
            eq(TopicNames.INTENTS_SUBMITTED_V1),
            eq("42"),
            eq(EventTypes.INTENT_SUBMITTED),
            any(KafkaPublishException.class));
    verify(telemetry, never()).onPublishSuccess(anyString(), anyString(), anyString(), anyLong());
  }

  @Test
  void shouldRejectUnknownTopicNames() {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);
    KafkaEventPublisher publisher =
        new KafkaEventPublisher(kafkaTemplate, codec, new NoOpKafkaTelemetry(), Duration.ZERO);

    assertThrows(
        IllegalArgumentException.class,
        () -> publisher.publish("Intents_Submitted", "42", submittedEnvelope()));
  }

  private static EventEnvelope<IntentSubmittedV1> submittedEnvelope() {
    return EventEnvelope.of(
        EventTypes.INTENT_SUBMITTED,
        1,
        7L,
        "registry-api",
        "42",
        new IntentSubmittedV1(
            "42",
            "0x1111111111111111111111111111111111111111",
            "BUY",
            "1000000000000000",
            "100",
            "0x" + "ab".repeat(32),
            7L));
  }

  private static String headerValue(ProducerRecord<String, String> record, String headerName) {
    Header header = record.headers().lastHeader(headerName);
    assertNotNull(header, "Expected header " + headerName + " to exist");
    return new String(header.value(), StandardCharsets.UTF_8);
  }
}

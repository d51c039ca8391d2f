package com.intentregistry.registryapi.events;

import com.intentregistry.infra.kafka.producer.ConfigEventProducer;
import com.intentregistry.infra.kafka.producer.IntentEventProducer;
import com.intentregistry.infra.kafka.producer.TreasuryEventProducer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Kafka when the publishing infrastructure is enabled, otherwise the application log. */
@Configuration
public class RegistryEventsConfiguration {
  @Bean
  @ConditionalOnProperty(prefix = "infra.kafka", name = "enabled", havingValue = "true")
  public RegistryEventSink kafkaRegistryEventSink(
      IntentEventProducer intentEventProducer,
      ConfigEventProducer configEventProducer,
      TreasuryEventProducer treasuryEventProducer) {
    return new KafkaRegistryEventSink(
        intentEventProducer, configEventProducer, treasuryEventProducer);
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "infra.kafka",
      name = "enabled",
      havingValue = "false",
      matchIfMissing = true)
  public RegistryEventSink loggingRegistryEventSink() {
    return new LoggingRegistryEventSink();
  }
}

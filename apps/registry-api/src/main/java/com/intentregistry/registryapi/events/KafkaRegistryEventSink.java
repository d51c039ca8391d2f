package com.intentregistry.registryapi.events;

import com.intentregistry.infra.kafka.contract.payload.ConfigChangedV1;
import com.intentregistry.infra.kafka.contract.payload.IntentCancelledV1;
import com.intentregistry.infra.kafka.contract.payload.IntentExecutedV1;
import com.intentregistry.infra.kafka.contract.payload.IntentSubmittedV1;
import com.intentregistry.infra.kafka.contract.payload.PauseToggledV1;
import com.intentregistry.infra.kafka.contract.payload.TreasuryToppedV1;
import com.intentregistry.infra.kafka.contract.payload.TreasuryWithdrawnV1;
import com.intentregistry.infra.kafka.producer.ConfigEventProducer;
import com.intentregistry.infra.kafka.producer.IntentEventProducer;
import com.intentregistry.infra.kafka.producer.TreasuryEventProducer;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.support.SendResult;

/**
 * Forwards committed registry events to Kafka. Publishing is asynchronous; a failed send is
 * logged and does not roll back the transition that produced it.
 */
public class KafkaRegistryEventSink implements RegistryEventSink {
  private static final Logger log = LoggerFactory.getLogger(KafkaRegistryEventSink.class);

  private final IntentEventProducer intentEventProducer;
  private final ConfigEventProducer configEventProducer;
  private final TreasuryEventProducer treasuryEventProducer;

  public KafkaRegistryEventSink(
      IntentEventProducer intentEventProducer,
      ConfigEventProducer configEventProducer,
      TreasuryEventProducer treasuryEventProducer) {
    this.intentEventProducer = intentEventProducer;
    this.configEventProducer = configEventProducer;
    this.treasuryEventProducer = treasuryEventProducer;
  }

  @Override
  public void publish(RegistryEvent event) {
    CompletableFuture<SendResult<String, String>> sent = dispatch(event);
    sent.whenComplete(
        (result, error) -> {
          if (error != null) {
            log.warn(
                "Failed to publish registry event type={} seq={}",
                event.getClass().getSimpleName(),
                event.seq(),
                error);
          }
        });
  }

  private CompletableFuture<SendResult<String, String>> dispatch(RegistryEvent event) {
    if (event instanceof RegistryEvent.IntentSubmitted submitted) {
      return intentEventProducer.publishIntentSubmitted(
          new IntentSubmittedV1(
              Long.toString(submitted.intentId()),
              submitted.submitter().value(),
              submitted.side().name(),
              submitted.amount().toString(),
              submitted.limitPrice().toString(),
              submitted.symbolHash().value(),
              submitted.seq()));
    }
    if (event instanceof RegistryEvent.IntentExecuted executed) {
      return intentEventProducer.publishIntentExecuted(
          new IntentExecutedV1(
              Long.toString(executed.intentId()),
              executed.executor().value(),
              executed.executedAmount().toString(),
              executed.avgPrice().toString(),
              executed.seq()));
    }
    if (event instanceof RegistryEvent.IntentCancelled cancelled) {
      return intentEventProducer.publishIntentCancelled(
          new IntentCancelledV1(
              Long.toString(cancelled.intentId()),
              cancelled.cancelledBy().value(),
              cancelled.seq()));
    }
    if (event instanceof RegistryEvent.ControllerChanged changed) {
      return configEventProducer.publishConfigChanged(
          new ConfigChangedV1(
              "CONTROLLER",
              changed.previous().value(),
              changed.current().value(),
              changed.seq()));
    }
    if (event instanceof RegistryEvent.KeeperChanged changed) {
      return configEventProducer.publishConfigChanged(
          new ConfigChangedV1(
              "KEEPER", changed.previous().value(), changed.current().value(), changed.seq()));
    }
    if (event instanceof RegistryEvent.BoundsChanged changed) {
      return configEventProducer.publishConfigChanged(
          new ConfigChangedV1(
              "BOUNDS", null, changed.minAmount() + ".." + changed.maxAmount(), changed.seq()));
    }
    if (event instanceof RegistryEvent.FeeChanged changed) {
      return configEventProducer.publishConfigChanged(
          new ConfigChangedV1(
              "FEE",
              Integer.toString(changed.previousBps()),
              Integer.toString(changed.currentBps()),
              changed.seq()));
    }
    if (event instanceof RegistryEvent.PauseToggled toggled) {
      return configEventProducer.publishPauseToggled(
          new PauseToggledV1(toggled.paused(), toggled.seq()));
    }
    if (event instanceof RegistryEvent.TreasuryTopped topped) {
      return treasuryEventProducer.publishTreasuryTopped(
          new TreasuryToppedV1(topped.amount().toString(), topped.from().value(), topped.seq()));
    }
    if (event instanceof RegistryEvent.TreasuryWithdrawn withdrawn) {
      return treasuryEventProducer.publishTreasuryWithdrawn(
          new TreasuryWithdrawnV1(
              withdrawn.to().value(), withdrawn.amount().toString(), withdrawn.seq()));
    }
    throw new IllegalArgumentException("Unsupported registry event " + event.getClass().getName());
  }
}

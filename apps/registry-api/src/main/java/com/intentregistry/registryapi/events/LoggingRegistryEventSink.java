package com.intentregistry.registryapi.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingRegistryEventSink implements RegistryEventSink {
  private static final Logger log = LoggerFactory.getLogger(LoggingRegistryEventSink.class);

  @Override
  public void publish(RegistryEvent event) {
    log.info(
        "Registry event type={} seq={} event={}",
        event.getClass().getSimpleName(),
        event.seq(),
        event);
  }
}

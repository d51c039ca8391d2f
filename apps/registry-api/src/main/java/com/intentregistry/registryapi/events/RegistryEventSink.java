package com.intentregistry.registryapi.events;

public interface RegistryEventSink {
  void publish(RegistryEvent event);
}

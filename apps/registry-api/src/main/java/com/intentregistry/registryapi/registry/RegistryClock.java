package com.intentregistry.registryapi.registry;

import com.intentregistry.registryapi.store.KeyValueTransaction;
import org.springframework.stereotype.Component;

/** Logical clock persisted with the registry state. The first value handed out is 1. */
@Component
public class RegistryClock {
  private static final String CLOCK_KEY = "registry:clock";

  public long current(KeyValueTransaction tx) {
    return tx.readLong(CLOCK_KEY);
  }

  public long advance(KeyValueTransaction tx) {
    long next = current(tx) + 1;
    tx.writeLong(CLOCK_KEY, next);
    return next;
  }

  /** Only valid while the writer lock that handed out the later values is still held. */
  public void rewind(KeyValueTransaction tx, long value) {
    if (value < 0 || value > current(tx)) {
      throw new IllegalStateException("Cannot rewind clock from " + current(tx) + " to " + value);
    }
    tx.writeLong(CLOCK_KEY, value);
  }
}

package com.intentregistry.registryapi.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intentregistry.registryapi.store.KeyValueStore;
import com.intentregistry.registryapi.store.KeyValueTransaction;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Serializes every registry write behind one fair lock. Readers never take the lock and only
 * observe committed state.
 */
@Component
public class RegistryTransactions {
  private final ReentrantLock writeLock = new ReentrantLock(true);
  private final KeyValueStore store;
  private final ObjectMapper objectMapper;

  public RegistryTransactions(KeyValueStore store, ObjectMapper objectMapper) {
    this.store = store;
    this.objectMapper = objectMapper;
  }

  /** Runs {@code work} against a fresh staged transaction and commits it if no exception escapes. */
  public <T> T write(Function<KeyValueTransaction, T> work) {
    return exclusively(
        () -> {
          KeyValueTransaction tx = new KeyValueTransaction(store, objectMapper);
          T result = work.apply(tx);
          tx.commit();
          return result;
        });
  }

  public <T> T read(Function<KeyValueTransaction, T> work) {
    return work.apply(new KeyValueTransaction(store, objectMapper));
  }

  public <T> T exclusively(Supplier<T> work) {
    writeLock.lock();
    try {
      return work.get();
    } finally {
      writeLock.unlock();
    }
  }
}

package com.intentregistry.registryapi.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Staged view over a {@link KeyValueStore}. Reads see this transaction's own pending writes
 * layered over committed state; nothing reaches the store until {@link #commit()}.
 */
public class KeyValueTransaction {
  private final KeyValueStore store;
  private final ObjectMapper objectMapper;
  private final Map<String, String> staged = new LinkedHashMap<>();
  private boolean committed;

  public KeyValueTransaction(KeyValueStore store, ObjectMapper objectMapper) {
    this.store = store;
    this.objectMapper = objectMapper;
  }

  public <T> Optional<T> read(String key, Class<T> type) {
    return raw(key).map(json -> decode(key, json, type));
  }

  public long readLong(String key) {
    return read(key, Long.class).orElse(0L);
  }

  public void write(String key, Object value) {
    if (committed) {
      throw new IllegalStateException("Transaction already committed");
    }
    try {
      staged.put(key, objectMapper.writeValueAsString(value));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to encode value for key " + key, ex);
    }
  }

  public void writeLong(String key, long value) {
    write(key, value);
  }

  public boolean hasPendingWrites() {
    return !staged.isEmpty();
  }

  public void commit() {
    if (committed) {
      throw new IllegalStateException("Transaction already committed");
    }
    store.putAll(Map.copyOf(staged));
    committed = true;
  }

  private Optional<String> raw(String key) {
    String pending = staged.get(key);
    if (pending != null) {
      return Optional.of(pending);
    }
    return store.get(key);
  }

  private <T> T decode(String key, String json, Class<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to decode value for key " + key, ex);
    }
  }
}

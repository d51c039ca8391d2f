package com.intentregistry.registryapi.store;

import java.util.Map;
import java.util.Optional;

/**
 * Flat string key-value storage behind the registry. Implementations must apply {@link
 * #putAll} atomically: a reader sees either none or all of the entries.
 */
public interface KeyValueStore {
  Optional<String> get(String key);

  void putAll(Map<String, String> entries);
}

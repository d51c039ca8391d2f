package com.intentregistry.registryapi.registry;

import com.intentregistry.registryapi.config.RegistryProperties;
import com.intentregistry.registryapi.store.KeyValueTransaction;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class RegistrySettingsStore {
  private static final String SETTINGS_KEY = "registry:settings";

  private final RegistryProperties properties;

  public RegistrySettingsStore(RegistryProperties properties) {
    this.properties = properties;
  }

  /** Stored settings, or the configured initial settings when nothing has been stored yet. */
  public RegistrySettings load(KeyValueTransaction tx) {
    return stored(tx).orElseGet(properties::toInitialSettings);
  }

  public void save(KeyValueTransaction tx, RegistrySettings settings) {
    tx.write(SETTINGS_KEY, RegistrySettingsDocument.from(settings));
  }

  /** Persists the initial settings when the store is empty. Returns true when it did so. */
  public boolean bootstrapIfAbsent(KeyValueTransaction tx) {
    if (stored(tx).isPresent()) {
      return false;
    }
    save(tx, properties.toInitialSettings());
    return true;
  }

  private Optional<RegistrySettings> stored(KeyValueTransaction tx) {
    return tx.read(SETTINGS_KEY, RegistrySettingsDocument.class)
        .map(RegistrySettingsDocument::toSettings);
  }
}

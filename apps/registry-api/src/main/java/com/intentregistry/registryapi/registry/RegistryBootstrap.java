package com.intentregistry.registryapi.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Writes the configured initial settings into an empty store on startup. */
@Component
public class RegistryBootstrap implements ApplicationRunner {
  private static final Logger log = LoggerFactory.getLogger(RegistryBootstrap.class);

  private final RegistryTransactions transactions;
  private final RegistrySettingsStore settingsStore;

  public RegistryBootstrap(
      RegistryTransactions transactions, RegistrySettingsStore settingsStore) {
    this.transactions = transactions;
    this.settingsStore = settingsStore;
  }

  @Override
  public void run(ApplicationArguments args) {
    boolean bootstrapped = transactions.write(settingsStore::bootstrapIfAbsent);
    RegistrySettings settings = transactions.read(settingsStore::load);
    log.info(
        "Registry ready bootstrapped={} owner={} controller={} keeper={} paused={} feeBps={}",
        bootstrapped,
        settings.owner(),
        settings.controller(),
        settings.keeper(),
        settings.paused(),
        settings.feeBps());
  }
}

package com.intentregistry.registryapi.access;

import com.intentregistry.domain.intents.Address;
import com.intentregistry.domain.intents.Intent;
import com.intentregistry.domain.intents.RegistryAuthorizationException;
import com.intentregistry.domain.intents.RegistryErrorCode;
import com.intentregistry.registryapi.intents.IntentStore;
import com.intentregistry.registryapi.registry.RegistrySettings;
import com.intentregistry.registryapi.registry.RegistrySettingsStore;
import com.intentregistry.registryapi.registry.RegistryTransactions;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Role checks. The {@code require*} methods judge a caller against a given settings snapshot and
 * are used inside write transactions; the predicates read committed state.
 */
@Component
public class AccessPolicy {
  private final RegistryTransactions transactions;
  private final RegistrySettingsStore settingsStore;
  private final IntentStore intentStore;

  public AccessPolicy(
      RegistryTransactions transactions,
      RegistrySettingsStore settingsStore,
      IntentStore intentStore) {
    this.transactions = transactions;
    this.settingsStore = settingsStore;
    this.intentStore = intentStore;
  }

  public boolean isOwner(Address address) {
    return transactions.read(tx -> settingsStore.load(tx).owner().equals(address));
  }

  public boolean isController(Address address) {
    return transactions.read(tx -> isController(settingsStore.load(tx), address));
  }

  public boolean isKeeper(Address address) {
    return transactions.read(tx -> isKeeper(settingsStore.load(tx), address));
  }

  /** False for unknown or terminal intents. */
  public boolean canCancel(long intentId, Address caller) {
    return transactions.read(
        tx -> {
          Optional<Intent> intent = intentStore.find(tx, intentId);
          return intent.isPresent()
              && intent.get().isPending()
              && mayCancel(settingsStore.load(tx), intent.get(), caller);
        });
  }

  public boolean canExecute(long intentId) {
    return transactions.read(
        tx ->
            !settingsStore.load(tx).paused()
                && intentStore.find(tx, intentId).map(Intent::isPending).orElse(false));
  }

  public void requireOwner(RegistrySettings settings, Address caller) {
    if (!settings.owner().equals(caller)) {
      throw new RegistryAuthorizationException(
          RegistryErrorCode.NOT_OWNER, "Caller " + caller + " is not the registry owner");
    }
  }

  public void requireController(RegistrySettings settings, Address caller) {
    if (!isController(settings, caller)) {
      throw new RegistryAuthorizationException(
          RegistryErrorCode.NOT_CONTROLLER, "Caller " + caller + " is not the controller");
    }
  }

  public void requireKeeper(RegistrySettings settings, Address caller) {
    if (!isKeeper(settings, caller)) {
      throw new RegistryAuthorizationException(
          RegistryErrorCode.NOT_KEEPER, "Caller " + caller + " is not the keeper");
    }
  }

  public void requireCanCancel(RegistrySettings settings, Intent intent, Address caller) {
    if (!mayCancel(settings, intent, caller)) {
      throw new RegistryAuthorizationException(
          RegistryErrorCode.UNAUTHORIZED,
          "Caller " + caller + " may not cancel intent " + intent.id());
    }
  }

  private static boolean mayCancel(RegistrySettings settings, Intent intent, Address caller) {
    return intent.submitter().equals(caller) || settings.owner().equals(caller);
  }

  // An unassigned (zero) role matches nobody.
  private static boolean isController(RegistrySettings settings, Address address) {
    return !settings.controller().isZero() && settings.controller().equals(address);
  }

  private static boolean isKeeper(RegistrySettings settings, Address address) {
    return !settings.keeper().isZero() && settings.keeper().equals(address);
  }
}

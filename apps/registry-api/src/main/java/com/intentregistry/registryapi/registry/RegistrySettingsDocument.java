package com.intentregistry.registryapi.registry;

import com.intentregistry.domain.intents.Address;
import java.math.BigInteger;

public record RegistrySettingsDocument(
    String owner,
    String controller,
    String keeper,
    boolean paused,
    int feeBps,
    BigInteger minAmount,
    BigInteger maxAmount) {

  public static RegistrySettingsDocument from(RegistrySettings settings) {
    return new RegistrySettingsDocument(
        settings.owner().value(),
        settings.controller().value(),
        settings.keeper().value(),
        settings.paused(),
        settings.feeBps(),
        settings.minAmount(),
        settings.maxAmount());
  }

  public RegistrySettings toSettings() {
    return new RegistrySettings(
        Address.of(owner),
        Address.of(controller),
        Address.of(keeper),
        paused,
        feeBps,
        minAmount,
        maxAmount);
  }
}

package com.intentregistry.registryapi.api;

import com.intentregistry.registryapi.registry.RegistrySettings;
import java.math.BigInteger;

public record SettingsResponse(
    String owner,
    String controller,
    String keeper,
    boolean paused,
    int feeBps,
    BigInteger minAmount,
    BigInteger maxAmount) {

  public static SettingsResponse from(RegistrySettings settings) {
    return new SettingsResponse(
        settings.owner().value(),
        settings.controller().value(),
        settings.keeper().value(),
        settings.paused(),
        settings.feeBps(),
        settings.minAmount(),
        settings.maxAmount());
  }
}

package com.intentregistry.registryapi.registry;

import com.intentregistry.domain.intents.Address;
import com.intentregistry.domain.intents.RegistryConstants;
import com.intentregistry.domain.intents.RegistryErrorCode;
import com.intentregistry.domain.intents.RegistryValidationException;
import java.math.BigInteger;
import java.util.Objects;

public record RegistrySettings(
    Address owner,
    Address controller,
    Address keeper,
    boolean paused,
    int feeBps,
    BigInteger minAmount,
    BigInteger maxAmount) {
  public RegistrySettings {
    Objects.requireNonNull(owner, "owner must not be null");
    Objects.requireNonNull(controller, "controller must not be null");
    Objects.requireNonNull(keeper, "keeper must not be null");
    Objects.requireNonNull(minAmount, "minAmount must not be null");
    Objects.requireNonNull(maxAmount, "maxAmount must not be null");
  }

  /** Validates a bootstrap configuration; controller and keeper may still be unassigned. */
  public static RegistrySettings initial(
      Address owner,
      Address controller,
      Address keeper,
      boolean paused,
      int feeBps,
      BigInteger minAmount,
      BigInteger maxAmount) {
    if (owner.isZero()) {
      throw new RegistryValidationException(
          RegistryErrorCode.ZERO_ADDRESS, "owner must not be the zero address");
    }
    validateFee(feeBps);
    validateBounds(minAmount, maxAmount);
    return new RegistrySettings(owner, controller, keeper, paused, feeBps, minAmount, maxAmount);
  }

  public RegistrySettings withController(Address newController) {
    return new RegistrySettings(
        owner, newController, keeper, paused, feeBps, minAmount, maxAmount);
  }

  public RegistrySettings withKeeper(Address newKeeper) {
    return new RegistrySettings(
        owner, controller, newKeeper, paused, feeBps, minAmount, maxAmount);
  }

  public RegistrySettings withPaused(boolean newPaused) {
    return new RegistrySettings(
        owner, controller, keeper, newPaused, feeBps, minAmount, maxAmount);
  }

  public RegistrySettings withFeeBps(int newFeeBps) {
    validateFee(newFeeBps);
    return new RegistrySettings(
        owner, controller, keeper, paused, newFeeBps, minAmount, maxAmount);
  }

  public RegistrySettings withBounds(BigInteger newMin, BigInteger newMax) {
    validateBounds(newMin, newMax);
    return new RegistrySettings(owner, controller, keeper, paused, feeBps, newMin, newMax);
  }

  public boolean withinBounds(BigInteger amount) {
    return amount.compareTo(minAmount) >= 0 && amount.compareTo(maxAmount) <= 0;
  }

  private static void validateFee(int feeBps) {
    if (feeBps < 0 || feeBps > RegistryConstants.MAX_FEE_BPS) {
      throw new RegistryValidationException(
          RegistryErrorCode.FEE_TOO_HIGH,
          "feeBps must be in [0, " + RegistryConstants.MAX_FEE_BPS + "], got " + feeBps);
    }
  }

  private static void validateBounds(BigInteger min, BigInteger max) {
    if (min == null || min.signum() <= 0) {
      throw new RegistryValidationException(
          RegistryErrorCode.ZERO_AMOUNT, "minimum execution amount must be >= 1");
    }
    if (max == null || min.compareTo(max) > 0) {
      throw new RegistryValidationException(
          RegistryErrorCode.BOUNDS_INVALID,
          "minimum " + min + " must not exceed maximum " + max);
    }
  }
}

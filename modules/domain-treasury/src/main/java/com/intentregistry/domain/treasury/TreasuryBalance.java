package com.intentregistry.domain.treasury;

import com.intentregistry.domain.intents.RegistryErrorCode;
import com.intentregistry.domain.intents.RegistryFundsException;
import java.math.BigInteger;
import java.util.Objects;

public record TreasuryBalance(BigInteger available, long updatedSeq) {
  public static final TreasuryBalance EMPTY = new TreasuryBalance(BigInteger.ZERO, 0L);

  public TreasuryBalance {
    Objects.requireNonNull(available, "available must not be null");
    if (available.signum() < 0) {
      throw new IllegalArgumentException("available must be >= 0");
    }
  }

  public TreasuryBalance credit(BigInteger amount, long seq) {
    requireNonNegative(amount);
    return new TreasuryBalance(available.add(amount), seq);
  }

  public TreasuryBalance debit(BigInteger amount, long seq) {
    requireNonNegative(amount);
    if (available.compareTo(amount) < 0) {
      throw new RegistryFundsException(
          RegistryErrorCode.TRANSFER_FAILED,
          String.format(
              "Withdrawal exceeds treasury balance: requested=%s, available=%s",
              amount, available));
    }
    return new TreasuryBalance(available.subtract(amount), seq);
  }

  private static void requireNonNegative(BigInteger amount) {
    if (amount == null || amount.signum() < 0) {
      throw new IllegalArgumentException("amount must be >= 0");
    }
  }
}

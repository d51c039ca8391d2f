package com.intentregistry.domain.treasury;

import com.intentregistry.domain.intents.Address;
import java.math.BigInteger;
import java.util.Objects;

public record TreasuryWithdrawal(
    Address to, BigInteger amount, BigInteger remaining, long seq, String transferReference) {
  public TreasuryWithdrawal {
    Objects.requireNonNull(to, "to must not be null");
    Objects.requireNonNull(amount, "amount must not be null");
    Objects.requireNonNull(remaining, "remaining must not be null");
    if (amount.signum() <= 0) {
      throw new IllegalArgumentException("amount must be > 0");
    }
  }
}

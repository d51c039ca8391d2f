package com.intentregistry.registryapi.api;

import com.intentregistry.domain.treasury.TreasuryWithdrawal;
import java.math.BigInteger;

public record TreasuryWithdrawalResponse(
    String to, BigInteger amount, BigInteger remaining, long seq, String transferReference) {
  public static TreasuryWithdrawalResponse from(TreasuryWithdrawal withdrawal) {
    return new TreasuryWithdrawalResponse(
        withdrawal.to().value(),
        withdrawal.amount(),
        withdrawal.remaining(),
        withdrawal.seq(),
        withdrawal.transferReference());
  }
}

package com.intentregistry.registryapi.api;

import com.intentregistry.domain.treasury.TreasuryBalance;
import java.math.BigInteger;

public record TreasuryResponse(BigInteger available, long updatedSeq) {
  public static TreasuryResponse from(TreasuryBalance balance) {
    return new TreasuryResponse(balance.available(), balance.updatedSeq());
  }
}

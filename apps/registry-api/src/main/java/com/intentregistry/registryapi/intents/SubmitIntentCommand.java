package com.intentregistry.registryapi.intents;

import com.intentregistry.domain.intents.SymbolHash;
import java.math.BigInteger;
import java.util.Objects;

/** One intent to register. {@code side} is the raw side code, decoded during validation. */
public record SubmitIntentCommand(
    int side, BigInteger amount, BigInteger limitPrice, SymbolHash symbol) {
  public SubmitIntentCommand {
    Objects.requireNonNull(symbol, "symbol must not be null");
    limitPrice = limitPrice == null ? BigInteger.ZERO : limitPrice;
    if (limitPrice.signum() < 0) {
      throw new IllegalArgumentException("limitPrice must be >= 0");
    }
  }
}

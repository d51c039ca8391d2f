package com.intentregistry.domain.intents;

import java.math.BigInteger;

public class InsufficientFeeException extends RegistryFundsException {
  private final BigInteger required;
  private final BigInteger paid;

  public InsufficientFeeException(BigInteger required, BigInteger paid) {
    super(
        RegistryErrorCode.INSUFFICIENT_FEE,
        String.format("Insufficient fee: required=%s, paid=%s", required, paid));
    this.required = required;
    this.paid = paid;
  }

  public BigInteger required() {
    return required;
  }

  public BigInteger paid() {
    return paid;
  }
}

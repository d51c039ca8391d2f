package com.intentregistry.domain.intents;

import java.math.BigInteger;
import java.util.Objects;

public record Intent(
    long id,
    Address submitter,
    IntentSide side,
    BigInteger amount,
    BigInteger limitPrice,
    SymbolHash symbol,
    long createdSeq,
    BigInteger executedAmount,
    boolean executed,
    boolean cancelled) {
  public Intent {
    if (id < 1) {
      throw new IllegalArgumentException("id must be >= 1");
    }
    Objects.requireNonNull(submitter, "submitter must not be null");
    Objects.requireNonNull(side, "side must not be null");
    requirePositive(amount, "amount");
    requireNonNegative(limitPrice, "limitPrice");
    Objects.requireNonNull(symbol, "symbol must not be null");
    if (createdSeq < 1) {
      throw new IllegalArgumentException("createdSeq must be >= 1");
    }
    requireNonNegative(executedAmount, "executedAmount");
    if (executedAmount.compareTo(amount) > 0) {
      throw new IllegalArgumentException("executedAmount must not exceed amount");
    }
    if (executed && cancelled) {
      throw new IllegalArgumentException("intent cannot be both executed and cancelled");
    }
  }

  public static Intent createNew(
      long id,
      Address submitter,
      IntentSide side,
      BigInteger amount,
      BigInteger limitPrice,
      SymbolHash symbol,
      long createdSeq) {
    return new Intent(
        id, submitter, side, amount, limitPrice, symbol, createdSeq, BigInteger.ZERO, false, false);
  }

  public IntentStatus status() {
    if (executed) {
      return IntentStatus.EXECUTED;
    }
    if (cancelled) {
      return IntentStatus.CANCELLED;
    }
    return IntentStatus.PENDING;
  }

  public boolean isPending() {
    return status() == IntentStatus.PENDING;
  }

  public Intent markExecuted(BigInteger fillAmount) {
    IntentStateMachine.validateTransition(id, status(), IntentStatus.EXECUTED);
    if (fillAmount == null || fillAmount.signum() <= 0 || fillAmount.compareTo(amount) > 0) {
      throw new RegistryValidationException(
          RegistryErrorCode.AMOUNT_OUT_OF_BOUNDS,
          "Executed amount " + fillAmount + " must be in [1, " + amount + "]");
    }
    return new Intent(
        id, submitter, side, amount, limitPrice, symbol, createdSeq, fillAmount, true, false);
  }

  public Intent markCancelled() {
    IntentStateMachine.validateTransition(id, status(), IntentStatus.CANCELLED);
    return new Intent(
        id, submitter, side, amount, limitPrice, symbol, createdSeq, executedAmount, false, true);
  }

  private static void requirePositive(BigInteger value, String fieldName) {
    if (value == null || value.signum() <= 0) {
      throw new IllegalArgumentException(fieldName + " must be > 0");
    }
  }

  private static void requireNonNegative(BigInteger value, String fieldName) {
    if (value == null || value.signum() < 0) {
      throw new IllegalArgumentException(fieldName + " must be >= 0");
    }
  }
}

package com.intentregistry.domain.intents;

import java.math.BigInteger;
import java.util.Objects;

public record ExecutionRecord(
    long intentId,
    Address executor,
    BigInteger executedAmount,
    BigInteger avgPrice,
    long executedSeq) {
  public ExecutionRecord {
    Objects.requireNonNull(executor, "executor must not be null");
    Objects.requireNonNull(executedAmount, "executedAmount must not be null");
    Objects.requireNonNull(avgPrice, "avgPrice must not be null");
    if (executedAmount.signum() < 0 || avgPrice.signum() < 0) {
      throw new IllegalArgumentException("executedAmount and avgPrice must be >= 0");
    }
    if (executedSeq < 0) {
      throw new IllegalArgumentException("executedSeq must be >= 0");
    }
  }

  /** Placeholder returned by bulk lookups for ids that were never executed. */
  public static ExecutionRecord empty(long intentId) {
    return new ExecutionRecord(intentId, Address.ZERO, BigInteger.ZERO, BigInteger.ZERO, 0L);
  }

  public boolean isEmpty() {
    return executedSeq == 0L;
  }
}

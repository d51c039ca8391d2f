package com.intentregistry.registryapi.api;

import com.intentregistry.domain.intents.ExecutionRecord;
import java.math.BigInteger;

/** {@code recorded} is false for the zero-valued placeholders of a bulk lookup. */
public record ExecutionResponse(
    long intentId,
    String executor,
    BigInteger executedAmount,
    BigInteger avgPrice,
    long executedSeq,
    boolean recorded) {

  public static ExecutionResponse from(ExecutionRecord record) {
    return new ExecutionResponse(
        record.intentId(),
        record.executor().value(),
        record.executedAmount(),
        record.avgPrice(),
        record.executedSeq(),
        !record.isEmpty());
  }
}

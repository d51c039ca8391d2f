package com.intentregistry.registryapi.executions;

import com.intentregistry.domain.intents.Address;
import com.intentregistry.domain.intents.ExecutionRecord;
import java.math.BigInteger;

public record ExecutionDocument(
    long intentId,
    String executor,
    BigInteger executedAmount,
    BigInteger avgPrice,
    long executedSeq) {

  public static ExecutionDocument from(ExecutionRecord record) {
    return new ExecutionDocument(
        record.intentId(),
        record.executor().value(),
        record.executedAmount(),
        record.avgPrice(),
        record.executedSeq());
  }

  public ExecutionRecord toRecord() {
    return new ExecutionRecord(
        intentId, Address.of(executor), executedAmount, avgPrice, executedSeq);
  }
}

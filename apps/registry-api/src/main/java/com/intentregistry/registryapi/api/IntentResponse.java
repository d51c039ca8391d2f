package com.intentregistry.registryapi.api;

import com.intentregistry.domain.intents.Intent;
import java.math.BigInteger;

public record IntentResponse(
    long id,
    String submitter,
    String side,
    BigInteger amount,
    BigInteger limitPrice,
    String symbol,
    long createdSeq,
    BigInteger executedAmount,
    String status) {

  public static IntentResponse from(Intent intent) {
    return new IntentResponse(
        intent.id(),
        intent.submitter().value(),
        intent.side().name(),
        intent.amount(),
        intent.limitPrice(),
        intent.symbol().value(),
        intent.createdSeq(),
        intent.executedAmount(),
        intent.status().name());
  }
}

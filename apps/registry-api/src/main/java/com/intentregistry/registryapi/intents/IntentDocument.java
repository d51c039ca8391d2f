package com.intentregistry.registryapi.intents;

import com.intentregistry.domain.intents.Address;
import com.intentregistry.domain.intents.Intent;
import com.intentregistry.domain.intents.IntentSide;
import com.intentregistry.domain.intents.SymbolHash;
import java.math.BigInteger;

public record IntentDocument(
    long id,
    String submitter,
    int side,
    BigInteger amount,
    BigInteger limitPrice,
    String symbol,
    long createdSeq,
    BigInteger executedAmount,
    boolean executed,
    boolean cancelled) {

  public static IntentDocument from(Intent intent) {
    return new IntentDocument(
        intent.id(),
        intent.submitter().value(),
        intent.side().code(),
        intent.amount(),
        intent.limitPrice(),
        intent.symbol().value(),
        intent.createdSeq(),
        intent.executedAmount(),
        intent.executed(),
        intent.cancelled());
  }

  public Intent toIntent() {
    return new Intent(
        id,
        Address.of(submitter),
        IntentSide.fromCode(side),
        amount,
        limitPrice,
        SymbolHash.fromHex(symbol),
        createdSeq,
        executedAmount,
        executed,
        cancelled);
  }
}

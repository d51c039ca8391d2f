package com.intentregistry.infra.kafka.contract.payload;

public record IntentSubmittedV1(
    String intentId,
    String submitter,
    String side,
    String amount,
    String limitPrice,
    String symbolHash,
    long seq) {}

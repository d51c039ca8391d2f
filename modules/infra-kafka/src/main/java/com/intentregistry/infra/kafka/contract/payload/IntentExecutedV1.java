package com.intentregistry.infra.kafka.contract.payload;

public record IntentExecutedV1(
    String intentId, String executor, String executedAmount, String avgPrice, long seq) {}

package com.intentregistry.infra.kafka.contract.payload;

public record IntentCancelledV1(String intentId, String cancelledBy, long seq) {}

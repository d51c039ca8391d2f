package com.intentregistry.infra.kafka.contract.payload;

public record TreasuryToppedV1(String amount, String from, long seq) {}

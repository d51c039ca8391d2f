package com.intentregistry.infra.kafka.contract.payload;

public record TreasuryWithdrawnV1(String to, String amount, long seq) {}

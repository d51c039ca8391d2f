package com.intentregistry.infra.kafka.contract.payload;

/**
 * One payload for every configuration change. {@code setting} is one of CONTROLLER, KEEPER,
 * BOUNDS or FEE; bounds render as {@code "min..max"}.
 */
public record ConfigChangedV1(String setting, String previousValue, String newValue, long seq) {}

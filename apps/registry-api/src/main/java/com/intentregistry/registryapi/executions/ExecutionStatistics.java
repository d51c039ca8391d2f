package com.intentregistry.registryapi.executions;

import java.math.BigInteger;

public record ExecutionStatistics(
    long totalIntents,
    long totalExecutions,
    long pending,
    long executed,
    long cancelled,
    BigInteger requestedBuyVolume,
    BigInteger requestedSellVolume,
    BigInteger executedBuyVolume,
    BigInteger executedSellVolume,
    long fillRateBps,
    long cancellationRateBps,
    long executionRateBps) {}

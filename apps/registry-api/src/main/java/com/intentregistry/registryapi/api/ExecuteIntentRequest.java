package com.intentregistry.registryapi.api;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigInteger;

public record ExecuteIntentRequest(
    @NotNull Long intentId,
    @NotNull @PositiveOrZero BigInteger executedAmount,
    @PositiveOrZero BigInteger avgPrice) {}

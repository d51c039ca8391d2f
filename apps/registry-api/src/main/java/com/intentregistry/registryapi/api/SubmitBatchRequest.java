package com.intentregistry.registryapi.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigInteger;
import java.util.List;

public record SubmitBatchRequest(
    @NotNull List<@Valid @NotNull IntentEntryRequest> intents,
    @PositiveOrZero BigInteger totalFee) {}

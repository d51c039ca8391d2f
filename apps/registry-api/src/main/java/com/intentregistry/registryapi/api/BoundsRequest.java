package com.intentregistry.registryapi.api;

import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;

public record BoundsRequest(@NotNull BigInteger minAmount, @NotNull BigInteger maxAmount) {}

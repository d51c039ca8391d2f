package com.intentregistry.registryapi.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigInteger;

public record TreasuryWithdrawalRequest(
    @NotBlank String to, @NotNull @PositiveOrZero BigInteger amount) {}

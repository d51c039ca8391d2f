package com.intentregistry.registryapi.api;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record FeeRequest(@NotNull @Min(0) Integer feeBps) {}

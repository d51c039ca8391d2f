package com.intentregistry.registryapi.api;

import jakarta.validation.constraints.NotBlank;

public record AddressRequest(@NotBlank String address) {}

package com.intentregistry.registryapi.api;

import jakarta.validation.constraints.NotNull;
import java.util.List;

public record BulkQueryRequest(@NotNull List<@NotNull Long> ids) {}

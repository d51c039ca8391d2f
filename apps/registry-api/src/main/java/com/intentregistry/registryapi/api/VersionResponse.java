package com.intentregistry.registryapi.api;

import java.time.Instant;

public record VersionResponse(String application, String version, Instant buildTime) {}

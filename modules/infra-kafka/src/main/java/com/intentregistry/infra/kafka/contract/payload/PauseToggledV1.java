package com.intentregistry.infra.kafka.contract.payload;

public record PauseToggledV1(boolean paused, long seq) {}

package com.intentregistry.registryapi.api;

public record AccessResponse(
    String address,
    boolean owner,
    boolean controller,
    boolean keeper,
    Long intentId,
    Boolean canCancel,
    Boolean canExecute) {}

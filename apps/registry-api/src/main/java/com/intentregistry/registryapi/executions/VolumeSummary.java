package com.intentregistry.registryapi.executions;

import java.math.BigInteger;

/** Requested and executed volume over one slice of intents (a symbol or a submitter). */
public record VolumeSummary(long intents, BigInteger requestedVolume, BigInteger executedVolume) {}

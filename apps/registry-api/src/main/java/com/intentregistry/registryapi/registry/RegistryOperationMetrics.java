package com.intentregistry.registryapi.registry;

import com.intentregistry.domain.intents.RegistryErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class RegistryOperationMetrics {
  private static final String OPERATIONS_TOTAL = "registry.operations.total";

  private final MeterRegistry meterRegistry;

  public RegistryOperationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordSuccess(String operation) {
    increment(operation, "success");
  }

  public void recordRejection(String operation, RegistryErrorCode code) {
    increment(operation, code.name().toLowerCase(Locale.ROOT));
  }

  public void recordError(String operation) {
    increment(operation, "error");
  }

  private void increment(String operation, String outcome) {
    Counter.builder(OPERATIONS_TOTAL)
        .description("Registry operations by outcome")
        .tag("operation", operation)
        .tag("outcome", outcome)
        .register(meterRegistry)
        .increment();
  }
}

package com.intentregistry.registryapi.registry;

import com.intentregistry.domain.intents.RegistryErrorCode;
import com.intentregistry.domain.intents.RegistryStateException;
import java.util.function.Supplier;

/**
 * In-progress flag shared by the guarded operations. Must be entered while holding the registry
 * write lock, so only the owning thread can ever observe it set.
 */
public class ReentrancyGuard {
  private boolean entered;

  public <T> T call(String operation, Supplier<T> work) {
    if (entered) {
      throw new RegistryStateException(
          RegistryErrorCode.REENTRANT_CALL, "Reentrant call into " + operation + " rejected");
    }
    entered = true;
    try {
      return work.get();
    } finally {
      entered = false;
    }
  }

  public boolean isEntered() {
    return entered;
  }
}

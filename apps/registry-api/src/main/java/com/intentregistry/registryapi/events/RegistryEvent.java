package com.intentregistry.registryapi.events;

import com.intentregistry.domain.intents.Address;
import com.intentregistry.domain.intents.IntentSide;
import com.intentregistry.domain.intents.SymbolHash;
import java.math.BigInteger;

/** Notifications emitted after a registry transition commits, stamped with its clock value. */
public interface RegistryEvent {
  long seq();

  record IntentSubmitted(
      long intentId,
      Address submitter,
      IntentSide side,
      BigInteger amount,
      BigInteger limitPrice,
      SymbolHash symbolHash,
      long seq)
      implements RegistryEvent {}

  record IntentExecuted(
      long intentId, Address executor, BigInteger executedAmount, BigInteger avgPrice, long seq)
      implements RegistryEvent {}

  record IntentCancelled(long intentId, Address cancelledBy, long seq) implements RegistryEvent {}

  record ControllerChanged(Address previous, Address current, long seq)
      implements RegistryEvent {}

  record KeeperChanged(Address previous, Address current, long seq) implements RegistryEvent {}

  record BoundsChanged(BigInteger minAmount, BigInteger maxAmount, long seq)
      implements RegistryEvent {}

  record FeeChanged(int previousBps, int currentBps, long seq) implements RegistryEvent {}

  record TreasuryTopped(BigInteger amount, Address from, long seq) implements RegistryEvent {}

  record TreasuryWithdrawn(Address to, BigInteger amount, long seq) implements RegistryEvent {}

  record PauseToggled(boolean paused, long seq) implements RegistryEvent {}
}

package com.intentregistry.domain.treasury;

import com.intentregistry.domain.intents.Address;
import java.math.BigInteger;

/**
 * Moves value out of the registry. Implementations may call back into the registry; the
 * treasury commits its debit before invoking {@link #transfer}.
 */
public interface ValueTransfer {
  TransferResult transfer(Address to, BigInteger amount);
}

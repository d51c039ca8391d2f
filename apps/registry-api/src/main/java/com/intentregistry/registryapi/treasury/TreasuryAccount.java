package com.intentregistry.registryapi.treasury;

import com.intentregistry.domain.treasury.TreasuryBalance;
import com.intentregistry.registryapi.store.KeyValueTransaction;
import java.math.BigInteger;
import org.springframework.stereotype.Component;

@Component
public class TreasuryAccount {
  private static final String BALANCE_KEY = "treasury:balance";

  public TreasuryBalance balance(KeyValueTransaction tx) {
    return tx.read(BALANCE_KEY, TreasuryBalance.class).orElse(TreasuryBalance.EMPTY);
  }

  public TreasuryBalance credit(KeyValueTransaction tx, BigInteger amount, long seq) {
    TreasuryBalance next = balance(tx).credit(amount, seq);
    tx.write(BALANCE_KEY, next);
    return next;
  }

  public void restore(KeyValueTransaction tx, TreasuryBalance previous) {
    tx.write(BALANCE_KEY, previous);
  }

  /** Fails with TRANSFER_FAILED when {@code amount} exceeds the balance. */
  public TreasuryBalance debit(KeyValueTransaction tx, BigInteger amount, long seq) {
    TreasuryBalance next = balance(tx).debit(amount, seq);
    tx.write(BALANCE_KEY, next);
    return next;
  }
}

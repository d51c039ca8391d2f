package com.intentregistry.registryapi.intents;

import com.intentregistry.domain.intents.Address;
import com.intentregistry.domain.intents.Intent;
import com.intentregistry.domain.intents.SymbolHash;
import com.intentregistry.registryapi.registry.RegistryTransactions;
import java.util.List;
import org.springframework.stereotype.Service;

/** Read side over committed intents. */
@Service
public class IntentQueryService {
  private final RegistryTransactions transactions;
  private final IntentStore intentStore;

  public IntentQueryService(RegistryTransactions transactions, IntentStore intentStore) {
    this.transactions = transactions;
    this.intentStore = intentStore;
  }

  public Intent get(long intentId) {
    return transactions.read(tx -> intentStore.get(tx, intentId));
  }

  public long total() {
    return transactions.read(intentStore::count);
  }

  public List<Intent> bySubmitter(Address submitter) {
    return transactions.read(tx -> intentStore.bySubmitter(tx, submitter));
  }

  public List<Intent> bySymbol(SymbolHash symbol) {
    return transactions.read(tx -> intentStore.bySymbol(tx, symbol));
  }

  public Intent atIndex(long index) {
    return transactions.read(tx -> intentStore.atIndex(tx, index));
  }

  public List<Intent> range(long fromIndex, long toIndex) {
    return transactions.read(tx -> intentStore.range(tx, fromIndex, toIndex));
  }

  public List<Intent> latest(long count) {
    return transactions.read(tx -> intentStore.latest(tx, count));
  }

  public List<Intent> bySequence(long fromSeq, long toSeq) {
    return transactions.read(tx -> intentStore.bySequence(tx, fromSeq, toSeq));
  }

  public List<Intent> bulk(List<Long> intentIds) {
    return transactions.read(tx -> intentStore.bulk(tx, intentIds));
  }
}

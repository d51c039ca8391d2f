package com.intentregistry.registryapi.executions;

import com.intentregistry.domain.intents.ExecutionRecord;
import com.intentregistry.registryapi.registry.RegistryTransactions;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class ExecutionQueryService {
  private final RegistryTransactions transactions;
  private final ExecutionLedger executionLedger;

  public ExecutionQueryService(
      RegistryTransactions transactions, ExecutionLedger executionLedger) {
    this.transactions = transactions;
    this.executionLedger = executionLedger;
  }

  public ExecutionRecord get(long intentId) {
    return transactions.read(tx -> executionLedger.get(tx, intentId));
  }

  public List<ExecutionRecord> latest(long count) {
    return transactions.read(tx -> executionLedger.latest(tx, count));
  }

  public List<ExecutionRecord> range(long fromIndex, long toIndex) {
    return transactions.read(tx -> executionLedger.range(tx, fromIndex, toIndex));
  }

  public List<ExecutionRecord> bulk(List<Long> intentIds) {
    return transactions.read(tx -> executionLedger.bulk(tx, intentIds));
  }
}

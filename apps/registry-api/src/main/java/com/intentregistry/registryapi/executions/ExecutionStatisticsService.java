package com.intentregistry.registryapi.executions;

import com.intentregistry.domain.intents.Address;
import com.intentregistry.domain.intents.Intent;
import com.intentregistry.domain.intents.IntentSide;
import com.intentregistry.domain.intents.RegistryConstants;
import com.intentregistry.domain.intents.SymbolHash;
import com.intentregistry.registryapi.intents.IntentStore;
import com.intentregistry.registryapi.registry.RegistryTransactions;
import java.math.BigInteger;
import java.util.List;
import org.springframework.stereotype.Service;

/** Aggregates recomputed from the indexes on every call; nothing is kept incrementally. */
@Service
public class ExecutionStatisticsService {
  private final RegistryTransactions transactions;
  private final IntentStore intentStore;
  private final ExecutionLedger executionLedger;

  public ExecutionStatisticsService(
      RegistryTransactions transactions, IntentStore intentStore, ExecutionLedger executionLedger) {
    this.transactions = transactions;
    this.intentStore = intentStore;
    this.executionLedger = executionLedger;
  }

  public ExecutionStatistics statistics() {
    return transactions.read(
        tx -> summarize(intentStore.all(tx), executionLedger.totalExecutions(tx)));
  }

  public long countPending() {
    return statistics().pending();
  }

  public long countExecuted() {
    return statistics().executed();
  }

  public long countCancelled() {
    return statistics().cancelled();
  }

  public VolumeSummary volumeBySymbol(SymbolHash symbol) {
    return transactions.read(tx -> volume(intentStore.bySymbol(tx, symbol)));
  }

  public VolumeSummary volumeBySubmitter(Address submitter) {
    return transactions.read(tx -> volume(intentStore.bySubmitter(tx, submitter)));
  }

  static ExecutionStatistics summarize(List<Intent> intents, long totalExecutions) {
    long pending = 0;
    long executed = 0;
    long cancelled = 0;
    BigInteger requestedBuy = BigInteger.ZERO;
    BigInteger requestedSell = BigInteger.ZERO;
    BigInteger executedBuy = BigInteger.ZERO;
    BigInteger executedSell = BigInteger.ZERO;
    BigInteger filled = BigInteger.ZERO;
    BigInteger requestedOfExecuted = BigInteger.ZERO;

    for (Intent intent : intents) {
      boolean buy = intent.side() == IntentSide.BUY;
      if (buy) {
        requestedBuy = requestedBuy.add(intent.amount());
      } else {
        requestedSell = requestedSell.add(intent.amount());
      }
      switch (intent.status()) {
        case PENDING -> pending++;
        case CANCELLED -> cancelled++;
        case EXECUTED -> {
          executed++;
          filled = filled.add(intent.executedAmount());
          requestedOfExecuted = requestedOfExecuted.add(intent.amount());
          if (buy) {
            executedBuy = executedBuy.add(intent.executedAmount());
          } else {
            executedSell = executedSell.add(intent.executedAmount());
          }
        }
      }
    }

    BigInteger total = BigInteger.valueOf(intents.size());
    return new ExecutionStatistics(
        intents.size(),
        totalExecutions,
        pending,
        executed,
        cancelled,
        requestedBuy,
        requestedSell,
        executedBuy,
        executedSell,
        RegistryConstants.toBps(filled, requestedOfExecuted),
        RegistryConstants.toBps(BigInteger.valueOf(cancelled), total),
        RegistryConstants.toBps(BigInteger.valueOf(executed), total));
  }

  private static VolumeSummary volume(List<Intent> intents) {
    BigInteger requested = BigInteger.ZERO;
    BigInteger executed = BigInteger.ZERO;
    for (Intent intent : intents) {
      requested = requested.add(intent.amount());
      executed = executed.add(intent.executedAmount());
    }
    return new VolumeSummary(intents.size(), requested, executed);
  }
}

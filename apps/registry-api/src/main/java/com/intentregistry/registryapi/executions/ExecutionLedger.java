package com.intentregistry.registryapi.executions;

import com.intentregistry.domain.intents.Address;
import com.intentregistry.domain.intents.ExecutionRecord;
import com.intentregistry.domain.intents.Intent;
import com.intentregistry.domain.intents.RegistryCapacityException;
import com.intentregistry.domain.intents.RegistryConstants;
import com.intentregistry.domain.intents.RegistryErrorCode;
import com.intentregistry.domain.intents.RegistryStateException;
import com.intentregistry.registryapi.store.AppendOnlyIndex;
import com.intentregistry.registryapi.store.KeyValueTransaction;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** At most one execution per intent, plus the execution-order index. */
@Component
public class ExecutionLedger {
  private static final AppendOnlyIndex EXECUTION_ORDER = AppendOnlyIndex.named("executions");

  /**
   * Records the execution of {@code executed}, which must already carry its fill amount. The
   * caller is responsible for persisting the intent itself.
   */
  public ExecutionRecord record(
      KeyValueTransaction tx, Intent executed, Address executor, BigInteger avgPrice, long seq) {
    if (find(tx, executed.id()).isPresent()) {
      throw new RegistryStateException(
          RegistryErrorCode.ALREADY_EXECUTED, "Intent " + executed.id() + " is already executed");
    }
    ExecutionRecord record =
        new ExecutionRecord(executed.id(), executor, executed.executedAmount(), avgPrice, seq);
    tx.write(executionKey(executed.id()), ExecutionDocument.from(record));
    EXECUTION_ORDER.append(tx, executed.id());
    return record;
  }

  public Optional<ExecutionRecord> find(KeyValueTransaction tx, long intentId) {
    return tx.read(executionKey(intentId), ExecutionDocument.class)
        .map(ExecutionDocument::toRecord);
  }

  public ExecutionRecord get(KeyValueTransaction tx, long intentId) {
    return find(tx, intentId)
        .orElseThrow(
            () ->
                new RegistryStateException(
                    RegistryErrorCode.NOT_FOUND, "No execution recorded for intent " + intentId));
  }

  public long totalExecutions(KeyValueTransaction tx) {
    return EXECUTION_ORDER.length(tx);
  }

  public List<ExecutionRecord> latest(KeyValueTransaction tx, long count) {
    return load(tx, EXECUTION_ORDER.latest(tx, count));
  }

  public List<ExecutionRecord> range(KeyValueTransaction tx, long fromIndex, long toIndex) {
    return load(tx, EXECUTION_ORDER.slice(tx, fromIndex, toIndex));
  }

  /**
   * Records in request order. Unlike the intent bulk lookup, an id without an execution yields
   * {@link ExecutionRecord#empty} instead of failing.
   */
  public List<ExecutionRecord> bulk(KeyValueTransaction tx, List<Long> intentIds) {
    if (intentIds.size() > RegistryConstants.MAX_BULK_QUERY) {
      throw new RegistryCapacityException(
          RegistryErrorCode.BULK_QUERY_TOO_LARGE,
          String.format(
              "Bulk query of %d ids exceeds the limit of %d",
              intentIds.size(), RegistryConstants.MAX_BULK_QUERY));
    }
    List<ExecutionRecord> records = new ArrayList<>(intentIds.size());
    for (Long intentId : intentIds) {
      records.add(find(tx, intentId).orElseGet(() -> ExecutionRecord.empty(intentId)));
    }
    return records;
  }

  private List<ExecutionRecord> load(KeyValueTransaction tx, List<Long> intentIds) {
    List<ExecutionRecord> records = new ArrayList<>(intentIds.size());
    for (Long intentId : intentIds) {
      records.add(get(tx, intentId));
    }
    return records;
  }

  private static String executionKey(long intentId) {
    return "execution:" + intentId;
  }
}

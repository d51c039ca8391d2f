package com.intentregistry.registryapi.intents;

import com.intentregistry.domain.intents.Address;
import com.intentregistry.domain.intents.Intent;
import com.intentregistry.domain.intents.IntentSide;
import com.intentregistry.domain.intents.RegistryCapacityException;
import com.intentregistry.domain.intents.RegistryConstants;
import com.intentregistry.domain.intents.RegistryErrorCode;
import com.intentregistry.domain.intents.RegistryStateException;
import com.intentregistry.domain.intents.RegistryValidationException;
import com.intentregistry.domain.intents.SymbolHash;
import com.intentregistry.registryapi.registry.RegistrySettings;
import com.intentregistry.registryapi.store.AppendOnlyIndex;
import com.intentregistry.registryapi.store.KeyValueTransaction;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Intent records plus their three append-only indexes: submission order, per submitter and per
 * symbol. Ids are 1-based and equal to the submission position plus one.
 */
@Component
public class IntentStore {
  private static final String COUNT_KEY = "intent:count";
  private static final AppendOnlyIndex SUBMISSION_ORDER = AppendOnlyIndex.named("intents");

  public long count(KeyValueTransaction tx) {
    return tx.readLong(COUNT_KEY);
  }

  public Optional<Intent> find(KeyValueTransaction tx, long intentId) {
    if (intentId < 1) {
      return Optional.empty();
    }
    return tx.read(intentKey(intentId), IntentDocument.class).map(IntentDocument::toIntent);
  }

  public Intent get(KeyValueTransaction tx, long intentId) {
    return find(tx, intentId)
        .orElseThrow(
            () ->
                new RegistryStateException(
                    RegistryErrorCode.NOT_FOUND, "Intent not found: " + intentId));
  }

  /** Side, zero amount and bounds checks for one entry; touches no state. */
  public IntentSide validate(SubmitIntentCommand command, RegistrySettings settings) {
    IntentSide side = IntentSide.fromCode(command.side());
    if (command.amount() == null || command.amount().signum() == 0) {
      throw new RegistryValidationException(
          RegistryErrorCode.ZERO_AMOUNT, "Intent amount must be > 0");
    }
    if (!settings.withinBounds(command.amount())) {
      throw new RegistryValidationException(
          RegistryErrorCode.AMOUNT_OUT_OF_BOUNDS,
          String.format(
              "Intent amount %s outside bounds [%s, %s]",
              command.amount(), settings.minAmount(), settings.maxAmount()));
    }
    return side;
  }

  public void requireCapacity(KeyValueTransaction tx, int additional) {
    long total = count(tx);
    if (total + additional > RegistryConstants.MAX_INTENTS) {
      throw new RegistryCapacityException(
          RegistryErrorCode.CAPACITY_EXCEEDED,
          String.format(
              "Registry holds %d intents; adding %d exceeds the cap of %d",
              total, additional, RegistryConstants.MAX_INTENTS));
    }
  }

  public Intent append(
      KeyValueTransaction tx,
      Address submitter,
      IntentSide side,
      SubmitIntentCommand command,
      long seq) {
    long id = count(tx) + 1;
    Intent intent =
        Intent.createNew(
            id, submitter, side, command.amount(), command.limitPrice(), command.symbol(), seq);
    tx.write(intentKey(id), IntentDocument.from(intent));
    tx.writeLong(COUNT_KEY, id);
    SUBMISSION_ORDER.append(tx, id);
    bySubmitterIndex(submitter).append(tx, id);
    bySymbolIndex(command.symbol()).append(tx, id);
    return intent;
  }

  public void update(KeyValueTransaction tx, Intent intent) {
    if (find(tx, intent.id()).isEmpty()) {
      throw new RegistryStateException(
          RegistryErrorCode.NOT_FOUND, "Intent not found: " + intent.id());
    }
    tx.write(intentKey(intent.id()), IntentDocument.from(intent));
  }

  public List<Intent> bySubmitter(KeyValueTransaction tx, Address submitter) {
    return load(tx, bySubmitterIndex(submitter).all(tx));
  }

  public List<Intent> bySymbol(KeyValueTransaction tx, SymbolHash symbol) {
    return load(tx, bySymbolIndex(symbol).all(tx));
  }

  public List<Intent> all(KeyValueTransaction tx) {
    return load(tx, SUBMISSION_ORDER.all(tx));
  }

  public Intent atIndex(KeyValueTransaction tx, long index) {
    long intentId = SUBMISSION_ORDER.get(tx, index);
    if (intentId == 0L) {
      throw new RegistryStateException(
          RegistryErrorCode.NOT_FOUND,
          "No intent at index " + index + "; total=" + SUBMISSION_ORDER.length(tx));
    }
    return get(tx, intentId);
  }

  public List<Intent> range(KeyValueTransaction tx, long fromIndex, long toIndex) {
    return load(tx, SUBMISSION_ORDER.slice(tx, fromIndex, toIndex));
  }

  public List<Intent> latest(KeyValueTransaction tx, long count) {
    return load(tx, SUBMISSION_ORDER.latest(tx, count));
  }

  /** Intents whose creation marker lies in {@code [fromSeq, toSeq]}, in submission order. */
  public List<Intent> bySequence(KeyValueTransaction tx, long fromSeq, long toSeq) {
    List<Intent> matches = new ArrayList<>();
    for (Intent intent : all(tx)) {
      if (intent.createdSeq() >= fromSeq && intent.createdSeq() <= toSeq) {
        matches.add(intent);
      }
    }
    return matches;
  }

  /** All requested intents in request order; fails on the first unknown id. */
  public List<Intent> bulk(KeyValueTransaction tx, List<Long> intentIds) {
    if (intentIds.size() > RegistryConstants.MAX_BULK_QUERY) {
      throw new RegistryCapacityException(
          RegistryErrorCode.BULK_QUERY_TOO_LARGE,
          String.format(
              "Bulk query of %d ids exceeds the limit of %d",
              intentIds.size(), RegistryConstants.MAX_BULK_QUERY));
    }
    return load(tx, intentIds);
  }

  private List<Intent> load(KeyValueTransaction tx, List<Long> intentIds) {
    List<Intent> intents = new ArrayList<>(intentIds.size());
    for (Long intentId : intentIds) {
      intents.add(get(tx, intentId));
    }
    return intents;
  }

  private static AppendOnlyIndex bySubmitterIndex(Address submitter) {
    return AppendOnlyIndex.named("submitter:" + submitter.value());
  }

  private static AppendOnlyIndex bySymbolIndex(SymbolHash symbol) {
    return AppendOnlyIndex.named("symbol:" + symbol.value());
  }

  private static String intentKey(long intentId) {
    return "intent:" + intentId;
  }
}

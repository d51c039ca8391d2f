package com.intentregistry.registryapi.registry;

import com.intentregistry.domain.intents.Address;
import com.intentregistry.domain.intents.ExecutionRecord;
import com.intentregistry.domain.intents.InsufficientFeeException;
import com.intentregistry.domain.intents.Intent;
import com.intentregistry.domain.intents.IntentSide;
import com.intentregistry.domain.intents.RegistryConstants;
import com.intentregistry.domain.intents.RegistryErrorCode;
import com.intentregistry.domain.intents.RegistryException;
import com.intentregistry.domain.intents.RegistryFundsException;
import com.intentregistry.domain.intents.RegistryStateException;
import com.intentregistry.domain.intents.RegistryValidationException;
import com.intentregistry.domain.treasury.TransferResult;
import com.intentregistry.domain.treasury.TreasuryBalance;
import com.intentregistry.domain.treasury.TreasuryWithdrawal;
import com.intentregistry.domain.treasury.ValueTransfer;
import com.intentregistry.registryapi.access.AccessPolicy;
import com.intentregistry.registryapi.events.RegistryEvent;
import com.intentregistry.registryapi.events.RegistryEventSink;
import com.intentregistry.registryapi.executions.ExecutionLedger;
import com.intentregistry.registryapi.intents.IntentStore;
import com.intentregistry.registryapi.intents.SubmitIntentCommand;
import com.intentregistry.registryapi.store.KeyValueTransaction;
import com.intentregistry.registryapi.treasury.TreasuryAccount;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Every state-changing registry operation. Each call validates against one settings snapshot,
 * commits its writes in a single store transaction, then publishes the resulting events in
 * commit order. A rejected call leaves no trace besides the rejection metric.
 */
@Service
public class RegistryFacade {
  private static final Logger log = LoggerFactory.getLogger(RegistryFacade.class);

  private final RegistryTransactions transactions;
  private final RegistrySettingsStore settingsStore;
  private final RegistryClock clock;
  private final IntentStore intentStore;
  private final ExecutionLedger executionLedger;
  private final TreasuryAccount treasuryAccount;
  private final AccessPolicy accessPolicy;
  private final ValueTransfer valueTransfer;
  private final RegistryEventSink eventSink;
  private final RegistryOperationMetrics metrics;
  private final ReentrancyGuard reentrancyGuard = new ReentrancyGuard();

  public RegistryFacade(
      RegistryTransactions transactions,
      RegistrySettingsStore settingsStore,
      RegistryClock clock,
      IntentStore intentStore,
      ExecutionLedger executionLedger,
      TreasuryAccount treasuryAccount,
      AccessPolicy accessPolicy,
      ValueTransfer valueTransfer,
      RegistryEventSink eventSink,
      RegistryOperationMetrics metrics) {
    this.transactions = transactions;
    this.settingsStore = settingsStore;
    this.clock = clock;
    this.intentStore = intentStore;
    this.executionLedger = executionLedger;
    this.treasuryAccount = treasuryAccount;
    this.accessPolicy = accessPolicy;
    this.valueTransfer = valueTransfer;
    this.eventSink = eventSink;
    this.metrics = metrics;
  }

  public Intent submit(Address caller, SubmitIntentCommand command, BigInteger feePaid) {
    return measured(
        "submit",
        () ->
            commitAndPublish(
                (tx, events) -> {
                  RegistrySettings settings = settingsStore.load(tx);
                  accessPolicy.requireController(settings, caller);
                  requireActive(settings);
                  IntentSide side = intentStore.validate(command, settings);
                  intentStore.requireCapacity(tx, 1);
                  BigInteger fee = nonNegativeFee(feePaid);
                  BigInteger required =
                      RegistryConstants.requiredFee(command.amount(), settings.feeBps());
                  if (fee.compareTo(required) < 0) {
                    throw new InsufficientFeeException(required, fee);
                  }

                  long seq = clock.advance(tx);
                  Intent intent = intentStore.append(tx, caller, side, command, seq);
                  events.add(submittedEvent(intent));
                  collectFee(tx, events, caller, fee, seq);
                  log.info(
                      "Intent submitted intentId={} submitter={} side={} amount={} seq={}",
                      intent.id(),
                      caller,
                      side,
                      intent.amount(),
                      seq);
                  return intent;
                }));
  }

  /** All-or-nothing: every entry is validated before any id is assigned. */
  public List<Intent> submitBatch(
      Address caller, List<SubmitIntentCommand> commands, BigInteger totalFeePaid) {
    return measured(
        "submit_batch",
        () ->
            commitAndPublish(
                (tx, events) -> {
                  RegistrySettings settings = settingsStore.load(tx);
                  accessPolicy.requireController(settings, caller);
                  requireActive(settings);
                  if (commands == null || commands.isEmpty()) {
                    throw new RegistryValidationException(
                        RegistryErrorCode.ZERO_AMOUNT, "Batch must contain at least one intent");
                  }
                  List<IntentSide> sides = new ArrayList<>(commands.size());
                  BigInteger required = BigInteger.ZERO;
                  for (SubmitIntentCommand command : commands) {
                    sides.add(intentStore.validate(command, settings));
                    required =
                        required.add(
                            RegistryConstants.requiredFee(command.amount(), settings.feeBps()));
                  }
                  intentStore.requireCapacity(tx, commands.size());
                  BigInteger fee = nonNegativeFee(totalFeePaid);
                  if (fee.compareTo(required) < 0) {
                    throw new InsufficientFeeException(required, fee);
                  }

                  long seq = clock.advance(tx);
                  List<Intent> intents = new ArrayList<>(commands.size());
                  for (int i = 0; i < commands.size(); i++) {
                    Intent intent =
                        intentStore.append(tx, caller, sides.get(i), commands.get(i), seq);
                    intents.add(intent);
                    events.add(submittedEvent(intent));
                  }
                  collectFee(tx, events, caller, fee, seq);
                  log.info(
                      "Intent batch submitted submitter={} count={} firstId={} seq={}",
                      caller,
                      intents.size(),
                      intents.get(0).id(),
                      seq);
                  return intents;
                }));
  }

  /** Allowed while paused. */
  public Intent cancel(Address caller, long intentId) {
    return measured(
        "cancel",
        () ->
            commitAndPublish(
                (tx, events) -> {
                  RegistrySettings settings = settingsStore.load(tx);
                  Intent current = intentStore.get(tx, intentId);
                  Intent cancelled = current.markCancelled();
                  accessPolicy.requireCanCancel(settings, current, caller);

                  long seq = clock.advance(tx);
                  intentStore.update(tx, cancelled);
                  events.add(new RegistryEvent.IntentCancelled(intentId, caller, seq));
                  log.info("Intent cancelled intentId={} by={} seq={}", intentId, caller, seq);
                  return cancelled;
                }));
  }

  public ExecutionRecord execute(
      Address caller, long intentId, BigInteger executedAmount, BigInteger avgPrice) {
    return measured(
        "execute",
        () ->
            transactions.exclusively(
                () ->
                    reentrancyGuard.call(
                        "execute",
                        () -> commitAndPublish(
                            (tx, events) ->
                                doExecute(tx, events, caller, intentId, executedAmount, avgPrice)))));
  }

  /** Anyone may top up the treasury. A zero deposit changes nothing and emits nothing. */
  public TreasuryBalance deposit(Address from, BigInteger amount) {
    return measured(
        "deposit",
        () ->
            commitAndPublish(
                (tx, events) -> {
                  if (amount == null || amount.signum() < 0) {
                    throw new IllegalArgumentException("deposit amount must be >= 0");
                  }
                  if (amount.signum() == 0) {
                    return treasuryAccount.balance(tx);
                  }
                  long seq = clock.advance(tx);
                  TreasuryBalance balance = treasuryAccount.credit(tx, amount, seq);
                  events.add(new RegistryEvent.TreasuryTopped(amount, from, seq));
                  log.info(
                      "Treasury deposit from={} amount={} balance={} seq={}",
                      from,
                      amount,
                      balance.available(),
                      seq);
                  return balance;
                }));
  }

  /**
   * Debits and commits before calling the value transfer. A failed transfer puts back the prior
   * balance record and clock value and is reported as TRANSFER_FAILED without a withdrawal event.
   */
  public TreasuryWithdrawal withdraw(Address caller, Address to, BigInteger amount) {
    return measured(
        "withdraw",
        () ->
            transactions.exclusively(
                () -> reentrancyGuard.call("withdraw", () -> doWithdraw(caller, to, amount))));
  }

  public RegistrySettings setController(Address caller, Address newController) {
    return updateSettings(
        "set_controller",
        caller,
        (settings, seq, events) -> {
          requireNonZero(newController, "controller");
          events.add(
              new RegistryEvent.ControllerChanged(settings.controller(), newController, seq));
          return settings.withController(newController);
        });
  }

  public RegistrySettings setKeeper(Address caller, Address newKeeper) {
    return updateSettings(
        "set_keeper",
        caller,
        (settings, seq, events) -> {
          requireNonZero(newKeeper, "keeper");
          events.add(new RegistryEvent.KeeperChanged(settings.keeper(), newKeeper, seq));
          return settings.withKeeper(newKeeper);
        });
  }

  public RegistrySettings setBounds(Address caller, BigInteger minAmount, BigInteger maxAmount) {
    return updateSettings(
        "set_bounds",
        caller,
        (settings, seq, events) -> {
          RegistrySettings updated = settings.withBounds(minAmount, maxAmount);
          events.add(new RegistryEvent.BoundsChanged(minAmount, maxAmount, seq));
          return updated;
        });
  }

  public RegistrySettings setFeeBps(Address caller, int feeBps) {
    return updateSettings(
        "set_fee",
        caller,
        (settings, seq, events) -> {
          RegistrySettings updated = settings.withFeeBps(feeBps);
          events.add(new RegistryEvent.FeeChanged(settings.feeBps(), feeBps, seq));
          return updated;
        });
  }

  public RegistrySettings setPaused(Address caller, boolean paused) {
    return updateSettings(
        paused ? "pause" : "unpause",
        caller,
        (settings, seq, events) -> {
          events.add(new RegistryEvent.PauseToggled(paused, seq));
          return settings.withPaused(paused);
        });
  }

  public RegistrySettings settings() {
    return transactions.read(settingsStore::load);
  }

  public TreasuryBalance treasuryBalance() {
    return transactions.read(treasuryAccount::balance);
  }

  public long currentSeq() {
    return transactions.read(clock::current);
  }

  private ExecutionRecord doExecute(
      KeyValueTransaction tx,
      List<RegistryEvent> events,
      Address caller,
      long intentId,
      BigInteger executedAmount,
      BigInteger avgPrice) {
    RegistrySettings settings = settingsStore.load(tx);
    accessPolicy.requireKeeper(settings, caller);
    requireActive(settings);
    Intent executed = intentStore.get(tx, intentId).markExecuted(executedAmount);
    BigInteger price = avgPrice == null ? BigInteger.ZERO : avgPrice;

    long seq = clock.advance(tx);
    intentStore.update(tx, executed);
    ExecutionRecord record = executionLedger.record(tx, executed, caller, price, seq);
    events.add(new RegistryEvent.IntentExecuted(intentId, caller, executedAmount, price, seq));
    log.info(
        "Intent executed intentId={} executor={} amount={} avgPrice={} seq={}",
        intentId,
        caller,
        executedAmount,
        price,
        seq);
    return record;
  }

  private TreasuryWithdrawal doWithdraw(Address caller, Address to, BigInteger amount) {
    PriorTreasuryState prior =
        transactions.write(
            tx -> {
              RegistrySettings settings = settingsStore.load(tx);
              accessPolicy.requireOwner(settings, caller);
              requireNonZero(to, "withdrawal recipient");
              if (amount == null || amount.signum() <= 0) {
                throw new RegistryValidationException(
                    RegistryErrorCode.ZERO_AMOUNT, "Withdrawal amount must be > 0");
              }
              PriorTreasuryState before =
                  new PriorTreasuryState(treasuryAccount.balance(tx), clock.current(tx));
              treasuryAccount.debit(tx, amount, clock.advance(tx));
              return before;
            });
    long seq = prior.seq() + 1;

    TransferResult result = attemptTransfer(to, amount);
    if (!result.success()) {
      TreasuryBalance restored = transactions.write(tx -> revertDebit(tx, prior, amount));
      log.warn(
          "Treasury withdrawal reverted to={} amount={} reason={} balance={}",
          to,
          amount,
          result.failureReason(),
          restored.available());
      throw new RegistryFundsException(
          RegistryErrorCode.TRANSFER_FAILED,
          "Transfer of " + amount + " to " + to + " failed: " + result.failureReason());
    }

    publish(new RegistryEvent.TreasuryWithdrawn(to, amount, seq));
    BigInteger remaining = treasuryBalance().available();
    log.info(
        "Treasury withdrawal to={} amount={} remaining={} reference={} seq={}",
        to,
        amount,
        remaining,
        result.reference(),
        seq);
    return new TreasuryWithdrawal(to, amount, remaining, seq, result.reference());
  }

  // A transfer callback may itself commit (a nested deposit); then only a credit is safe.
  private TreasuryBalance revertDebit(
      KeyValueTransaction tx, PriorTreasuryState prior, BigInteger amount) {
    if (clock.current(tx) == prior.seq() + 1) {
      treasuryAccount.restore(tx, prior.balance());
      clock.rewind(tx, prior.seq());
      return prior.balance();
    }
    return treasuryAccount.credit(tx, amount, clock.advance(tx));
  }

  private TransferResult attemptTransfer(Address to, BigInteger amount) {
    try {
      TransferResult result = valueTransfer.transfer(to, amount);
      return result == null ? TransferResult.failed("no transfer result") : result;
    } catch (RuntimeException ex) {
      log.warn("Value transfer threw to={} amount={}", to, amount, ex);
      return TransferResult.failed(ex.getMessage());
    }
  }

  private RegistrySettings updateSettings(
      String operation, Address caller, SettingsChange change) {
    return measured(
        operation,
        () ->
            commitAndPublish(
                (tx, events) -> {
                  RegistrySettings current = settingsStore.load(tx);
                  accessPolicy.requireOwner(current, caller);
                  long seq = clock.advance(tx);
                  RegistrySettings updated = change.apply(current, seq, events);
                  settingsStore.save(tx, updated);
                  log.info(
                      "Registry config changed operation={} by={} seq={}", operation, caller, seq);
                  return updated;
                }));
  }

  private <T> T commitAndPublish(Mutation<T> mutation) {
    return transactions.exclusively(
        () -> {
          List<RegistryEvent> events = new ArrayList<>();
          T result = transactions.write(tx -> mutation.apply(tx, events));
          events.forEach(this::publish);
          return result;
        });
  }

  /** The transition is already committed, so a failing sink must not fail the caller. */
  private void publish(RegistryEvent event) {
    try {
      eventSink.publish(event);
    } catch (RuntimeException ex) {
      log.warn(
          "Registry event publish failed type={} seq={}",
          event.getClass().getSimpleName(),
          event.seq(),
          ex);
    }
  }

  private <T> T measured(String operation, Supplier<T> work) {
    try {
      T result = work.get();
      metrics.recordSuccess(operation);
      return result;
    } catch (RegistryException ex) {
      metrics.recordRejection(operation, ex.code());
      throw ex;
    } catch (RuntimeException ex) {
      metrics.recordError(operation);
      throw ex;
    }
  }

  private void collectFee(
      KeyValueTransaction tx,
      List<RegistryEvent> events,
      Address payer,
      BigInteger fee,
      long seq) {
    if (fee.signum() > 0) {
      treasuryAccount.credit(tx, fee, seq);
      events.add(new RegistryEvent.TreasuryTopped(fee, payer, seq));
    }
  }

  private static RegistryEvent.IntentSubmitted submittedEvent(Intent intent) {
    return new RegistryEvent.IntentSubmitted(
        intent.id(),
        intent.submitter(),
        intent.side(),
        intent.amount(),
        intent.limitPrice(),
        intent.symbol(),
        intent.createdSeq());
  }

  private static void requireActive(RegistrySettings settings) {
    if (settings.paused()) {
      throw new RegistryStateException(RegistryErrorCode.PAUSED, "Registry is paused");
    }
  }

  private static void requireNonZero(Address address, String role) {
    if (address == null || address.isZero()) {
      throw new RegistryValidationException(
          RegistryErrorCode.ZERO_ADDRESS, role + " must not be the zero address");
    }
  }

  private static BigInteger nonNegativeFee(BigInteger feePaid) {
    if (feePaid == null) {
      return BigInteger.ZERO;
    }
    if (feePaid.signum() < 0) {
      throw new IllegalArgumentException("fee must be >= 0");
    }
    return feePaid;
  }

  @FunctionalInterface
  private interface Mutation<T> {
    T apply(KeyValueTransaction tx, List<RegistryEvent> events);
  }

  @FunctionalInterface
  private interface SettingsChange {
    RegistrySettings apply(RegistrySettings current, long seq, List<RegistryEvent> events);
  }

  private record PriorTreasuryState(TreasuryBalance balance, long seq) {}
}

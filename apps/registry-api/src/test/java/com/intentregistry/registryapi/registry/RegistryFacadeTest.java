package com.intentregistry.registryapi.registry;

import static com.intentregistry.registryapi.RegistryFixture.BTC;
import static com.intentregistry.registryapi.RegistryFixture.CONTROLLER;
import static com.intentregistry.registryapi.RegistryFixture.ETH;
import static com.intentregistry.registryapi.RegistryFixture.KEEPER;
import static com.intentregistry.registryapi.RegistryFixture.OWNER;
import static com.intentregistry.registryapi.RegistryFixture.STRANGER;
import static com.intentregistry.registryapi.RegistryFixture.buy;
import static com.intentregistry.registryapi.RegistryFixture.sell;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.intentregistry.domain.intents.Address;
import com.intentregistry.domain.intents.ExecutionRecord;
import com.intentregistry.domain.intents.InsufficientFeeException;
import com.intentregistry.domain.intents.Intent;
import com.intentregistry.domain.intents.IntentStatus;
import com.intentregistry.domain.intents.RegistryErrorCode;
import com.intentregistry.domain.intents.RegistryException;
import com.intentregistry.registryapi.RegistryFixture;
import com.intentregistry.registryapi.events.RegistryEvent;
import com.intentregistry.registryapi.executions.ExecutionStatistics;
import com.intentregistry.registryapi.intents.SubmitIntentCommand;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

class RegistryFacadeTest {
  private RegistryFixture fixture;
  private RegistryFacade facade;

  @BeforeEach
  void setUp() {
    fixture = new RegistryFixture();
    facade = fixture.facade();
  }

  @Test
  void shouldAssignMonotonicIdsAndSequenceMarkers() {
    Intent first = facade.submit(CONTROLLER, buy(10), BigInteger.ZERO);
    Intent second = facade.submit(CONTROLLER, sell(20, BTC), BigInteger.ZERO);
    Intent third = facade.submit(CONTROLLER, buy(30), null);

    assertEquals(1L, first.id());
    assertEquals(2L, second.id());
    assertEquals(3L, third.id());
    assertEquals(1L, first.createdSeq());
    assertEquals(3L, third.createdSeq());
    assertEquals(3L, facade.currentSeq());
    assertEquals(IntentStatus.PENDING, fixture.intentQueries().get(2).status());
  }

  @Test
  void shouldExecutePendingIntentExactlyOnce() {
    facade.submit(CONTROLLER, buy(100), BigInteger.ZERO);

    ExecutionRecord record =
        facade.execute(KEEPER, 1L, BigInteger.valueOf(60), BigInteger.valueOf(101));

    assertEquals(KEEPER, record.executor());
    assertEquals(BigInteger.valueOf(60), record.executedAmount());
    assertEquals(2L, record.executedSeq());
    Intent executed = fixture.intentQueries().get(1);
    assertEquals(IntentStatus.EXECUTED, executed.status());
    assertEquals(BigInteger.valueOf(60), executed.executedAmount());
    assertCode(
        RegistryErrorCode.ALREADY_EXECUTED,
        () -> facade.execute(KEEPER, 1L, BigInteger.ONE, BigInteger.ONE));
    assertCode(RegistryErrorCode.ALREADY_EXECUTED, () -> facade.cancel(CONTROLLER, 1L));
  }

  @Test
  void shouldNotExecuteCancelledIntent() {
    facade.submit(CONTROLLER, buy(100), BigInteger.ZERO);
    Intent cancelled = facade.cancel(CONTROLLER, 1L);

    assertEquals(IntentStatus.CANCELLED, cancelled.status());
    assertCode(
        RegistryErrorCode.ALREADY_CANCELLED,
        () -> facade.execute(KEEPER, 1L, BigInteger.ONE, BigInteger.ONE));
    assertCode(RegistryErrorCode.ALREADY_CANCELLED, () -> facade.cancel(OWNER, 1L));
  }

  @Test
  void shouldRejectExecutionOutsideRequestedAmount() {
    facade.submit(CONTROLLER, buy(100), BigInteger.ZERO);

    assertCode(
        RegistryErrorCode.AMOUNT_OUT_OF_BOUNDS,
        () -> facade.execute(KEEPER, 1L, BigInteger.valueOf(101), BigInteger.ONE));
    assertCode(
        RegistryErrorCode.AMOUNT_OUT_OF_BOUNDS,
        () -> facade.execute(KEEPER, 1L, BigInteger.ZERO, BigInteger.ONE));
    assertCode(
        RegistryErrorCode.NOT_FOUND,
        () -> facade.execute(KEEPER, 9L, BigInteger.ONE, BigInteger.ONE));
    assertEquals(IntentStatus.PENDING, fixture.intentQueries().get(1).status());
    assertEquals(0L, fixture.statistics().statistics().totalExecutions());
  }

  @Test
  void shouldTreatBoundsAsInclusive() {
    facade.setBounds(OWNER, BigInteger.valueOf(10), BigInteger.valueOf(20));

    assertEquals(1L, facade.submit(CONTROLLER, buy(10), BigInteger.ZERO).id());
    assertEquals(2L, facade.submit(CONTROLLER, buy(20), BigInteger.ZERO).id());
    assertCode(
        RegistryErrorCode.AMOUNT_OUT_OF_BOUNDS,
        () -> facade.submit(CONTROLLER, buy(9), BigInteger.ZERO));
    assertCode(
        RegistryErrorCode.AMOUNT_OUT_OF_BOUNDS,
        () -> facade.submit(CONTROLLER, buy(21), BigInteger.ZERO));
    assertCode(
        RegistryErrorCode.ZERO_AMOUNT, () -> facade.submit(CONTROLLER, buy(0), BigInteger.ZERO));
  }

  @Test
  void shouldRejectUnknownSide() {
    SubmitIntentCommand hold = new SubmitIntentCommand(3, BigInteger.TEN, BigInteger.ONE, ETH);

    assertCode(RegistryErrorCode.INVALID_SIDE, () -> facade.submit(CONTROLLER, hold, null));
  }

  @Test
  void shouldCommitNothingWhenOneBatchEntryIsInvalid() {
    List<SubmitIntentCommand> batch =
        List.of(buy(10), new SubmitIntentCommand(3, BigInteger.TEN, BigInteger.ONE, ETH));

    assertCode(
        RegistryErrorCode.INVALID_SIDE,
        () -> facade.submitBatch(CONTROLLER, batch, BigInteger.ZERO));
    assertEquals(0L, fixture.intentQueries().total());
    assertEquals(0L, facade.currentSeq());
    assertTrue(fixture.events.isEmpty());
  }

  @Test
  void shouldAssignBatchIdsInOrderUnderOneSequenceMarker() {
    facade.submit(CONTROLLER, buy(5), BigInteger.ZERO);

    List<Intent> intents =
        facade.submitBatch(
            CONTROLLER, List.of(buy(10), sell(20, BTC), buy(30)), BigInteger.ZERO);

    assertEquals(List.of(2L, 3L, 4L), intents.stream().map(Intent::id).toList());
    assertTrue(intents.stream().allMatch(intent -> intent.createdSeq() == 2L));
    assertEquals(2L, facade.currentSeq());
    assertEquals(List.of(3L), ids(fixture.intentQueries().bySymbol(BTC)));
  }

  @Test
  void shouldRejectEmptyBatch() {
    assertCode(
        RegistryErrorCode.ZERO_AMOUNT,
        () -> facade.submitBatch(CONTROLLER, List.of(), BigInteger.ZERO));
  }

  @Test
  void shouldRequireSumOfRoundedDownFeesForBatch() {
    facade.setFeeBps(OWNER, 25);
    List<SubmitIntentCommand> batch = List.of(buy(10_000), buy(10_001));

    InsufficientFeeException ex =
        assertThrows(
            InsufficientFeeException.class,
            () -> facade.submitBatch(CONTROLLER, batch, BigInteger.valueOf(49)));
    assertEquals(BigInteger.valueOf(50), ex.required());

    facade.submitBatch(CONTROLLER, batch, BigInteger.valueOf(50));
    assertEquals(BigInteger.valueOf(50), facade.treasuryBalance().available());
  }

  @Test
  void shouldRejectBatchThatWouldExceedCapacity() {
    fixture.store.putAll(Map.of("intent:count", "9999"));

    assertCode(
        RegistryErrorCode.CAPACITY_EXCEEDED,
        () -> facade.submitBatch(CONTROLLER, List.of(buy(1), buy(2)), BigInteger.ZERO));
  }

  @Test
  void shouldRejectSingleSubmitOnceCapacityIsReached() {
    fixture.store.putAll(Map.of("intent:count", "9999"));

    Intent last = facade.submit(CONTROLLER, buy(1), BigInteger.ZERO);
    assertEquals(10_000L, last.id());
    assertCode(
        RegistryErrorCode.CAPACITY_EXCEEDED,
        () -> facade.submit(CONTROLLER, buy(2), BigInteger.ZERO));
    assertEquals(10_000L, fixture.intentQueries().total());
    assertEquals(1L, facade.currentSeq());
  }

  @Test
  void shouldRejectCancelOfUnknownIntent() {
    facade.submit(CONTROLLER, buy(100), BigInteger.ZERO);

    assertCode(RegistryErrorCode.NOT_FOUND, () -> facade.cancel(OWNER, 42L));
    assertCode(RegistryErrorCode.NOT_FOUND, () -> facade.cancel(CONTROLLER, 0L));
    assertEquals(IntentStatus.PENDING, fixture.intentQueries().get(1).status());
    assertEquals(1L, facade.currentSeq());
  }

  @Test
  void shouldChargeBasisPointFeeIntoTreasury() {
    facade.setFeeBps(OWNER, 25);
    BigInteger amount = BigInteger.TEN.pow(15);
    BigInteger required = new BigInteger("2500000000000");
    SubmitIntentCommand command = new SubmitIntentCommand(1, amount, BigInteger.ONE, ETH);

    InsufficientFeeException ex =
        assertThrows(
            InsufficientFeeException.class,
            () -> facade.submit(CONTROLLER, command, required.subtract(BigInteger.ONE)));
    assertEquals(required, ex.required());

    facade.submit(CONTROLLER, command, required);
    assertEquals(required, facade.treasuryBalance().available());
    RegistryEvent last = fixture.events.get(fixture.events.size() - 1);
    RegistryEvent.TreasuryTopped topped = assertInstanceOf(RegistryEvent.TreasuryTopped.class, last);
    assertEquals(required, topped.amount());
    assertEquals(CONTROLLER, topped.from());
  }

  @Test
  void shouldKeepExcessFee() {
    facade.submit(CONTROLLER, buy(10), BigInteger.valueOf(7));

    assertEquals(BigInteger.valueOf(7), facade.treasuryBalance().available());
  }

  @Test
  void shouldReportCountsAndLatestAfterExecutingMiddleIntent() {
    facade.submit(CONTROLLER, buy(10), BigInteger.ZERO);
    facade.submit(CONTROLLER, buy(20), BigInteger.ZERO);
    facade.submit(CONTROLLER, buy(30), BigInteger.ZERO);
    facade.execute(KEEPER, 2L, BigInteger.valueOf(20), BigInteger.valueOf(100));

    ExecutionStatistics statistics = fixture.statistics().statistics();
    assertEquals(2L, statistics.pending());
    assertEquals(1L, statistics.executed());
    assertEquals(0L, statistics.cancelled());
    assertEquals(List.of(3L, 2L), ids(fixture.intentQueries().latest(2)));
    List<ExecutionRecord> executions = fixture.executionQueries().latest(5);
    assertEquals(1, executions.size());
    assertEquals(2L, executions.get(0).intentId());
  }

  @Test
  void shouldBlockSubmitAndExecuteButAllowCancelWhilePaused() {
    facade.submit(CONTROLLER, buy(10), BigInteger.ZERO);
    facade.setPaused(OWNER, true);

    assertCode(
        RegistryErrorCode.PAUSED, () -> facade.submit(CONTROLLER, buy(10), BigInteger.ZERO));
    assertCode(
        RegistryErrorCode.PAUSED,
        () -> facade.submitBatch(CONTROLLER, List.of(buy(10)), BigInteger.ZERO));
    assertCode(
        RegistryErrorCode.PAUSED,
        () -> facade.execute(KEEPER, 1L, BigInteger.ONE, BigInteger.ONE));

    assertEquals(IntentStatus.CANCELLED, facade.cancel(CONTROLLER, 1L).status());

    facade.setPaused(OWNER, false);
    assertEquals(2L, facade.submit(CONTROLLER, buy(10), BigInteger.ZERO).id());
  }

  @Test
  void shouldEnforceRoles() {
    facade.submit(CONTROLLER, buy(10), BigInteger.ZERO);

    assertCode(
        RegistryErrorCode.NOT_CONTROLLER, () -> facade.submit(STRANGER, buy(10), BigInteger.ZERO));
    assertCode(
        RegistryErrorCode.NOT_KEEPER,
        () -> facade.execute(CONTROLLER, 1L, BigInteger.ONE, BigInteger.ONE));
    assertCode(RegistryErrorCode.UNAUTHORIZED, () -> facade.cancel(STRANGER, 1L));
    assertCode(RegistryErrorCode.NOT_OWNER, () -> facade.setFeeBps(CONTROLLER, 10));
    assertCode(RegistryErrorCode.NOT_OWNER, () -> facade.setPaused(KEEPER, true));

    assertEquals(IntentStatus.CANCELLED, facade.cancel(OWNER, 1L).status());
  }

  @Test
  void shouldApplyConfigChangesImmediately() {
    Address newController = STRANGER;

    facade.setController(OWNER, newController);

    assertCode(
        RegistryErrorCode.NOT_CONTROLLER,
        () -> facade.submit(CONTROLLER, buy(10), BigInteger.ZERO));
    assertEquals(1L, facade.submit(newController, buy(10), BigInteger.ZERO).id());
    assertEquals(newController, facade.settings().controller());
  }

  @Test
  void shouldValidateConfigChangesWithoutAdvancingClock() {
    assertCode(RegistryErrorCode.FEE_TOO_HIGH, () -> facade.setFeeBps(OWNER, 10_001));
    assertCode(
        RegistryErrorCode.BOUNDS_INVALID,
        () -> facade.setBounds(OWNER, BigInteger.valueOf(5), BigInteger.valueOf(4)));
    assertCode(
        RegistryErrorCode.ZERO_AMOUNT,
        () -> facade.setBounds(OWNER, BigInteger.ZERO, BigInteger.valueOf(4)));
    assertCode(RegistryErrorCode.ZERO_ADDRESS, () -> facade.setController(OWNER, Address.ZERO));
    assertCode(RegistryErrorCode.ZERO_ADDRESS, () -> facade.setKeeper(OWNER, Address.ZERO));

    assertEquals(0L, facade.currentSeq());
    assertTrue(fixture.events.isEmpty());
    assertEquals(10_000, facade.setFeeBps(OWNER, 10_000).feeBps());
  }

  @Test
  void shouldEmitEventsInCommitOrder() {
    facade.setFeeBps(OWNER, 100);
    facade.submit(CONTROLLER, buy(1_000), BigInteger.TEN);
    facade.execute(KEEPER, 1L, BigInteger.valueOf(1_000), BigInteger.valueOf(7));
    facade.setKeeper(OWNER, STRANGER);

    List<RegistryEvent> events = fixture.events;
    assertEquals(5, events.size());
    RegistryEvent.FeeChanged feeChanged =
        assertInstanceOf(RegistryEvent.FeeChanged.class, events.get(0));
    assertEquals(0, feeChanged.previousBps());
    assertEquals(100, feeChanged.currentBps());
    assertInstanceOf(RegistryEvent.IntentSubmitted.class, events.get(1));
    assertInstanceOf(RegistryEvent.TreasuryTopped.class, events.get(2));
    RegistryEvent.IntentExecuted executed =
        assertInstanceOf(RegistryEvent.IntentExecuted.class, events.get(3));
    assertEquals(KEEPER, executed.executor());
    RegistryEvent.KeeperChanged keeperChanged =
        assertInstanceOf(RegistryEvent.KeeperChanged.class, events.get(4));
    assertEquals(KEEPER, keeperChanged.previous());
    assertEquals(STRANGER, keeperChanged.current());
    assertEquals(
        List.of(1L, 2L, 2L, 3L, 4L), events.stream().map(RegistryEvent::seq).toList());
  }

  @Test
  void shouldKeepCommittedStateWhenEventSinkThrows() {
    List<RegistryEvent> delivered = new ArrayList<>();
    RegistryFixture failing =
        new RegistryFixture()
            .withEventSink(
                event -> {
                  if (event instanceof RegistryEvent.IntentSubmitted submitted
                      && submitted.intentId() == 1L) {
                    throw new IllegalStateException("broker down");
                  }
                  delivered.add(event);
                });
    RegistryFacade facade = failing.facade();

    Intent submitted = facade.submit(CONTROLLER, buy(10), BigInteger.ZERO);
    List<Intent> batch =
        facade.submitBatch(CONTROLLER, List.of(buy(20), buy(30)), BigInteger.ZERO);

    assertEquals(1L, submitted.id());
    assertEquals(List.of(2L, 3L), ids(batch));
    assertEquals(3L, failing.intentQueries().total());
    assertEquals(2L, facade.currentSeq());
    assertEquals(
        List.of(2L, 3L),
        delivered.stream()
            .map(RegistryEvent.IntentSubmitted.class::cast)
            .map(RegistryEvent.IntentSubmitted::intentId)
            .toList());
    double succeeded =
        failing
            .meterRegistry
            .get("registry.operations.total")
            .tag("operation", "submit")
            .tag("outcome", "success")
            .counter()
            .count();
    assertEquals(1.0, succeeded);
  }

  @Test
  void shouldRejectReentrantExecuteFromEventSink() {
    AtomicReference<RegistryFacade> self = new AtomicReference<>();
    List<RegistryErrorCode> nestedFailures = new ArrayList<>();
    RegistryFixture reentrant =
        new RegistryFixture()
            .withEventSink(
                event -> {
                  if (event instanceof RegistryEvent.IntentExecuted) {
                    try {
                      self.get().execute(KEEPER, 2L, BigInteger.ONE, BigInteger.ONE);
                    } catch (RegistryException ex) {
                      nestedFailures.add(ex.code());
                    }
                  }
                });
    RegistryFacade guarded = reentrant.facade();
    self.set(guarded);
    guarded.submit(CONTROLLER, buy(10), BigInteger.ZERO);
    guarded.submit(CONTROLLER, buy(10), BigInteger.ZERO);

    guarded.execute(KEEPER, 1L, BigInteger.TEN, BigInteger.ONE);

    assertEquals(List.of(RegistryErrorCode.REENTRANT_CALL), nestedFailures);
    assertEquals(IntentStatus.PENDING, reentrant.intentQueries().get(2).status());
    assertEquals(IntentStatus.EXECUTED, reentrant.intentQueries().get(1).status());
  }

  @Test
  void shouldCountRejectionsByErrorCode() {
    facade.setPaused(OWNER, true);
    assertCode(
        RegistryErrorCode.PAUSED, () -> facade.submit(CONTROLLER, buy(10), BigInteger.ZERO));

    double paused =
        fixture
            .meterRegistry
            .get("registry.operations.total")
            .tag("operation", "submit")
            .tag("outcome", "paused")
            .counter()
            .count();
    double pauses =
        fixture
            .meterRegistry
            .get("registry.operations.total")
            .tag("operation", "pause")
            .tag("outcome", "success")
            .counter()
            .count();
    assertEquals(1.0, paused);
    assertEquals(1.0, pauses);
  }

  @Test
  void shouldIgnoreZeroDepositAndCreditPositiveDeposit() {
    facade.deposit(STRANGER, BigInteger.ZERO);
    assertEquals(0L, facade.currentSeq());
    assertFalse(fixture.events.stream().anyMatch(RegistryEvent.TreasuryTopped.class::isInstance));

    facade.deposit(STRANGER, BigInteger.valueOf(500));
    assertEquals(BigInteger.valueOf(500), facade.treasuryBalance().available());
    assertEquals(1L, facade.currentSeq());
    assertThrows(
        IllegalArgumentException.class, () -> facade.deposit(STRANGER, BigInteger.valueOf(-1)));
  }

  private static List<Long> ids(List<Intent> intents) {
    return intents.stream().map(Intent::id).toList();
  }

  private static void assertCode(RegistryErrorCode expected, Executable executable) {
    RegistryException ex = assertThrows(RegistryException.class, executable);
    assertEquals(expected, ex.code());
  }
}

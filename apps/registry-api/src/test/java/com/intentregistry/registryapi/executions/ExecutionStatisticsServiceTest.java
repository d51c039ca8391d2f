package com.intentregistry.registryapi.executions;

import static com.intentregistry.registryapi.RegistryFixture.BTC;
import static com.intentregistry.registryapi.RegistryFixture.CONTROLLER;
import static com.intentregistry.registryapi.RegistryFixture.ETH;
import static com.intentregistry.registryapi.RegistryFixture.KEEPER;
import static com.intentregistry.registryapi.RegistryFixture.OWNER;
import static com.intentregistry.registryapi.RegistryFixture.STRANGER;
import static com.intentregistry.registryapi.RegistryFixture.buy;
import static com.intentregistry.registryapi.RegistryFixture.sell;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.intentregistry.registryapi.RegistryFixture;
import com.intentregistry.registryapi.registry.RegistryFacade;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExecutionStatisticsServiceTest {

  @Test
  void shouldReturnZeroRatesForEmptyRegistry() {
    ExecutionStatistics statistics = ExecutionStatisticsService.summarize(List.of(), 0L);

    assertEquals(0L, statistics.totalIntents());
    assertEquals(0L, statistics.fillRateBps());
    assertEquals(0L, statistics.cancellationRateBps());
    assertEquals(0L, statistics.executionRateBps());
    assertEquals(BigInteger.ZERO, statistics.requestedBuyVolume());
  }

  @Test
  void shouldAggregateVolumesAndRates() {
    RegistryFixture fixture = new RegistryFixture();
    RegistryFacade facade = fixture.facade();
    facade.submit(CONTROLLER, buy(100), BigInteger.ZERO);
    facade.submit(CONTROLLER, sell(200, BTC), BigInteger.ZERO);
    facade.submit(CONTROLLER, buy(300), BigInteger.ZERO);
    facade.submit(CONTROLLER, sell(400, ETH), BigInteger.ZERO);
    facade.execute(KEEPER, 1L, BigInteger.valueOf(50), BigInteger.TEN);
    facade.execute(KEEPER, 2L, BigInteger.valueOf(200), BigInteger.TEN);
    facade.cancel(OWNER, 3L);

    ExecutionStatistics statistics = fixture.statistics().statistics();

    assertEquals(4L, statistics.totalIntents());
    assertEquals(2L, statistics.totalExecutions());
    assertEquals(1L, statistics.pending());
    assertEquals(2L, statistics.executed());
    assertEquals(1L, statistics.cancelled());
    assertEquals(BigInteger.valueOf(400), statistics.requestedBuyVolume());
    assertEquals(BigInteger.valueOf(600), statistics.requestedSellVolume());
    assertEquals(BigInteger.valueOf(50), statistics.executedBuyVolume());
    assertEquals(BigInteger.valueOf(200), statistics.executedSellVolume());
    // 250 filled of 300 requested across executed intents
    assertEquals(8_333L, statistics.fillRateBps());
    assertEquals(2_500L, statistics.cancellationRateBps());
    assertEquals(5_000L, statistics.executionRateBps());
  }

  @Test
  void shouldSummarizeVolumeBySymbolAndSubmitter() {
    RegistryFixture fixture = new RegistryFixture();
    RegistryFacade facade = fixture.facade();
    facade.submit(CONTROLLER, buy(100), BigInteger.ZERO);
    facade.submit(CONTROLLER, sell(200, BTC), BigInteger.ZERO);
    facade.execute(KEEPER, 1L, BigInteger.valueOf(40), BigInteger.TEN);
    ExecutionStatisticsService service = fixture.statistics();

    VolumeSummary eth = service.volumeBySymbol(ETH);
    assertEquals(1L, eth.intents());
    assertEquals(BigInteger.valueOf(100), eth.requestedVolume());
    assertEquals(BigInteger.valueOf(40), eth.executedVolume());

    VolumeSummary controller = service.volumeBySubmitter(CONTROLLER);
    assertEquals(2L, controller.intents());
    assertEquals(BigInteger.valueOf(300), controller.requestedVolume());

    assertEquals(0L, service.volumeBySubmitter(STRANGER).intents());
    assertEquals(1L, service.countPending());
    assertEquals(1L, service.countExecuted());
    assertEquals(0L, service.countCancelled());
  }
}

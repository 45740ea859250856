package com.tradeaggregator.worker.config;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tradeaggregator.domain.aggregation.AggregationDomainException;
import com.tradeaggregator.domain.aggregation.PartitionKey;
import java.util.List;
import org.junit.jupiter.api.Test;

class PartitionFilterTest {
  private static final PartitionKey BITFLYER_BTC = PartitionKey.of("bitflyer", "BTC_JPY");
  private static final PartitionKey BITFLYER_ETH = PartitionKey.of("bitflyer", "ETH_JPY");
  private static final PartitionKey LIQUID_BTC = PartitionKey.of("liquid", "BTCJPY");

  @Test
  void shouldEnableEverythingWithoutLists() {
    PartitionFilter filter = PartitionFilter.from(new AggregatorProperties.Partitions());

    assertTrue(filter.isEnabled(BITFLYER_BTC));
    assertTrue(filter.isEnabled(LIQUID_BTC));
  }

  @Test
  void shouldTreatEnabledListAsAllowList() {
    PartitionFilter filter = new PartitionFilter(List.of("bitflyer:*"), List.of());

    assertTrue(filter.isEnabled(BITFLYER_BTC));
    assertTrue(filter.isEnabled(BITFLYER_ETH));
    assertFalse(filter.isEnabled(LIQUID_BTC));
  }

  @Test
  void shouldLetDisabledEntryWinIgnoringCase() {
    PartitionFilter filter =
        new PartitionFilter(List.of(" BITFLYER "), List.of("bitflyer:eth_jpy", "liquid"));

    assertTrue(filter.isEnabled(BITFLYER_BTC));
    assertFalse(filter.isEnabled(BITFLYER_ETH));
    assertFalse(filter.isEnabled(LIQUID_BTC));
  }

  @Test
  void shouldAcceptSpacesAroundSeparator() {
    PartitionFilter filter = new PartitionFilter(List.of("bitflyer : btc_jpy"), List.of());

    assertTrue(filter.isEnabled(BITFLYER_BTC));
    assertFalse(filter.isEnabled(BITFLYER_ETH));
  }

  @Test
  void shouldRejectEntryWithoutExchangeOrInstrument() {
    assertThrows(
        AggregationDomainException.class,
        () -> new PartitionFilter(List.of(":BTC_JPY"), List.of()));
    assertThrows(
        AggregationDomainException.class,
        () -> new PartitionFilter(List.of(), List.of("bitflyer:")));
  }
}

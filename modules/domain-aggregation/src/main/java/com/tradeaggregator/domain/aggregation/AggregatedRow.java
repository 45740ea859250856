package com.tradeaggregator.domain.aggregation;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record AggregatedRow(
    PartitionKey partition,
    Instant tradedAt,
    TradeSide side,
    BigDecimal volumeSum,
    long tradeCount,
    BigDecimal priceOpen,
    BigDecimal priceHigh,
    BigDecimal priceLow,
    BigDecimal priceClose,
    BigDecimal priceAvg,
    long firstSequence,
    long lastSequence) {
  public AggregatedRow {
    Objects.requireNonNull(partition, "partition must not be null");
    Objects.requireNonNull(tradedAt, "tradedAt must not be null");
    Objects.requireNonNull(side, "side must not be null");
    Objects.requireNonNull(volumeSum, "volumeSum must not be null");
    Objects.requireNonNull(priceOpen, "priceOpen must not be null");
    Objects.requireNonNull(priceHigh, "priceHigh must not be null");
    Objects.requireNonNull(priceLow, "priceLow must not be null");
    Objects.requireNonNull(priceClose, "priceClose must not be null");
    Objects.requireNonNull(priceAvg, "priceAvg must not be null");
    if (tradeCount <= 0) {
      throw new AggregationDomainException("tradeCount must be > 0");
    }
    if (firstSequence > lastSequence) {
      throw new AggregationDomainException("firstSequence must not exceed lastSequence");
    }
  }
}

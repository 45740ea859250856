package com.tradeaggregator.domain.aggregation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/** Mutable running state for one (timestamp, side) group inside a single reduce call. */
final class ExecutionAccumulator {
  static final int AVG_SCALE = 12;

  private final Instant tradedAt;
  private final TradeSide side;
  private final long firstSequence;
  private final BigDecimal priceOpen;
  private BigDecimal volumeSum = BigDecimal.ZERO;
  private BigDecimal priceSum = BigDecimal.ZERO;
  private BigDecimal priceHigh;
  private BigDecimal priceLow;
  private BigDecimal priceClose;
  private long lastSequence;
  private long tradeCount;

  ExecutionAccumulator(RawExecution first) {
    this.tradedAt = first.tradedAt();
    this.side = first.side();
    this.firstSequence = first.sequence();
    this.priceOpen = first.price();
    this.priceHigh = first.price();
    this.priceLow = first.price();
  }

  void add(RawExecution execution) {
    BigDecimal price = execution.price();
    volumeSum = volumeSum.add(execution.volume());
    priceSum = priceSum.add(price);
    tradeCount++;
    priceClose = price;
    lastSequence = execution.sequence();
    if (price.compareTo(priceHigh) > 0) {
      priceHigh = price;
    }
    if (price.compareTo(priceLow) < 0) {
      priceLow = price;
    }
  }

  Instant tradedAt() {
    return tradedAt;
  }

  TradeSide side() {
    return side;
  }

  AggregatedRow toRow(PartitionKey partition) {
    BigDecimal priceAvg =
        priceSum.divide(BigDecimal.valueOf(tradeCount), AVG_SCALE, RoundingMode.HALF_EVEN);
    return new AggregatedRow(
        partition,
        tradedAt,
        side,
        volumeSum,
        tradeCount,
        priceOpen,
        priceHigh,
        priceLow,
        priceClose,
        priceAvg,
        firstSequence,
        lastSequence);
  }
}

package com.tradeaggregator.domain.aggregation;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * One trade execution as written by the downloader. Price, volume and timestamp may be missing in
 * the source; the aggregation engine rejects such rows instead of the reader. {@code ingestedAt} is
 * when the downloader stored the row, which for backfilled trades is much later than {@code
 * tradedAt}; it is null when the source does not record it.
 */
public record RawExecution(
    PartitionKey partition,
    long sequence,
    Instant tradedAt,
    BigDecimal price,
    BigDecimal volume,
    TradeSide side,
    Instant ingestedAt) {
  public RawExecution {
    Objects.requireNonNull(partition, "partition must not be null");
    side = side == null ? TradeSide.NONE : side;
  }
}

package com.tradeaggregator.domain.aggregation;

import java.util.List;
import java.util.Objects;

/**
 * Result of reducing one raw batch. {@code toSequence} is the highest raw sequence consumed and is
 * the value the watermark advances to when the batch commits.
 */
public record AggregatedBatch(
    PartitionKey partition,
    List<AggregatedRow> rows,
    long fromSequence,
    long toSequence,
    int rawRowCount) {
  public AggregatedBatch {
    Objects.requireNonNull(partition, "partition must not be null");
    rows = List.copyOf(Objects.requireNonNull(rows, "rows must not be null"));
    if (rawRowCount < 0) {
      throw new AggregationDomainException("rawRowCount must be >= 0");
    }
    if (!rows.isEmpty() && fromSequence > toSequence) {
      throw new AggregationDomainException("fromSequence must not exceed toSequence");
    }
  }

  public static AggregatedBatch empty(PartitionKey partition) {
    return new AggregatedBatch(partition, List.of(), 0L, 0L, 0);
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }
}

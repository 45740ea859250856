package com.tradeaggregator.worker.source;

import com.tradeaggregator.domain.aggregation.PartitionKey;
import com.tradeaggregator.domain.aggregation.RawExecution;
import java.util.List;
import java.util.Objects;

/**
 * Rows fetched for one cycle. {@code sourceExhausted} is true when no row existed after the last
 * one at read time.
 */
public record RawBatch(
    PartitionKey partition, long afterSequence, List<RawExecution> rows, boolean sourceExhausted) {
  public RawBatch {
    Objects.requireNonNull(partition, "partition must not be null");
    rows = List.copyOf(Objects.requireNonNull(rows, "rows must not be null"));
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public long lastSequence() {
    return rows.isEmpty() ? afterSequence : rows.get(rows.size() - 1).sequence();
  }
}

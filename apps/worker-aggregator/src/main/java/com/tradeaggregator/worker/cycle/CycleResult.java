package com.tradeaggregator.worker.cycle;

import com.tradeaggregator.domain.aggregation.PartitionKey;

public record CycleResult(
    PartitionKey partition,
    CycleOutcome outcome,
    long watermark,
    long fromSequence,
    long toSequence,
    int rawRows,
    int aggregatedRows) {
  static CycleResult idle(PartitionKey partition, CycleOutcome outcome, long watermark) {
    return new CycleResult(partition, outcome, watermark, 0L, 0L, 0, 0);
  }
}

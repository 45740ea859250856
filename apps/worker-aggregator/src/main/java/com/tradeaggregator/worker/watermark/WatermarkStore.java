package com.tradeaggregator.worker.watermark;

import com.tradeaggregator.domain.aggregation.PartitionKey;

/**
 * Per-partition progress cursor. {@link #advance} must run inside the same transaction as the
 * destination bulk load.
 */
public interface WatermarkStore {
  /** Sequence value of a partition that has never committed. Raw sequences start above it. */
  long NONE = 0L;

  long get(PartitionKey partition);

  /**
   * Moves the watermark from {@code expected} to {@code next}. Returns {@code false} without
   * writing when the stored value is not {@code expected}.
   */
  boolean advance(PartitionKey partition, long expected, long next, long rawRowsCommitted);
}

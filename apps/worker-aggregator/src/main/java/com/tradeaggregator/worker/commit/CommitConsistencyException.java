package com.tradeaggregator.worker.commit;

import com.tradeaggregator.domain.aggregation.PartitionKey;

/**
 * Destination and watermark disagree about what has been committed. Requires manual
 * reconciliation; retrying cannot fix it.
 */
public class CommitConsistencyException extends RuntimeException {
  private final long observedWatermark;

  public CommitConsistencyException(
      PartitionKey partition,
      long fromSequence,
      long toSequence,
      long observedWatermark,
      String reason,
      Throwable cause) {
    super(
        "Commit conflict partition="
            + partition
            + " fromSequence="
            + fromSequence
            + " toSequence="
            + toSequence
            + " watermark="
            + observedWatermark
            + ": "
            + reason,
        cause);
    this.observedWatermark = observedWatermark;
  }

  /** Watermark stored for the partition when the conflict was detected. */
  public long observedWatermark() {
    return observedWatermark;
  }
}

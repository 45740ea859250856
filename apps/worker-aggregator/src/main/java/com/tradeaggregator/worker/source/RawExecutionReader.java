package com.tradeaggregator.worker.source;

import com.tradeaggregator.domain.aggregation.PartitionKey;

public interface RawExecutionReader {
  /**
   * Returns rows with {@code sequence > afterSequence} in ascending order. {@code maxRows} is a
   * soft cap: a full page is extended until the timestamp of its last row changes. An empty batch
   * means the source has no new rows; I/O trouble is reported as {@link SourceReadException}.
   */
  RawBatch fetch(PartitionKey partition, long afterSequence, int maxRows);
}

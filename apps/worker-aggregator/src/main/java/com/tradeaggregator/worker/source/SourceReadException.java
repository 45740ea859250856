package com.tradeaggregator.worker.source;

import com.tradeaggregator.domain.aggregation.PartitionKey;

/** Transient failure while reading raw executions. Distinct from an empty result. */
public class SourceReadException extends RuntimeException {
  public SourceReadException(PartitionKey partition, long afterSequence, Throwable cause) {
    super(
        "Raw execution read failed partition=" + partition + " afterSequence=" + afterSequence,
        cause);
  }
}

package com.tradeaggregator.worker.cycle;

import com.tradeaggregator.domain.aggregation.PartitionKey;

@FunctionalInterface
public interface LeaseRenewal {
  LeaseRenewal ALWAYS_HELD = partition -> true;

  /** Extends this worker's claim on the partition. False when the claim could not be kept. */
  boolean renew(PartitionKey partition);
}

package com.tradeaggregator.worker.partition;

import com.tradeaggregator.domain.aggregation.PartitionKey;
import java.time.Duration;
import java.time.Instant;

/**
 * Cross-process claim on a partition. A lease is held by one owner until it expires; the holder
 * renews it by acquiring again.
 */
public interface PartitionLeaseRepository {
  boolean tryAcquire(PartitionKey partition, String ownerId, Instant now, Duration ttl);

  void release(PartitionKey partition, String ownerId);
}

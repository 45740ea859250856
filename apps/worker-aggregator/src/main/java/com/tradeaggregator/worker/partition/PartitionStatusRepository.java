package com.tradeaggregator.worker.partition;

import com.tradeaggregator.domain.aggregation.PartitionKey;
import com.tradeaggregator.worker.cycle.PartitionCycleException;
import java.time.Instant;
import java.util.Optional;

public interface PartitionStatusRepository {
  void recordSuccess(PartitionKey partition, long watermark, Instant at);

  void recordFailure(PartitionCycleException failure, int consecutiveFailures, Instant at);

  Optional<PartitionStatus> findStatus(PartitionKey partition);
}

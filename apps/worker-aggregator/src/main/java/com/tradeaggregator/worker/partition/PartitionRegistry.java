package com.tradeaggregator.worker.partition;

import com.tradeaggregator.domain.aggregation.PartitionKey;
import java.util.List;

public interface PartitionRegistry {
  /** Registers every partition present in the raw table. Returns the number of new partitions. */
  int discoverPartitions();

  List<PartitionKey> findEnabledPartitions();
}

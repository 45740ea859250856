package com.tradeaggregator.worker.cycle;

import com.tradeaggregator.domain.aggregation.PartitionCycleState;
import com.tradeaggregator.domain.aggregation.PartitionKey;

@FunctionalInterface
public interface PartitionStateListener {
  PartitionStateListener NOOP = (partition, state) -> {};

  void onTransition(PartitionKey partition, PartitionCycleState state);
}

package com.tradeaggregator.worker.scheduler;

import com.tradeaggregator.domain.aggregation.PartitionKey;
import java.util.List;

public record DrainSummary(
    int partitions,
    List<PartitionKey> drained,
    List<PartitionKey> failed,
    List<PartitionKey> skipped,
    boolean halted) {
  public DrainSummary {
    drained = List.copyOf(drained);
    failed = List.copyOf(failed);
    skipped = List.copyOf(skipped);
  }

  public boolean isSuccessful() {
    return failed.isEmpty() && skipped.isEmpty() && !halted;
  }
}

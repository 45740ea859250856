package com.tradeaggregator.worker.partition;

import com.tradeaggregator.domain.aggregation.PartitionKey;
import java.time.Instant;

/** Operator request to resume one partition, or every partition when {@code partition} is null. */
public record ResumeRequest(
    long id, PartitionKey partition, String reason, String requestedBy, Instant requestedAt) {
  public boolean appliesToAll() {
    return partition == null;
  }
}

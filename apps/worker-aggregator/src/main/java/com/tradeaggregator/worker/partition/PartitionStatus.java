package com.tradeaggregator.worker.partition;

import com.tradeaggregator.domain.aggregation.PartitionKey;
import java.time.Instant;
import java.util.Objects;

public record PartitionStatus(
    PartitionKey partition,
    boolean enabled,
    Instant lastSuccessAt,
    long lastWatermark,
    Instant lastErrorAt,
    String lastErrorKind,
    String lastErrorMessage,
    Long lastErrorFromSequence,
    Long lastErrorToSequence,
    int consecutiveFailures,
    Instant updatedAt) {
  public PartitionStatus {
    Objects.requireNonNull(partition, "partition must not be null");
  }
}

package com.tradeaggregator.domain.aggregation;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/** Complete CSV transfer payload for one aggregated batch. */
public record BulkPayload(
    PartitionKey partition, String content, int rowCount, long fromSequence, long toSequence) {
  public BulkPayload {
    Objects.requireNonNull(partition, "partition must not be null");
    Objects.requireNonNull(content, "content must not be null");
    if (rowCount < 0) {
      throw new AggregationDomainException("rowCount must be >= 0");
    }
  }

  public byte[] bytes() {
    return content.getBytes(StandardCharsets.UTF_8);
  }

  public int byteSize() {
    return bytes().length;
  }
}

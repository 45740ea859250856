package com.tradeaggregator.worker.cycle;

import com.tradeaggregator.domain.aggregation.PartitionKey;

/**
 * Failure of one partition cycle with the sequence range it attempted. A {@code toSequence} of 0
 * means the range end was not known yet (the fetch itself failed).
 */
public class PartitionCycleException extends RuntimeException {
  private final PartitionKey partition;
  private final CycleFailureKind kind;
  private final long fromSequence;
  private final long toSequence;

  public PartitionCycleException(
      PartitionKey partition,
      CycleFailureKind kind,
      long fromSequence,
      long toSequence,
      Throwable cause) {
    super(
        "Partition cycle failed partition="
            + partition
            + " kind="
            + kind
            + " fromSequence="
            + fromSequence
            + " toSequence="
            + toSequence
            + " error="
            + describe(cause),
        cause);
    this.partition = partition;
    this.kind = kind;
    this.fromSequence = fromSequence;
    this.toSequence = toSequence;
  }

  public PartitionKey partition() {
    return partition;
  }

  public CycleFailureKind kind() {
    return kind;
  }

  public long fromSequence() {
    return fromSequence;
  }

  public long toSequence() {
    return toSequence;
  }

  public String errorMessage() {
    return describe(getCause());
  }

  private static String describe(Throwable cause) {
    if (cause == null) {
      return "unknown";
    }
    String message = cause.getMessage();
    if (message == null || message.isBlank()) {
      return cause.getClass().getSimpleName();
    }
    String compact = message.replaceAll("\\s+", " ").trim();
    return compact.length() <= 500 ? compact : compact.substring(0, 500);
  }
}

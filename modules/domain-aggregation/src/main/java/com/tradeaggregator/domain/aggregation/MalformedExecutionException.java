package com.tradeaggregator.domain.aggregation;

/** A raw row that cannot be reduced. The batch containing it must not be committed. */
public class MalformedExecutionException extends AggregationDomainException {
  private final PartitionKey partition;
  private final long sequence;

  public MalformedExecutionException(PartitionKey partition, long sequence, String reason) {
    super("Malformed execution partition=" + partition + " sequence=" + sequence + ": " + reason);
    this.partition = partition;
    this.sequence = sequence;
  }

  public PartitionKey partition() {
    return partition;
  }

  public long sequence() {
    return sequence;
  }
}

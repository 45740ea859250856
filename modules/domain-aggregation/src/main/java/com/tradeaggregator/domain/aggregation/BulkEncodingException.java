package com.tradeaggregator.domain.aggregation;

public class BulkEncodingException extends AggregationDomainException {
  private final PartitionKey partition;

  public BulkEncodingException(PartitionKey partition, String message) {
    super("Cannot encode aggregated rows partition=" + partition + ": " + message);
    this.partition = partition;
  }

  public PartitionKey partition() {
    return partition;
  }
}

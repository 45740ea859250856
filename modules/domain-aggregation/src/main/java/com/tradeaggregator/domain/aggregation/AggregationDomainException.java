package com.tradeaggregator.domain.aggregation;

public class AggregationDomainException extends RuntimeException {
  public AggregationDomainException(String message) {
    super(message);
  }

  public AggregationDomainException(String message, Throwable cause) {
    super(message, cause);
  }
}

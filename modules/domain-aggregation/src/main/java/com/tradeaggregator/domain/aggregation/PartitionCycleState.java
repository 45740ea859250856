package com.tradeaggregator.domain.aggregation;

public enum PartitionCycleState {
  IDLE,
  FETCHING,
  REDUCING,
  COMMITTING,
  BACKOFF,
  SUSPENDED
}

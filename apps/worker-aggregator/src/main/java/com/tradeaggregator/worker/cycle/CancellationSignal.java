package com.tradeaggregator.worker.cycle;

@FunctionalInterface
public interface CancellationSignal {
  CancellationSignal NEVER = () -> false;

  boolean isCancellationRequested();
}

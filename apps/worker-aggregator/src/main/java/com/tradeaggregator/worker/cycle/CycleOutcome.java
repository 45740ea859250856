package com.tradeaggregator.worker.cycle;

public enum CycleOutcome {
  COMMITTED("committed", true),
  ALREADY_COMMITTED("already_committed", true),
  NO_WORK("no_work", false),
  HELD_BACK("held_back", false),
  CANCELLED("cancelled", false),
  /** The partition lease could not be renewed; nothing was committed. */
  LEASE_LOST("lease_lost", false);

  private final String metricTag;
  private final boolean progressed;

  CycleOutcome(String metricTag, boolean progressed) {
    this.metricTag = metricTag;
    this.progressed = progressed;
  }

  public String metricTag() {
    return metricTag;
  }

  /** Whether the watermark is now past the fetched rows, so another cycle may find more work. */
  public boolean progressed() {
    return progressed;
  }
}

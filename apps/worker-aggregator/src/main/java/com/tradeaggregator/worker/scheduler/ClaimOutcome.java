package com.tradeaggregator.worker.scheduler;

/** How one claim on a partition ended. */
public enum ClaimOutcome {
  /** The last cycle found nothing committable. */
  DRAINED,
  /** The cycle limit of the claim was reached while batches were still being committed. */
  MORE_WORK,
  FAILED,
  LEASE_UNAVAILABLE,
  CANCELLED
}

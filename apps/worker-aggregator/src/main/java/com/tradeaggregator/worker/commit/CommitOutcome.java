package com.tradeaggregator.worker.commit;

public enum CommitOutcome {
  COMMITTED,
  /** A previous attempt had already committed the batch; nothing was written this time. */
  ALREADY_COMMITTED
}

package com.tradeaggregator.worker.cycle;

public enum CycleFailureKind {
  /** Source or destination temporarily unavailable; retried after backoff. */
  TRANSIENT_IO("transient_io"),
  /** Commit timed out or the commit call itself failed; the next attempt re-reads the watermark. */
  COMMIT_UNKNOWN_OUTCOME("commit_unknown_outcome"),
  /** Raw rows cannot be reduced or encoded; nothing is committed and no row is skipped. */
  MALFORMED_DATA("malformed_data"),
  /** Destination and watermark disagree; the partition is suspended for manual repair. */
  CONSISTENCY_CONFLICT("consistency_conflict"),
  /** Programming error inside the cycle; only this partition is suspended until resumed. */
  UNEXPECTED("unexpected"),
  /** Configuration or schema problem; all new cycles stop. */
  FATAL("fatal");

  private final String metricTag;

  CycleFailureKind(String metricTag) {
    this.metricTag = metricTag;
  }

  public String metricTag() {
    return metricTag;
  }
}

package com.tradeaggregator.worker.partition;

import java.time.Instant;
import java.util.List;

public interface ResumeRequestRepository {
  /** Highest request id filed before {@code before}, or 0 when there is none. */
  long latestRequestIdBefore(Instant before);

  List<ResumeRequest> findAfter(long afterId, int limit);
}

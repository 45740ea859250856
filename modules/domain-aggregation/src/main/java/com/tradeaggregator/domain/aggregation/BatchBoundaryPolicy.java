package com.tradeaggregator.domain.aggregation;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Batch boundaries are negotiated by timestamp, never by row count alone: a (timestamp, side)
 * group must land in exactly one batch, which lets the destination use it as a natural key.
 */
public final class BatchBoundaryPolicy {
  private BatchBoundaryPolicy() {}

  /**
   * Number of leading rows in {@code candidates} that share {@code tradedAt}. Rows after the first
   * differing timestamp are not counted even if they repeat it, so the caller never skips a row.
   */
  public static int leadingGroupLength(List<RawExecution> candidates, Instant tradedAt) {
    Objects.requireNonNull(tradedAt, "tradedAt must not be null");
    int length = 0;
    for (RawExecution candidate : candidates) {
      if (!tradedAt.equals(candidate.tradedAt())) {
        break;
      }
      length++;
    }
    return length;
  }

  /**
   * Drops the trailing timestamp group when the batch reached the end of the source and the
   * partition received rows since {@code settledBefore}: the downloader may still be appending rows
   * for that timestamp. Settling is judged by ingestion time, not trade time, because a backfill
   * writes trades that are old by their own timestamp. Rows without an ingestion time never count
   * as settled. Returns the batch unchanged otherwise.
   */
  public static List<RawExecution> holdBackUnsettledTail(
      List<RawExecution> batch, boolean sourceExhausted, Instant settledBefore) {
    Objects.requireNonNull(batch, "batch must not be null");
    if (batch.isEmpty() || !sourceExhausted || settledBefore == null) {
      return batch;
    }
    Instant lastIngestedAt = latestIngestedAt(batch);
    if (lastIngestedAt != null && lastIngestedAt.isBefore(settledBefore)) {
      return batch;
    }
    Instant lastTradedAt = batch.get(batch.size() - 1).tradedAt();
    int end = batch.size();
    while (end > 0 && Objects.equals(lastTradedAt, batch.get(end - 1).tradedAt())) {
      end--;
    }
    return List.copyOf(batch.subList(0, end));
  }

  private static Instant latestIngestedAt(List<RawExecution> batch) {
    Instant latest = null;
    for (RawExecution row : batch) {
      if (row.ingestedAt() == null) {
        return null;
      }
      if (latest == null || row.ingestedAt().isAfter(latest)) {
        latest = row.ingestedAt();
      }
    }
    return latest;
  }
}

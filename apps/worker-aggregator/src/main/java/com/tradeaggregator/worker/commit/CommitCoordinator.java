package com.tradeaggregator.worker.commit;

import com.tradeaggregator.domain.aggregation.AggregatedBatch;
import com.tradeaggregator.domain.aggregation.BulkPayload;
import com.tradeaggregator.domain.aggregation.PartitionKey;
import com.tradeaggregator.worker.watermark.WatermarkStore;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Commits an aggregated batch and the matching watermark advance as one transaction.
 *
 * <p>The bulk load runs first, then the watermark moves from the value the cycle started with to
 * the batch's highest raw sequence. Any failure before commit rolls back both. A duplicate natural
 * key or a watermark that moved underneath the cycle is re-checked after rollback: if the stored
 * watermark already covers the batch, a previous attempt committed it and the conflict is benign.
 */
public class CommitCoordinator {
  private static final Logger log = LoggerFactory.getLogger(CommitCoordinator.class);

  private final TransactionOperations transactionOperations;
  private final BulkLoader bulkLoader;
  private final WatermarkStore watermarkStore;
  private final BulkPayloadStager stager;

  public CommitCoordinator(
      TransactionOperations transactionOperations,
      BulkLoader bulkLoader,
      WatermarkStore watermarkStore,
      BulkPayloadStager stager) {
    this.transactionOperations =
        Objects.requireNonNull(transactionOperations, "transactionOperations must not be null");
    this.bulkLoader = Objects.requireNonNull(bulkLoader, "bulkLoader must not be null");
    this.watermarkStore = Objects.requireNonNull(watermarkStore, "watermarkStore must not be null");
    this.stager = Objects.requireNonNull(stager, "stager must not be null");
  }

  public CommitOutcome commit(
      PartitionKey partition,
      long expectedWatermark,
      AggregatedBatch batch,
      BulkPayload payload) {
    if (batch.isEmpty()) {
      throw new IllegalArgumentException("Empty batch must not be committed partition=" + partition);
    }
    if (payload.rowCount() != batch.rows().size() || payload.toSequence() != batch.toSequence()) {
      throw new IllegalArgumentException(
          "Payload does not match batch partition="
              + partition
              + " payloadRows="
              + payload.rowCount()
              + " batchRows="
              + batch.rows().size());
    }
    try {
      transactionOperations.executeWithoutResult(
          status -> loadAndAdvance(partition, expectedWatermark, batch, payload));
      log.info(
          "Aggregated batch committed partition={} fromSequence={} toSequence={} rawRows={} aggregatedRows={} payloadBytes={}",
          partition,
          batch.fromSequence(),
          batch.toSequence(),
          batch.rawRowCount(),
          batch.rows().size(),
          payload.byteSize());
      return CommitOutcome.COMMITTED;
    } catch (DuplicateKeyException | WatermarkMovedException ex) {
      return resolveConflict(partition, batch, ex);
    }
  }

  private void loadAndAdvance(
      PartitionKey partition, long expectedWatermark, AggregatedBatch batch, BulkPayload payload) {
    try (StagedPayload staged = stager.stage(payload)) {
      long loaded = bulkLoader.load(staged);
      if (loaded != payload.rowCount()) {
        throw new CommitConsistencyException(
            partition,
            batch.fromSequence(),
            batch.toSequence(),
            expectedWatermark,
            "bulk load accepted " + loaded + " of " + payload.rowCount() + " rows",
            null);
      }
    }
    boolean advanced =
        watermarkStore.advance(
            partition, expectedWatermark, batch.toSequence(), batch.rawRowCount());
    if (!advanced) {
      throw new WatermarkMovedException(partition, expectedWatermark);
    }
  }

  private CommitOutcome resolveConflict(
      PartitionKey partition, AggregatedBatch batch, RuntimeException conflict) {
    long current = watermarkStore.get(partition);
    if (current >= batch.toSequence()) {
      log.info(
          "Benign commit conflict partition={} fromSequence={} toSequence={} watermark={} cause={}",
          partition,
          batch.fromSequence(),
          batch.toSequence(),
          current,
          conflict.getClass().getSimpleName());
      return CommitOutcome.ALREADY_COMMITTED;
    }
    throw new CommitConsistencyException(
        partition,
        batch.fromSequence(),
        batch.toSequence(),
        current,
        "destination rejected batch but watermark does not cover it",
        conflict);
  }

  static final class WatermarkMovedException extends RuntimeException {
    WatermarkMovedException(PartitionKey partition, long expected) {
      super("Watermark moved partition=" + partition + " expected=" + expected);
    }
  }
}

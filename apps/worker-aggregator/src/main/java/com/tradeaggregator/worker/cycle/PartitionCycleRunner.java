package com.tradeaggregator.worker.cycle;

import com.tradeaggregator.domain.aggregation.AggregatedBatch;
import com.tradeaggregator.domain.aggregation.AggregatedRowCsvEncoder;
import com.tradeaggregator.domain.aggregation.BatchBoundaryPolicy;
import com.tradeaggregator.domain.aggregation.BulkPayload;
import com.tradeaggregator.domain.aggregation.ExecutionAggregator;
import com.tradeaggregator.domain.aggregation.PartitionCycleState;
import com.tradeaggregator.domain.aggregation.PartitionKey;
import com.tradeaggregator.domain.aggregation.RawExecution;
import com.tradeaggregator.worker.commit.CommitCoordinator;
import com.tradeaggregator.worker.commit.CommitOutcome;
import com.tradeaggregator.worker.source.RawBatch;
import com.tradeaggregator.worker.source.RawExecutionReader;
import com.tradeaggregator.worker.watermark.WatermarkStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one fetch, reduce, encode and commit cycle for a partition. Cycles of the same partition
 * must not overlap; the scheduler guarantees that. Every cycle starts from the stored watermark,
 * so a retry after any failure re-reads and re-aggregates from the last committed position.
 */
public class PartitionCycleRunner {
  private static final Logger log = LoggerFactory.getLogger(PartitionCycleRunner.class);

  private static final String CYCLE_TOTAL_METRIC = "worker.aggregation.cycle.total";
  private static final String CYCLE_DURATION_METRIC = "worker.aggregation.cycle.duration";
  private static final String RAW_ROWS_METRIC = "worker.aggregation.rows.raw.total";
  private static final String AGGREGATED_ROWS_METRIC = "worker.aggregation.rows.aggregated.total";

  private final WatermarkStore watermarkStore;
  private final RawExecutionReader reader;
  private final ExecutionAggregator aggregator;
  private final AggregatedRowCsvEncoder encoder;
  private final CommitCoordinator commitCoordinator;
  private final int batchSize;
  private final Duration settleDelay;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public PartitionCycleRunner(
      WatermarkStore watermarkStore,
      RawExecutionReader reader,
      ExecutionAggregator aggregator,
      AggregatedRowCsvEncoder encoder,
      CommitCoordinator commitCoordinator,
      int batchSize,
      Duration settleDelay,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.watermarkStore = watermarkStore;
    this.reader = reader;
    this.aggregator = aggregator;
    this.encoder = encoder;
    this.commitCoordinator = commitCoordinator;
    this.batchSize = Math.max(1, batchSize);
    this.settleDelay = settleDelay;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  public CycleResult runCycle(
      PartitionKey partition, CancellationSignal cancellation, PartitionStateListener listener) {
    return runCycle(partition, cancellation, listener, LeaseRenewal.ALWAYS_HELD);
  }

  /**
   * Runs one cycle, renewing the partition lease once the fetch is done and again right before the
   * commit. A failed renewal ends the cycle with {@link CycleOutcome#LEASE_LOST} and commits
   * nothing.
   */
  public CycleResult runCycle(
      PartitionKey partition,
      CancellationSignal cancellation,
      PartitionStateListener listener,
      LeaseRenewal leaseRenewal) {
    Instant startedAt = clock.instant();
    try {
      CycleResult result = execute(partition, cancellation, listener, leaseRenewal);
      increment(partition, result.outcome().metricTag());
      return result;
    } catch (PartitionCycleException ex) {
      increment(partition, "failed_" + ex.kind().metricTag());
      throw ex;
    } finally {
      Timer.builder(CYCLE_DURATION_METRIC)
          .description("Partition aggregation cycle latency")
          .tag("exchange", partition.exchange())
          .register(meterRegistry)
          .record(Duration.between(startedAt, clock.instant()).abs());
    }
  }

  private CycleResult execute(
      PartitionKey partition,
      CancellationSignal cancellation,
      PartitionStateListener listener,
      LeaseRenewal leaseRenewal) {
    if (cancellation.isCancellationRequested()) {
      return CycleResult.idle(partition, CycleOutcome.CANCELLED, WatermarkStore.NONE);
    }

    listener.onTransition(partition, PartitionCycleState.FETCHING);
    long watermark = WatermarkStore.NONE;
    RawBatch raw;
    try {
      watermark = watermarkStore.get(partition);
      raw = reader.fetch(partition, watermark, batchSize);
    } catch (RuntimeException ex) {
      throw new PartitionCycleException(
          partition, CycleFailureClassifier.classifyBeforeCommit(ex), watermark + 1, 0L, ex);
    }
    if (raw.isEmpty()) {
      log.debug("No new raw executions partition={} watermark={}", partition, watermark);
      return CycleResult.idle(partition, CycleOutcome.NO_WORK, watermark);
    }
    if (!leaseRenewal.renew(partition)) {
      return leaseLost(partition, watermark, "fetch");
    }

    List<RawExecution> rows =
        BatchBoundaryPolicy.holdBackUnsettledTail(
            raw.rows(), raw.sourceExhausted(), settledBefore());
    if (rows.isEmpty()) {
      log.debug(
          "Holding back unsettled timestamp group partition={} watermark={} rows={}",
          partition,
          watermark,
          raw.rows().size());
      return CycleResult.idle(partition, CycleOutcome.HELD_BACK, watermark);
    }
    long fromSequence = rows.get(0).sequence();
    long toSequence = rows.get(rows.size() - 1).sequence();

    listener.onTransition(partition, PartitionCycleState.REDUCING);
    AggregatedBatch batch;
    BulkPayload payload;
    try {
      batch = aggregator.reduce(partition, rows);
      payload = encoder.encode(batch);
    } catch (RuntimeException ex) {
      throw new PartitionCycleException(
          partition,
          CycleFailureClassifier.classifyBeforeCommit(ex),
          fromSequence,
          toSequence,
          ex);
    }

    if (cancellation.isCancellationRequested()) {
      log.info(
          "Cycle cancelled before commit partition={} fromSequence={} toSequence={}",
          partition,
          fromSequence,
          toSequence);
      return CycleResult.idle(partition, CycleOutcome.CANCELLED, watermark);
    }
    if (!leaseRenewal.renew(partition)) {
      return leaseLost(partition, watermark, "commit");
    }

    listener.onTransition(partition, PartitionCycleState.COMMITTING);
    CommitOutcome commitOutcome;
    try {
      commitOutcome = commitCoordinator.commit(partition, watermark, batch, payload);
    } catch (RuntimeException ex) {
      throw new PartitionCycleException(
          partition, CycleFailureClassifier.classifyCommit(ex), fromSequence, toSequence, ex);
    }

    if (commitOutcome == CommitOutcome.ALREADY_COMMITTED) {
      return new CycleResult(
          partition,
          CycleOutcome.ALREADY_COMMITTED,
          toSequence,
          fromSequence,
          toSequence,
          rows.size(),
          0);
    }
    meterRegistry
        .counter(RAW_ROWS_METRIC, "exchange", partition.exchange())
        .increment(batch.rawRowCount());
    meterRegistry
        .counter(AGGREGATED_ROWS_METRIC, "exchange", partition.exchange())
        .increment(batch.rows().size());
    return new CycleResult(
        partition,
        CycleOutcome.COMMITTED,
        toSequence,
        fromSequence,
        toSequence,
        batch.rawRowCount(),
        batch.rows().size());
  }

  private static CycleResult leaseLost(PartitionKey partition, long watermark, String step) {
    log.warn(
        "Partition lease lost, abandoning cycle partition={} step={} watermark={}",
        partition,
        step,
        watermark);
    return CycleResult.idle(partition, CycleOutcome.LEASE_LOST, watermark);
  }

  private Instant settledBefore() {
    if (settleDelay == null || settleDelay.isZero() || settleDelay.isNegative()) {
      return null;
    }
    return clock.instant().minus(settleDelay);
  }

  private void increment(PartitionKey partition, String outcome) {
    meterRegistry
        .counter(CYCLE_TOTAL_METRIC, "exchange", partition.exchange(), "outcome", outcome)
        .increment();
  }
}

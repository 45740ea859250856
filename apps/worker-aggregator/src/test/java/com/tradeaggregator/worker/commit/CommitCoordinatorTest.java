package com.tradeaggregator.worker.commit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tradeaggregator.domain.aggregation.AggregatedBatch;
import com.tradeaggregator.domain.aggregation.AggregatedRowCsvEncoder;
import com.tradeaggregator.domain.aggregation.BulkPayload;
import com.tradeaggregator.domain.aggregation.ExecutionAggregator;
import com.tradeaggregator.domain.aggregation.PartitionKey;
import com.tradeaggregator.domain.aggregation.RawExecution;
import com.tradeaggregator.domain.aggregation.TradeSide;
import com.tradeaggregator.worker.config.AggregatorProperties.StagingMode;
import com.tradeaggregator.worker.testing.InMemoryAggregationStore;
import com.tradeaggregator.worker.testing.InMemoryTransactionOperations;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessResourceFailureException;

class CommitCoordinatorTest {
  private static final PartitionKey PARTITION = PartitionKey.of("bitflyer", "BTC_JPY");
  private static final Instant T100 = Instant.parse("2026-03-01T00:00:00.100Z");
  private static final Instant T105 = Instant.parse("2026-03-01T00:00:00.105Z");

  private final ExecutionAggregator aggregator = new ExecutionAggregator();
  private final AggregatedRowCsvEncoder encoder = new AggregatedRowCsvEncoder();

  private InMemoryAggregationStore store;
  private InMemoryTransactionOperations transactions;
  private CommitCoordinator coordinator;

  @BeforeEach
  void setUp() {
    store = new InMemoryAggregationStore();
    transactions = new InMemoryTransactionOperations(store);
    coordinator =
        new CommitCoordinator(transactions, store, store, BulkPayloadStager.inMemory());
  }

  @Test
  void shouldLoadRowsAndAdvanceWatermarkTogether() {
    AggregatedBatch batch = aggregator.reduce(PARTITION, exampleRows());

    CommitOutcome outcome = coordinator.commit(PARTITION, 0L, batch, encoder.encode(batch));

    assertEquals(CommitOutcome.COMMITTED, outcome);
    assertEquals(3L, store.get(PARTITION));
    assertEquals(3L, store.rawRowsCommitted(PARTITION));
    assertEquals(2, store.rows().size());
    assertEquals(1, transactions.commits());
  }

  @Test
  void shouldRollBackLoadedRowsWhenWatermarkAdvanceFails() {
    AggregatedBatch batch = aggregator.reduce(PARTITION, exampleRows());
    BulkPayload payload = encoder.encode(batch);
    store.failNextAdvance(new DataAccessResourceFailureException("connection reset"));

    assertThrows(
        DataAccessResourceFailureException.class,
        () -> coordinator.commit(PARTITION, 0L, batch, payload));
    assertEquals(0L, store.get(PARTITION));
    assertTrue(store.rows().isEmpty());

    CommitOutcome retried = coordinator.commit(PARTITION, 0L, batch, payload);

    assertEquals(CommitOutcome.COMMITTED, retried);
    assertEquals(3L, store.get(PARTITION));
    assertEquals(2, store.rows().size());
  }

  @Test
  void shouldRollBackWhenFailureHitsBetweenLoadAndAdvance() {
    AggregatedBatch batch = aggregator.reduce(PARTITION, exampleRows());
    BulkPayload payload = encoder.encode(batch);
    store.failNextLoadAfterWrite(new IllegalStateException("process killed"));

    assertThrows(
        IllegalStateException.class, () -> coordinator.commit(PARTITION, 0L, batch, payload));

    assertEquals(0L, store.get(PARTITION));
    assertTrue(store.rows().isEmpty());
    assertEquals(1, transactions.rollbacks());
  }

  @Test
  void shouldReportAlreadyCommittedWhenRetryHitsOwnRows() {
    AggregatedBatch batch = aggregator.reduce(PARTITION, exampleRows());
    BulkPayload payload = encoder.encode(batch);
    coordinator.commit(PARTITION, 0L, batch, payload);

    CommitOutcome outcome = coordinator.commit(PARTITION, 0L, batch, payload);

    assertEquals(CommitOutcome.ALREADY_COMMITTED, outcome);
    assertEquals(3L, store.get(PARTITION));
    assertEquals(2, store.rows().size());
  }

  @Test
  void shouldRaiseConsistencyConflictForDuplicateNotCoveredByWatermark() {
    AggregatedBatch first = aggregator.reduce(PARTITION, exampleRows());
    coordinator.commit(PARTITION, 0L, first, encoder.encode(first));
    AggregatedBatch late =
        aggregator.reduce(PARTITION, List.of(raw(4, T100, TradeSide.BUY, "11", "1")));

    CommitConsistencyException ex =
        assertThrows(
            CommitConsistencyException.class,
            () -> coordinator.commit(PARTITION, 3L, late, encoder.encode(late)));

    assertEquals(3L, store.get(PARTITION));
    assertEquals(2, store.rows().size());
    assertTrue(ex.getMessage().contains("toSequence=4"));
    assertEquals(3L, ex.observedWatermark());
  }

  @Test
  void shouldRaiseConsistencyConflictWhenWatermarkMovedBelowBatch() {
    store.setWatermark(PARTITION, 2L);
    AggregatedBatch batch = aggregator.reduce(PARTITION, exampleRows());

    CommitConsistencyException ex =
        assertThrows(
            CommitConsistencyException.class,
            () -> coordinator.commit(PARTITION, 0L, batch, encoder.encode(batch)));

    assertEquals(2L, store.get(PARTITION));
    assertEquals(2L, ex.observedWatermark());
    assertTrue(store.rows().isEmpty());
  }

  @Test
  void shouldRejectPartialBulkLoad() {
    coordinator =
        new CommitCoordinator(transactions, staged -> 1L, store, BulkPayloadStager.inMemory());
    AggregatedBatch batch = aggregator.reduce(PARTITION, exampleRows());

    assertThrows(
        CommitConsistencyException.class,
        () -> coordinator.commit(PARTITION, 0L, batch, encoder.encode(batch)));

    assertEquals(0L, store.get(PARTITION));
  }

  @Test
  void shouldRejectEmptyBatch() {
    AggregatedBatch empty = AggregatedBatch.empty(PARTITION);

    assertThrows(
        IllegalArgumentException.class,
        () -> coordinator.commit(PARTITION, 0L, empty, encoder.encode(empty)));
    assertEquals(0, transactions.commits());
  }

  @Test
  void shouldDeleteStagingFileAfterCommit(@TempDir Path stagingDir) throws IOException {
    Clock clock = Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC);
    coordinator =
        new CommitCoordinator(
            transactions, store, store, new BulkPayloadStager(StagingMode.FILE, stagingDir, clock));
    AggregatedBatch batch = aggregator.reduce(PARTITION, exampleRows());

    coordinator.commit(PARTITION, 0L, batch, encoder.encode(batch));

    assertEquals(2, store.rows().size());
    try (Stream<Path> files = Files.list(stagingDir)) {
      assertEquals(0L, files.count());
    }
  }

  private static List<RawExecution> exampleRows() {
    return List.of(
        raw(1, T100, TradeSide.BUY, "10", "2"),
        raw(2, T100, TradeSide.BUY, "12", "3"),
        raw(3, T105, TradeSide.SELL, "9", "1"));
  }

  private static RawExecution raw(
      long sequence, Instant tradedAt, TradeSide side, String price, String volume) {
    return new RawExecution(
        PARTITION,
        sequence,
        tradedAt,
        new BigDecimal(price),
        new BigDecimal(volume),
        side,
        tradedAt);
  }
}

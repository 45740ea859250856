package com.tradeaggregator.worker.partition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tradeaggregator.domain.aggregation.PartitionKey;
import com.tradeaggregator.testsupport.containers.PostgresTestDatabase;
import com.tradeaggregator.worker.cycle.CycleFailureKind;
import com.tradeaggregator.worker.cycle.PartitionCycleException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class JdbcPartitionRepositoriesIntegrationTest {
  @Container static final PostgreSQLContainer<?> POSTGRES = PostgresTestDatabase.newContainer();

  private static final PartitionKey BTC = PartitionKey.of("bitflyer", "BTC_JPY");
  private static final PartitionKey XRP = PartitionKey.of("liquid", "XRPJPY");
  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  private JdbcTemplate jdbcTemplate;
  private JdbcPartitionRegistry registry;
  private JdbcPartitionStatusRepository statusRepository;
  private JdbcPartitionLeaseRepository leaseRepository;
  private JdbcResumeRequestRepository resumeRequestRepository;

  @BeforeEach
  void setUp() {
    jdbcTemplate = new JdbcTemplate(PostgresTestDatabase.cleanMigratedDataSource(POSTGRES));
    registry = new JdbcPartitionRegistry(jdbcTemplate);
    statusRepository = new JdbcPartitionStatusRepository(jdbcTemplate);
    leaseRepository = new JdbcPartitionLeaseRepository(jdbcTemplate);
    resumeRequestRepository = new JdbcResumeRequestRepository(jdbcTemplate);
  }

  @Test
  void shouldDiscoverPartitionsOnceAndHonorDisabledFlag() {
    insertRaw(BTC);
    insertRaw(BTC);
    insertRaw(XRP);

    assertEquals(2, registry.discoverPartitions());
    assertEquals(0, registry.discoverPartitions());

    jdbcTemplate.update(
        "UPDATE aggregation_partitions SET enabled = FALSE WHERE exchange = ?", XRP.exchange());

    assertEquals(List.of(BTC), registry.findEnabledPartitions());
  }

  @Test
  void shouldIgnoreBlankPartitionKeysInsteadOfFailingDiscovery() {
    insertRaw(BTC);
    insertRaw(" ", "BTC_JPY");
    insertRaw("bitflyer", "");
    jdbcTemplate.update(
        """
        INSERT INTO aggregation_partitions (exchange, instrument, enabled)
        VALUES ('', 'ETH_JPY', TRUE)
        """);

    assertEquals(1, registry.discoverPartitions());
    assertEquals(List.of(BTC), registry.findEnabledPartitions());
  }

  @Test
  void shouldRecordFailureThenClearCounterOnSuccess() {
    PartitionCycleException failure =
        new PartitionCycleException(
            BTC, CycleFailureKind.MALFORMED_DATA, 11L, 20L, new IllegalStateException("bad row"));

    statusRepository.recordFailure(failure, 2, NOW);
    PartitionStatus failed = statusRepository.findStatus(BTC).orElseThrow();

    assertEquals("MALFORMED_DATA", failed.lastErrorKind());
    assertEquals(11L, failed.lastErrorFromSequence());
    assertEquals(20L, failed.lastErrorToSequence());
    assertEquals(2, failed.consecutiveFailures());
    assertEquals(NOW, failed.lastErrorAt());
    assertNull(failed.lastSuccessAt());

    statusRepository.recordSuccess(BTC, 20L, NOW.plusSeconds(5));
    PartitionStatus recovered = statusRepository.findStatus(BTC).orElseThrow();

    assertEquals(0, recovered.consecutiveFailures());
    assertEquals(20L, recovered.lastWatermark());
    assertNotNull(recovered.lastSuccessAt());
    assertEquals("MALFORMED_DATA", recovered.lastErrorKind());
  }

  @Test
  void shouldGrantLeaseToOneOwnerUntilExpiryOrRelease() {
    Duration ttl = Duration.ofMinutes(2);

    assertTrue(leaseRepository.tryAcquire(BTC, "worker-a", NOW, ttl));
    assertFalse(leaseRepository.tryAcquire(BTC, "worker-b", NOW.plusSeconds(30), ttl));
    assertTrue(leaseRepository.tryAcquire(BTC, "worker-a", NOW.plusSeconds(30), ttl));
    assertTrue(leaseRepository.tryAcquire(BTC, "worker-b", NOW.plusSeconds(200), ttl));

    leaseRepository.release(BTC, "worker-a");
    assertFalse(leaseRepository.tryAcquire(BTC, "worker-a", NOW.plusSeconds(201), ttl));

    leaseRepository.release(BTC, "worker-b");
    assertTrue(leaseRepository.tryAcquire(BTC, "worker-a", NOW.plusSeconds(202), ttl));
  }

  @Test
  void shouldListResumeRequestsInFilingOrder() {
    insertResumeRequest(BTC, NOW.minusSeconds(60));
    insertResumeRequest(null, NOW.plusSeconds(1));
    insertResumeRequest(XRP, NOW.plusSeconds(2));

    long beforeStart = resumeRequestRepository.latestRequestIdBefore(NOW);
    List<ResumeRequest> pending = resumeRequestRepository.findAfter(beforeStart, 10);

    assertEquals(2, pending.size());
    assertTrue(pending.get(0).appliesToAll());
    assertEquals(XRP, pending.get(1).partition());
    assertEquals("operator", pending.get(1).requestedBy());
    assertEquals(NOW.plusSeconds(2), pending.get(1).requestedAt());
    assertEquals(1, resumeRequestRepository.findAfter(pending.get(0).id(), 10).size());
    assertEquals(0L, resumeRequestRepository.latestRequestIdBefore(NOW.minusSeconds(120)));
  }

  private void insertResumeRequest(PartitionKey partition, Instant requestedAt) {
    jdbcTemplate.update(
        """
        INSERT INTO aggregation_resume_requests
            (exchange, instrument, reason, requested_by, requested_at)
        VALUES (?, ?, 'reconciled', 'operator', ?)
        """,
        partition == null ? null : partition.exchange(),
        partition == null ? null : partition.instrument(),
        Timestamp.from(requestedAt));
  }

  private void insertRaw(PartitionKey partition) {
    insertRaw(partition.exchange(), partition.instrument());
  }

  private void insertRaw(String exchange, String instrument) {
    jdbcTemplate.update(
        """
        INSERT INTO raw_executions (exchange, instrument, traded_at, price, volume, side)
        VALUES (?, ?, NOW(), 1, 1, 'buy')
        """,
        exchange,
        instrument);
  }
}

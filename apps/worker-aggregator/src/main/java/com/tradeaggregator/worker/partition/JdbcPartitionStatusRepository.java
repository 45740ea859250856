package com.tradeaggregator.worker.partition;

import com.tradeaggregator.domain.aggregation.PartitionKey;
import com.tradeaggregator.worker.cycle.PartitionCycleException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcPartitionStatusRepository implements PartitionStatusRepository {
  private final JdbcTemplate jdbcTemplate;

  public JdbcPartitionStatusRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public void recordSuccess(PartitionKey partition, long watermark, Instant at) {
    String sql =
        """
        INSERT INTO aggregation_partitions (
            exchange,
            instrument,
            enabled,
            last_success_at,
            last_watermark,
            consecutive_failures,
            updated_at
        ) VALUES (?, ?, TRUE, ?, ?, 0, ?)
        ON CONFLICT (exchange, instrument) DO UPDATE SET
            last_success_at = EXCLUDED.last_success_at,
            last_watermark = GREATEST(aggregation_partitions.last_watermark, EXCLUDED.last_watermark),
            consecutive_failures = 0,
            updated_at = EXCLUDED.updated_at
        """;
    Timestamp timestamp = Timestamp.from(at);
    jdbcTemplate.update(
        sql, partition.exchange(), partition.instrument(), timestamp, watermark, timestamp);
  }

  @Override
  public void recordFailure(PartitionCycleException failure, int consecutiveFailures, Instant at) {
    String sql =
        """
        INSERT INTO aggregation_partitions (
            exchange,
            instrument,
            enabled,
            last_error_at,
            last_error_kind,
            last_error_message,
            last_error_from_sequence,
            last_error_to_sequence,
            consecutive_failures,
            updated_at
        ) VALUES (?, ?, TRUE, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (exchange, instrument) DO UPDATE SET
            last_error_at = EXCLUDED.last_error_at,
            last_error_kind = EXCLUDED.last_error_kind,
            last_error_message = EXCLUDED.last_error_message,
            last_error_from_sequence = EXCLUDED.last_error_from_sequence,
            last_error_to_sequence = EXCLUDED.last_error_to_sequence,
            consecutive_failures = EXCLUDED.consecutive_failures,
            updated_at = EXCLUDED.updated_at
        """;
    Timestamp timestamp = Timestamp.from(at);
    PartitionKey partition = failure.partition();
    jdbcTemplate.update(
        sql,
        partition.exchange(),
        partition.instrument(),
        timestamp,
        failure.kind().name(),
        failure.errorMessage(),
        failure.fromSequence(),
        failure.toSequence() > 0 ? failure.toSequence() : null,
        consecutiveFailures,
        timestamp);
  }

  @Override
  public Optional<PartitionStatus> findStatus(PartitionKey partition) {
    String sql =
        """
        SELECT exchange,
               instrument,
               enabled,
               last_success_at,
               last_watermark,
               last_error_at,
               last_error_kind,
               last_error_message,
               last_error_from_sequence,
               last_error_to_sequence,
               consecutive_failures,
               updated_at
        FROM aggregation_partitions
        WHERE exchange = ?
          AND instrument = ?
        """;
    List<PartitionStatus> rows =
        jdbcTemplate.query(sql, this::mapRow, partition.exchange(), partition.instrument());
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(rows.get(0));
  }

  private PartitionStatus mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new PartitionStatus(
        new PartitionKey(rs.getString("exchange"), rs.getString("instrument")),
        rs.getBoolean("enabled"),
        toInstant(rs, "last_success_at"),
        rs.getLong("last_watermark"),
        toInstant(rs, "last_error_at"),
        rs.getString("last_error_kind"),
        rs.getString("last_error_message"),
        rs.getObject("last_error_from_sequence", Long.class),
        rs.getObject("last_error_to_sequence", Long.class),
        rs.getInt("consecutive_failures"),
        toInstant(rs, "updated_at"));
  }

  private static Instant toInstant(ResultSet rs, String column) throws SQLException {
    Timestamp value = rs.getTimestamp(column);
    return value == null ? null : value.toInstant();
  }
}

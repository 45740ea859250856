package com.tradeaggregator.worker.watermark;

import com.tradeaggregator.domain.aggregation.PartitionKey;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcWatermarkStore implements WatermarkStore {
  private final JdbcTemplate jdbcTemplate;

  public JdbcWatermarkStore(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public long get(PartitionKey partition) {
    String sql =
        """
        SELECT last_sequence
        FROM aggregation_watermarks
        WHERE exchange = ?
          AND instrument = ?
        """;
    List<Long> rows =
        jdbcTemplate.query(
            sql,
            (rs, rowNum) -> rs.getLong("last_sequence"),
            partition.exchange(),
            partition.instrument());
    if (rows.isEmpty()) {
      return NONE;
    }
    return rows.get(0);
  }

  @Override
  public boolean advance(PartitionKey partition, long expected, long next, long rawRowsCommitted) {
    if (next <= expected) {
      throw new IllegalArgumentException(
          "Watermark must move forward partition="
              + partition
              + " expected="
              + expected
              + " next="
              + next);
    }
    if (expected == NONE) {
      String insertSql =
          """
          INSERT INTO aggregation_watermarks (
              exchange,
              instrument,
              last_sequence,
              raw_rows_committed,
              updated_at
          ) VALUES (?, ?, ?, ?, NOW())
          ON CONFLICT (exchange, instrument) DO NOTHING
          """;
      int inserted =
          jdbcTemplate.update(
              insertSql, partition.exchange(), partition.instrument(), next, rawRowsCommitted);
      if (inserted == 1) {
        return true;
      }
    }
    String updateSql =
        """
        UPDATE aggregation_watermarks
        SET last_sequence = ?,
            raw_rows_committed = raw_rows_committed + ?,
            updated_at = NOW()
        WHERE exchange = ?
          AND instrument = ?
          AND last_sequence = ?
        """;
    int updated =
        jdbcTemplate.update(
            updateSql,
            next,
            rawRowsCommitted,
            partition.exchange(),
            partition.instrument(),
            expected);
    return updated == 1;
  }
}

package com.tradeaggregator.worker.source;

import com.tradeaggregator.domain.aggregation.AggregationDomainException;
import com.tradeaggregator.domain.aggregation.BatchBoundaryPolicy;
import com.tradeaggregator.domain.aggregation.MalformedExecutionException;
import com.tradeaggregator.domain.aggregation.PartitionKey;
import com.tradeaggregator.domain.aggregation.RawExecution;
import com.tradeaggregator.domain.aggregation.TradeSide;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcRawExecutionReader implements RawExecutionReader {
  private static final String PAGE_SQL =
      """
      SELECT id,
             exchange,
             instrument,
             traded_at,
             price,
             volume,
             side,
             created_at
      FROM raw_executions
      WHERE exchange = ?
        AND instrument = ?
        AND id > ?
      ORDER BY id ASC
      LIMIT ?
      """;

  // Rest of the boundary group plus the first row after it, if any, in one bounded statement.
  private static final String GROUP_REST_SQL =
      """
      SELECT id,
             exchange,
             instrument,
             traded_at,
             price,
             volume,
             side,
             created_at
      FROM raw_executions
      WHERE exchange = ?
        AND instrument = ?
        AND id > ?
        AND id <= COALESCE(
            (SELECT MIN(next_row.id)
             FROM raw_executions next_row
             WHERE next_row.exchange = ?
               AND next_row.instrument = ?
               AND next_row.id > ?
               AND next_row.traded_at IS DISTINCT FROM ?),
            9223372036854775807)
      ORDER BY id ASC
      """;

  private final JdbcTemplate jdbcTemplate;

  public JdbcRawExecutionReader(@Qualifier("sourceJdbcTemplate") JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public RawBatch fetch(PartitionKey partition, long afterSequence, int maxRows) {
    int pageSize = Math.max(1, maxRows);
    try {
      List<RawExecution> rows = new ArrayList<>(readPage(partition, afterSequence, pageSize));
      if (rows.size() < pageSize) {
        return new RawBatch(partition, afterSequence, rows, true);
      }
      return extendToTimestampBoundary(partition, afterSequence, rows);
    } catch (TransientDataAccessException
        | RecoverableDataAccessException
        | DataAccessResourceFailureException ex) {
      throw new SourceReadException(partition, afterSequence, ex);
    }
  }

  // A full page may end inside a timestamp group; pull the rest of that group in one statement.
  private RawBatch extendToTimestampBoundary(
      PartitionKey partition, long afterSequence, List<RawExecution> rows) {
    RawExecution last = rows.get(rows.size() - 1);
    Instant boundary = last.tradedAt();
    if (boundary == null) {
      return new RawBatch(partition, afterSequence, rows, false);
    }
    List<RawExecution> rest =
        jdbcTemplate.query(
            GROUP_REST_SQL,
            this::mapRow,
            partition.exchange(),
            partition.instrument(),
            last.sequence(),
            partition.exchange(),
            partition.instrument(),
            last.sequence(),
            Timestamp.from(boundary));
    int sameTimestamp = BatchBoundaryPolicy.leadingGroupLength(rest, boundary);
    rows.addAll(rest.subList(0, sameTimestamp));
    return new RawBatch(partition, afterSequence, rows, sameTimestamp == rest.size());
  }

  private List<RawExecution> readPage(PartitionKey partition, long afterSequence, int limit) {
    return jdbcTemplate.query(
        PAGE_SQL,
        this::mapRow,
        partition.exchange(),
        partition.instrument(),
        afterSequence,
        limit);
  }

  private RawExecution mapRow(ResultSet rs, int rowNum) throws SQLException {
    PartitionKey partition = new PartitionKey(rs.getString("exchange"), rs.getString("instrument"));
    long sequence = rs.getLong("id");
    return new RawExecution(
        partition,
        sequence,
        toInstant(rs.getTimestamp("traded_at")),
        rs.getBigDecimal("price"),
        rs.getBigDecimal("volume"),
        side(partition, sequence, rs.getString("side")),
        toInstant(rs.getTimestamp("created_at")));
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  private static TradeSide side(PartitionKey partition, long sequence, String rawSide) {
    try {
      return TradeSide.fromRaw(rawSide);
    } catch (AggregationDomainException ex) {
      throw new MalformedExecutionException(partition, sequence, ex.getMessage());
    }
  }
}

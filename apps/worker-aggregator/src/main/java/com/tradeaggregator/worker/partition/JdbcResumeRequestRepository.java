package com.tradeaggregator.worker.partition;

import com.tradeaggregator.domain.aggregation.PartitionKey;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcResumeRequestRepository implements ResumeRequestRepository {
  private final JdbcTemplate jdbcTemplate;

  public JdbcResumeRequestRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public long latestRequestIdBefore(Instant before) {
    String sql =
        """
        SELECT COALESCE(MAX(id), 0)
        FROM aggregation_resume_requests
        WHERE requested_at < ?
        """;
    Long latest = jdbcTemplate.queryForObject(sql, Long.class, Timestamp.from(before));
    return latest == null ? 0L : latest;
  }

  @Override
  public List<ResumeRequest> findAfter(long afterId, int limit) {
    String sql =
        """
        SELECT id,
               exchange,
               instrument,
               reason,
               requested_by,
               requested_at
        FROM aggregation_resume_requests
        WHERE id > ?
        ORDER BY id ASC
        LIMIT ?
        """;
    return jdbcTemplate.query(sql, this::mapRow, afterId, Math.max(1, limit));
  }

  private ResumeRequest mapRow(ResultSet rs, int rowNum) throws SQLException {
    String exchange = rs.getString("exchange");
    String instrument = rs.getString("instrument");
    PartitionKey partition =
        exchange == null || instrument == null ? null : new PartitionKey(exchange, instrument);
    Timestamp requestedAt = rs.getTimestamp("requested_at");
    return new ResumeRequest(
        rs.getLong("id"),
        partition,
        rs.getString("reason"),
        rs.getString("requested_by"),
        requestedAt == null ? null : requestedAt.toInstant());
  }
}

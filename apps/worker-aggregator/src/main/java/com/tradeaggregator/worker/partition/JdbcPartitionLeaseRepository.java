package com.tradeaggregator.worker.partition;

import com.tradeaggregator.domain.aggregation.PartitionKey;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcPartitionLeaseRepository implements PartitionLeaseRepository {
  private final JdbcTemplate jdbcTemplate;

  public JdbcPartitionLeaseRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public boolean tryAcquire(PartitionKey partition, String ownerId, Instant now, Duration ttl) {
    String sql =
        """
        INSERT INTO aggregation_partition_leases (
            exchange,
            instrument,
            owner_id,
            lease_expires_at,
            updated_at
        ) VALUES (?, ?, ?, ?, ?)
        ON CONFLICT (exchange, instrument) DO UPDATE SET
            owner_id = EXCLUDED.owner_id,
            lease_expires_at = EXCLUDED.lease_expires_at,
            updated_at = EXCLUDED.updated_at
        WHERE aggregation_partition_leases.owner_id = EXCLUDED.owner_id
           OR aggregation_partition_leases.lease_expires_at <= EXCLUDED.updated_at
        RETURNING owner_id
        """;
    List<String> owners =
        jdbcTemplate.query(
            sql,
            (rs, rowNum) -> rs.getString("owner_id"),
            partition.exchange(),
            partition.instrument(),
            ownerId,
            Timestamp.from(now.plus(ttl)),
            Timestamp.from(now));
    return !owners.isEmpty();
  }

  @Override
  public void release(PartitionKey partition, String ownerId) {
    String sql =
        """
        DELETE FROM aggregation_partition_leases
        WHERE exchange = ?
          AND instrument = ?
          AND owner_id = ?
        """;
    jdbcTemplate.update(sql, partition.exchange(), partition.instrument(), ownerId);
  }
}

package com.tradeaggregator.worker.partition;

import com.tradeaggregator.domain.aggregation.AggregationDomainException;
import com.tradeaggregator.domain.aggregation.PartitionKey;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcPartitionRegistry implements PartitionRegistry {
  private static final Logger log = LoggerFactory.getLogger(JdbcPartitionRegistry.class);

  private final JdbcTemplate jdbcTemplate;

  public JdbcPartitionRegistry(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public int discoverPartitions() {
    String sql =
        """
        INSERT INTO aggregation_partitions (
            exchange,
            instrument,
            enabled,
            consecutive_failures,
            updated_at
        )
        SELECT DISTINCT exchange, instrument, TRUE, 0, NOW()
        FROM raw_executions
        WHERE btrim(exchange) <> ''
          AND btrim(instrument) <> ''
        ON CONFLICT (exchange, instrument) DO NOTHING
        """;
    return jdbcTemplate.update(sql);
  }

  @Override
  public List<PartitionKey> findEnabledPartitions() {
    String sql =
        """
        SELECT exchange, instrument
        FROM aggregation_partitions
        WHERE enabled = TRUE
        ORDER BY exchange, instrument
        """;
    List<PartitionKey> partitions = new ArrayList<>();
    jdbcTemplate.query(
        sql,
        rs -> {
          String exchange = rs.getString("exchange");
          String instrument = rs.getString("instrument");
          try {
            partitions.add(new PartitionKey(exchange, instrument));
          } catch (AggregationDomainException ex) {
            log.warn(
                "Skipping partition registry row with invalid key exchange='{}' instrument='{}' error={}",
                exchange,
                instrument,
                ex.getMessage());
          }
        });
    return partitions;
  }
}

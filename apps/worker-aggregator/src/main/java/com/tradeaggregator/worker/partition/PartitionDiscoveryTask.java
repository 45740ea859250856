package com.tradeaggregator.worker.partition;

import com.tradeaggregator.worker.config.AggregatorProperties;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    prefix = "aggregator.discovery",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class PartitionDiscoveryTask {
  private static final Logger log = LoggerFactory.getLogger(PartitionDiscoveryTask.class);

  private final PartitionRegistry partitionRegistry;
  private final AggregatorProperties properties;
  private final MeterRegistry meterRegistry;

  public PartitionDiscoveryTask(
      PartitionRegistry partitionRegistry,
      AggregatorProperties properties,
      MeterRegistry meterRegistry) {
    this.partitionRegistry = partitionRegistry;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
  }

  @Scheduled(
      fixedDelayString = "${aggregator.discovery.fixed-delay-ms:60000}",
      initialDelayString = "0")
  public void runScheduled() {
    if (!properties.isEnabled()
        || properties.getRunMode() == AggregatorProperties.RunMode.DRAIN) {
      return;
    }
    runOnce();
  }

  public int runOnce() {
    try {
      int discovered = partitionRegistry.discoverPartitions();
      meterRegistry.counter("worker.aggregation.discovery.total", "outcome", "success").increment();
      if (discovered > 0) {
        log.info("Discovered new partitions count={}", discovered);
      }
      return discovered;
    } catch (DataAccessException ex) {
      meterRegistry.counter("worker.aggregation.discovery.total", "outcome", "failed").increment();
      log.warn("Partition discovery failed error={}", ex.getMessage(), ex);
      return 0;
    }
  }
}

package com.tradeaggregator.worker.scheduler;

import com.tradeaggregator.worker.config.AggregatorProperties;
import com.tradeaggregator.worker.partition.PartitionRegistry;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/** One-shot mode: aggregate everything available, then exit with 0, or 1 if any partition failed. */
@Component
@ConditionalOnProperty(prefix = "aggregator", name = "run-mode", havingValue = "drain")
public class AggregationDrainRunner implements ApplicationRunner {
  private static final Logger log = LoggerFactory.getLogger(AggregationDrainRunner.class);

  private final PartitionScheduler scheduler;
  private final PartitionRegistry partitionRegistry;
  private final AggregatorProperties properties;
  private final IntConsumer exitHandler;

  public AggregationDrainRunner(
      PartitionScheduler scheduler,
      PartitionRegistry partitionRegistry,
      AggregatorProperties properties,
      ConfigurableApplicationContext context) {
    this(
        scheduler,
        partitionRegistry,
        properties,
        code -> System.exit(SpringApplication.exit(context, () -> code)));
  }

  AggregationDrainRunner(
      PartitionScheduler scheduler,
      PartitionRegistry partitionRegistry,
      AggregatorProperties properties,
      IntConsumer exitHandler) {
    this.scheduler = scheduler;
    this.partitionRegistry = partitionRegistry;
    this.properties = properties;
    this.exitHandler = exitHandler;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (properties.getDiscovery().isEnabled()) {
      int discovered = partitionRegistry.discoverPartitions();
      log.info("Partition discovery before drain discovered={}", discovered);
    }
    DrainSummary summary = scheduler.drain();
    int exitCode = summary.isSuccessful() ? 0 : 1;
    if (exitCode != 0) {
      log.error(
          "Drain incomplete failed={} skipped={} halted={}",
          summary.failed(),
          summary.skipped(),
          summary.halted());
    }
    exitHandler.accept(exitCode);
  }
}

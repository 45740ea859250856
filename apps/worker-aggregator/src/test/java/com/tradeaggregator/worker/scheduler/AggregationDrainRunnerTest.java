package com.tradeaggregator.worker.scheduler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradeaggregator.domain.aggregation.PartitionKey;
import com.tradeaggregator.worker.config.AggregatorProperties;
import com.tradeaggregator.worker.partition.PartitionRegistry;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
class AggregationDrainRunnerTest {
  private static final PartitionKey BTC = PartitionKey.of("bitflyer", "BTC_JPY");
  private static final PartitionKey ETH = PartitionKey.of("bitflyer", "ETH_JPY");

  @Mock private PartitionScheduler scheduler;

  @Mock private PartitionRegistry partitionRegistry;

  private AggregatorProperties properties;
  private final List<Integer> exitCodes = new ArrayList<>();

  @BeforeEach
  void setUp() {
    properties = new AggregatorProperties();
    properties.setRunMode(AggregatorProperties.RunMode.DRAIN);
  }

  @Test
  void shouldDiscoverThenExitZeroWhenEveryPartitionDrained() {
    when(partitionRegistry.discoverPartitions()).thenReturn(2);
    when(scheduler.drain())
        .thenReturn(new DrainSummary(2, List.of(BTC, ETH), List.of(), List.of(), false));

    runner().run(new DefaultApplicationArguments());

    verify(partitionRegistry).discoverPartitions();
    assertEquals(List.of(0), exitCodes);
  }

  @Test
  void shouldExitOneWhenAnyPartitionFailed() {
    properties.getDiscovery().setEnabled(false);
    when(scheduler.drain())
        .thenReturn(new DrainSummary(2, List.of(BTC), List.of(ETH), List.of(), false));

    runner().run(new DefaultApplicationArguments());

    verify(partitionRegistry, never()).discoverPartitions();
    assertEquals(List.of(1), exitCodes);
  }

  @Test
  void shouldExitOneWhenPartitionSkippedOrSchedulerHalted() {
    properties.getDiscovery().setEnabled(false);
    when(scheduler.drain())
        .thenReturn(
            new DrainSummary(1, List.of(), List.of(), List.of(BTC), false),
            new DrainSummary(1, List.of(BTC), List.of(), List.of(), true));

    runner().run(new DefaultApplicationArguments());
    runner().run(new DefaultApplicationArguments());

    assertEquals(List.of(1, 1), exitCodes);
  }

  private AggregationDrainRunner runner() {
    return new AggregationDrainRunner(scheduler, partitionRegistry, properties, exitCodes::add);
  }
}

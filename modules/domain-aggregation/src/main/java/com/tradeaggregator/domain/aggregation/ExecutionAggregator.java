package com.tradeaggregator.domain.aggregation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reduces a sequence-ordered batch of raw executions into one row per (timestamp, side).
 *
 * <p>Open and close prices follow sequence order: the row with the smaller sequence is earlier.
 * Output rows are sorted by timestamp then side, so reducing the same batch twice yields equal
 * lists. The aggregator holds no state between calls and is safe to share between threads.
 */
public class ExecutionAggregator {
  private static final Comparator<AggregatedRow> OUTPUT_ORDER =
      Comparator.comparing(AggregatedRow::tradedAt).thenComparing(AggregatedRow::side);

  public AggregatedBatch reduce(PartitionKey partition, List<RawExecution> batch) {
    Objects.requireNonNull(partition, "partition must not be null");
    Objects.requireNonNull(batch, "batch must not be null");
    if (batch.isEmpty()) {
      return AggregatedBatch.empty(partition);
    }

    Map<GroupKey, ExecutionAccumulator> groups = new LinkedHashMap<>();
    RawExecution previous = null;
    for (RawExecution execution : batch) {
      validate(partition, execution, previous);
      GroupKey key = new GroupKey(execution.tradedAt(), execution.side());
      groups.computeIfAbsent(key, ignored -> new ExecutionAccumulator(execution)).add(execution);
      previous = execution;
    }

    List<AggregatedRow> rows = new ArrayList<>(groups.size());
    for (ExecutionAccumulator accumulator : groups.values()) {
      rows.add(accumulator.toRow(partition));
    }
    rows.sort(OUTPUT_ORDER);
    return new AggregatedBatch(
        partition,
        rows,
        batch.get(0).sequence(),
        batch.get(batch.size() - 1).sequence(),
        batch.size());
  }

  private static void validate(
      PartitionKey partition, RawExecution execution, RawExecution previous) {
    long sequence = execution.sequence();
    if (!partition.equals(execution.partition())) {
      throw new MalformedExecutionException(
          partition, sequence, "row belongs to partition " + execution.partition());
    }
    if (sequence <= 0) {
      throw new MalformedExecutionException(partition, sequence, "sequence must be > 0");
    }
    if (execution.tradedAt() == null) {
      throw new MalformedExecutionException(partition, sequence, "missing timestamp");
    }
    if (execution.price() == null) {
      throw new MalformedExecutionException(partition, sequence, "missing price");
    }
    if (execution.volume() == null) {
      throw new MalformedExecutionException(partition, sequence, "missing volume");
    }
    if (previous == null) {
      return;
    }
    if (sequence <= previous.sequence()) {
      throw new MalformedExecutionException(
          partition,
          sequence,
          "sequence not strictly increasing after " + previous.sequence());
    }
    if (execution.tradedAt().isBefore(previous.tradedAt())) {
      throw new MalformedExecutionException(
          partition,
          sequence,
          "timestamp "
              + execution.tradedAt()
              + " precedes "
              + previous.tradedAt()
              + " of sequence "
              + previous.sequence());
    }
  }

  private record GroupKey(Instant tradedAt, TradeSide side) {}
}

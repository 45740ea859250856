package com.tradeaggregator.domain.aggregation;

import java.util.EnumSet;
import java.util.Map;

public final class PartitionStateMachine {
  private static final Map<PartitionCycleState, EnumSet<PartitionCycleState>> ALLOWED_TRANSITIONS =
      Map.of(
          PartitionCycleState.IDLE,
              EnumSet.of(
                  PartitionCycleState.FETCHING,
                  PartitionCycleState.BACKOFF,
                  PartitionCycleState.SUSPENDED),
          PartitionCycleState.FETCHING,
              EnumSet.of(
                  PartitionCycleState.REDUCING,
                  PartitionCycleState.IDLE,
                  PartitionCycleState.BACKOFF,
                  PartitionCycleState.SUSPENDED),
          PartitionCycleState.REDUCING,
              EnumSet.of(
                  PartitionCycleState.COMMITTING,
                  PartitionCycleState.IDLE,
                  PartitionCycleState.BACKOFF,
                  PartitionCycleState.SUSPENDED),
          PartitionCycleState.COMMITTING,
              EnumSet.of(
                  PartitionCycleState.IDLE,
                  PartitionCycleState.BACKOFF,
                  PartitionCycleState.SUSPENDED),
          PartitionCycleState.BACKOFF,
              EnumSet.of(PartitionCycleState.IDLE, PartitionCycleState.SUSPENDED),
          PartitionCycleState.SUSPENDED, EnumSet.of(PartitionCycleState.IDLE));

  private PartitionStateMachine() {}

  public static boolean canTransition(PartitionCycleState from, PartitionCycleState to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<PartitionCycleState> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  public static void validateTransition(PartitionCycleState from, PartitionCycleState to) {
    if (!canTransition(from, to)) {
      throw new AggregationDomainException(
          "Invalid partition state transition from " + from + " to " + to);
    }
  }
}

package com.tradeaggregator.worker.scheduler;

import com.tradeaggregator.domain.aggregation.PartitionCycleState;
import com.tradeaggregator.domain.aggregation.PartitionKey;
import com.tradeaggregator.domain.aggregation.PartitionStateMachine;
import com.tradeaggregator.worker.cycle.PartitionStateListener;
import java.time.Instant;

/** In-memory scheduling state of one partition. Shared between the dispatcher and one worker. */
final class PartitionProgress implements PartitionStateListener {
  private final PartitionKey partition;
  private PartitionCycleState state = PartitionCycleState.IDLE;
  private int consecutiveFailures;
  private Instant nextAttemptAt;

  PartitionProgress(PartitionKey partition) {
    this.partition = partition;
  }

  @Override
  public synchronized void onTransition(PartitionKey partition, PartitionCycleState next) {
    moveTo(next);
  }

  /** True when a claim may start now. Moves an expired backoff back to idle. */
  synchronized boolean isDue(Instant now) {
    if (state == PartitionCycleState.BACKOFF
        && (nextAttemptAt == null || !now.isBefore(nextAttemptAt))) {
      moveTo(PartitionCycleState.IDLE);
      nextAttemptAt = null;
    }
    return state == PartitionCycleState.IDLE;
  }

  synchronized void recordSuccess() {
    moveTo(PartitionCycleState.IDLE);
    consecutiveFailures = 0;
    nextAttemptAt = null;
  }

  synchronized int recordFailure() {
    consecutiveFailures++;
    return consecutiveFailures;
  }

  synchronized void backOffUntil(Instant nextAttemptAt) {
    moveTo(PartitionCycleState.BACKOFF);
    this.nextAttemptAt = nextAttemptAt;
  }

  synchronized void suspend() {
    moveTo(PartitionCycleState.SUSPENDED);
    nextAttemptAt = null;
  }

  synchronized boolean resume() {
    if (state != PartitionCycleState.SUSPENDED && state != PartitionCycleState.BACKOFF) {
      return false;
    }
    moveTo(PartitionCycleState.IDLE);
    consecutiveFailures = 0;
    nextAttemptAt = null;
    return true;
  }

  synchronized boolean resumeIfSuspended() {
    return state == PartitionCycleState.SUSPENDED && resume();
  }

  synchronized PartitionCycleState state() {
    return state;
  }

  synchronized int consecutiveFailures() {
    return consecutiveFailures;
  }

  private void moveTo(PartitionCycleState next) {
    if (state == next) {
      return;
    }
    if (!PartitionStateMachine.canTransition(state, next)) {
      throw new IllegalStateException(
          "Invalid partition state transition partition="
              + partition
              + " from="
              + state
              + " to="
              + next);
    }
    state = next;
  }
}

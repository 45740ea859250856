package com.tradeaggregator.worker.scheduler;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JitteredExponentialBackoffTest {
  @Test
  void shouldDoubleDelayPerConsecutiveFailureUpToMax() {
    JitteredExponentialBackoff backoff = new JitteredExponentialBackoff(100L, 500L, false);

    assertEquals(Duration.ZERO, backoff.backoffForFailures(0));
    assertEquals(Duration.ofMillis(100L), backoff.backoffForFailures(1));
    assertEquals(Duration.ofMillis(200L), backoff.backoffForFailures(2));
    assertEquals(Duration.ofMillis(400L), backoff.backoffForFailures(3));
    assertEquals(Duration.ofMillis(500L), backoff.backoffForFailures(4));
    assertEquals(Duration.ofMillis(500L), backoff.backoffForFailures(10_000));
  }

  @Test
  void shouldKeepJitteredDelayBetweenHalfAndFullDelay() {
    JitteredExponentialBackoff low = new JitteredExponentialBackoff(200L, 5_000L, true, () -> 0.0d);
    JitteredExponentialBackoff high = new JitteredExponentialBackoff(200L, 5_000L, true, () -> 1.0d);

    assertEquals(Duration.ofMillis(200L), low.backoffForFailures(2));
    assertEquals(Duration.ofMillis(400L), high.backoffForFailures(2));
  }

  @Test
  void shouldComputeNextAttemptFromNow() {
    JitteredExponentialBackoff backoff = new JitteredExponentialBackoff(1_000L, 60_000L, false);
    Instant now = Instant.parse("2026-03-01T00:00:00Z");

    assertEquals(now.plusSeconds(4), backoff.nextAttemptAt(now, 3));
    assertEquals(Duration.ofMinutes(1), backoff.maxBackoff());
  }
}

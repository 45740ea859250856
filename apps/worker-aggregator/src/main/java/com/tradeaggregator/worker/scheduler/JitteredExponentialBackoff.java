package com.tradeaggregator.worker.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/** Per-partition retry delay, growing with the number of consecutive failed cycles. */
public class JitteredExponentialBackoff {
  private final long baseBackoffMs;
  private final long maxBackoffMs;
  private final boolean jitterEnabled;
  private final DoubleSupplier jitterSource;

  public JitteredExponentialBackoff(long baseBackoffMs, long maxBackoffMs, boolean jitterEnabled) {
    this(
        baseBackoffMs,
        maxBackoffMs,
        jitterEnabled,
        () -> ThreadLocalRandom.current().nextDouble());
  }

  public JitteredExponentialBackoff(
      long baseBackoffMs, long maxBackoffMs, boolean jitterEnabled, DoubleSupplier jitterSource) {
    this.baseBackoffMs = Math.max(0L, baseBackoffMs);
    this.maxBackoffMs = Math.max(this.baseBackoffMs, maxBackoffMs);
    this.jitterEnabled = jitterEnabled;
    this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource must not be null");
  }

  public Duration backoffForFailures(int consecutiveFailures) {
    long deterministic = deterministicBackoff(consecutiveFailures);
    if (!jitterEnabled || deterministic == 0L) {
      return Duration.ofMillis(deterministic);
    }
    // Jitter only shortens the delay, never below half of it.
    double factor = Math.max(0.0d, Math.min(1.0d, jitterSource.getAsDouble()));
    long half = deterministic / 2L;
    long jittered = half + (long) Math.floor(factor * (deterministic - half));
    return Duration.ofMillis(Math.max(0L, Math.min(maxBackoffMs, jittered)));
  }

  public Instant nextAttemptAt(Instant now, int consecutiveFailures) {
    return now.plus(backoffForFailures(consecutiveFailures));
  }

  public Duration maxBackoff() {
    return Duration.ofMillis(maxBackoffMs);
  }

  private long deterministicBackoff(int consecutiveFailures) {
    if (baseBackoffMs == 0L || consecutiveFailures <= 0) {
      return 0L;
    }
    int exponent = Math.min(62, consecutiveFailures - 1);
    double scaled = baseBackoffMs * Math.pow(2.0d, exponent);
    long bounded = (long) Math.floor(Math.min((double) maxBackoffMs, scaled));
    return Math.max(0L, bounded);
  }
}

package com.tradeaggregator.worker.scheduler;

import com.tradeaggregator.domain.aggregation.PartitionCycleState;
import com.tradeaggregator.domain.aggregation.PartitionKey;
import com.tradeaggregator.worker.commit.CommitConsistencyException;
import com.tradeaggregator.worker.config.AggregatorProperties;
import com.tradeaggregator.worker.config.PartitionFilter;
import com.tradeaggregator.worker.cycle.CycleFailureClassifier;
import com.tradeaggregator.worker.cycle.CycleFailureKind;
import com.tradeaggregator.worker.cycle.CycleOutcome;
import com.tradeaggregator.worker.cycle.CycleResult;
import com.tradeaggregator.worker.cycle.PartitionCycleException;
import com.tradeaggregator.worker.cycle.PartitionCycleRunner;
import com.tradeaggregator.worker.partition.PartitionLeaseRepository;
import com.tradeaggregator.worker.partition.PartitionRegistry;
import com.tradeaggregator.worker.partition.PartitionStatusRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Dispatches partition claims onto the bounded aggregation pool. A partition is processed by at
 * most one worker at a time: in-process through the in-flight set, across processes through the
 * lease table, which is renewed inside every cycle. Failures stay local to their partition except
 * {@link CycleFailureKind#FATAL}, which halts dispatching until {@link #resumeAll()}.
 */
@Component
@ConditionalOnProperty(
    prefix = "aggregator",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class PartitionScheduler {
  private static final Logger log = LoggerFactory.getLogger(PartitionScheduler.class);

  private final PartitionRegistry partitionRegistry;
  private final PartitionLeaseRepository leaseRepository;
  private final PartitionStatusRepository statusRepository;
  private final PartitionCycleRunner cycleRunner;
  private final TaskExecutor executor;
  private final JitteredExponentialBackoff backoff;
  private final PartitionFilter partitionFilter;
  private final AggregatorProperties properties;
  private final Clock clock;
  private final String ownerId;
  private final Semaphore permits;
  private final Set<PartitionKey> inFlight = ConcurrentHashMap.newKeySet();
  private final Map<PartitionKey, PartitionProgress> progressByPartition =
      new ConcurrentHashMap<>();
  private final AtomicBoolean stopping = new AtomicBoolean(false);
  private final AtomicBoolean halted = new AtomicBoolean(false);

  public PartitionScheduler(
      PartitionRegistry partitionRegistry,
      PartitionLeaseRepository leaseRepository,
      PartitionStatusRepository statusRepository,
      PartitionCycleRunner cycleRunner,
      @Qualifier("aggregationExecutor") TaskExecutor executor,
      JitteredExponentialBackoff backoff,
      PartitionFilter partitionFilter,
      AggregatorProperties properties,
      MeterRegistry meterRegistry) {
    this(
        partitionRegistry,
        leaseRepository,
        statusRepository,
        cycleRunner,
        executor,
        backoff,
        partitionFilter,
        properties,
        meterRegistry,
        Clock.systemUTC());
  }

  PartitionScheduler(
      PartitionRegistry partitionRegistry,
      PartitionLeaseRepository leaseRepository,
      PartitionStatusRepository statusRepository,
      PartitionCycleRunner cycleRunner,
      TaskExecutor executor,
      JitteredExponentialBackoff backoff,
      PartitionFilter partitionFilter,
      AggregatorProperties properties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.partitionRegistry = partitionRegistry;
    this.leaseRepository = leaseRepository;
    this.statusRepository = statusRepository;
    this.cycleRunner = cycleRunner;
    this.executor = executor;
    this.backoff = backoff;
    this.partitionFilter = partitionFilter;
    this.properties = properties;
    this.clock = clock;
    properties.validateLeaseTimings();
    this.ownerId = resolveOwnerId(properties.getOwnerId());
    this.permits = new Semaphore(properties.effectiveConcurrency());
    Gauge.builder("worker.aggregation.partitions.inflight", inFlight, Set::size)
        .description("Partitions currently claimed by this worker")
        .register(meterRegistry);
    Gauge.builder("worker.aggregation.scheduler.halted", halted, flag -> flag.get() ? 1.0d : 0.0d)
        .description("1 when dispatching is halted after a fatal failure")
        .register(meterRegistry);
  }

  @Scheduled(
      fixedDelayString = "${aggregator.fixed-delay-ms:1000}",
      initialDelayString = "${aggregator.fixed-delay-ms:1000}")
  public void runScheduled() {
    if (properties.getRunMode() == AggregatorProperties.RunMode.DRAIN) {
      return;
    }
    dispatch();
  }

  /** Submits one claim for every due partition while pool capacity lasts. */
  public int dispatch() {
    if (stopping.get() || halted.get()) {
      return 0;
    }
    List<PartitionKey> partitions;
    try {
      partitions = partitionRegistry.findEnabledPartitions();
    } catch (DataAccessException ex) {
      log.warn("Failed to load partitions for dispatch error={}", ex.getMessage(), ex);
      return 0;
    }
    Instant now = clock.instant();
    int submitted = 0;
    for (PartitionKey partition : partitions) {
      if (stopping.get() || halted.get()) {
        break;
      }
      if (!partitionFilter.isEnabled(partition)) {
        continue;
      }
      PartitionProgress progress = progressFor(partition);
      if (inFlight.contains(partition) || !progress.isDue(now)) {
        continue;
      }
      if (!permits.tryAcquire()) {
        break;
      }
      if (!inFlight.add(partition)) {
        permits.release();
        continue;
      }
      try {
        executor.execute(() -> runClaimAndRelease(partition, progress));
        submitted++;
      } catch (TaskRejectedException ex) {
        inFlight.remove(partition);
        permits.release();
        log.warn("Aggregation pool rejected partition claim partition={}", partition, ex);
        break;
      }
    }
    return submitted;
  }

  /**
   * Processes every enabled partition until it has no committable rows left. Failed partitions are
   * reported, not retried.
   */
  public DrainSummary drain() {
    List<PartitionKey> partitions =
        partitionRegistry.findEnabledPartitions().stream()
            .filter(partitionFilter::isEnabled)
            .toList();
    log.info("Draining partitions count={} owner={}", partitions.size(), ownerId);
    List<CompletableFuture<ClaimOutcome>> futures = new ArrayList<>(partitions.size());
    for (PartitionKey partition : partitions) {
      futures.add(CompletableFuture.supplyAsync(() -> drainPartition(partition), executor));
    }
    List<PartitionKey> drained = new ArrayList<>();
    List<PartitionKey> failed = new ArrayList<>();
    List<PartitionKey> skipped = new ArrayList<>();
    for (int i = 0; i < partitions.size(); i++) {
      ClaimOutcome outcome = futures.get(i).join();
      PartitionKey partition = partitions.get(i);
      switch (outcome) {
        case DRAINED -> drained.add(partition);
        case FAILED -> failed.add(partition);
        default -> skipped.add(partition);
      }
    }
    DrainSummary summary =
        new DrainSummary(partitions.size(), drained, failed, skipped, halted.get());
    log.info(
        "Drain finished partitions={} drained={} failed={} skipped={} halted={}",
        summary.partitions(),
        drained.size(),
        failed.size(),
        skipped.size(),
        summary.halted());
    return summary;
  }

  /** Clears a suspended or backing-off partition so the next dispatch picks it up. */
  public boolean resume(PartitionKey partition) {
    boolean resumed = progressFor(partition).resume();
    if (resumed) {
      log.info("Partition resumed partition={}", partition);
    }
    return resumed;
  }

  /** Lifts a fatal halt and clears every suspended partition. Returns the partitions cleared. */
  public int resumeAll() {
    if (halted.compareAndSet(true, false)) {
      log.info("Aggregation dispatching resumed after halt");
    }
    int resumed = 0;
    for (Map.Entry<PartitionKey, PartitionProgress> entry : progressByPartition.entrySet()) {
      if (entry.getValue().resumeIfSuspended()) {
        log.info("Partition resumed partition={}", entry.getKey());
        resumed++;
      }
    }
    return resumed;
  }

  public boolean isHalted() {
    return halted.get();
  }

  public Optional<PartitionCycleState> stateOf(PartitionKey partition) {
    PartitionProgress progress = progressByPartition.get(partition);
    return progress == null ? Optional.empty() : Optional.of(progress.state());
  }

  public int consecutiveFailures(PartitionKey partition) {
    PartitionProgress progress = progressByPartition.get(partition);
    return progress == null ? 0 : progress.consecutiveFailures();
  }

  public int inFlightCount() {
    return inFlight.size();
  }

  @PreDestroy
  public void stop() {
    if (stopping.compareAndSet(false, true)) {
      log.info("Aggregation scheduler stopping inFlight={}", inFlight.size());
    }
  }

  private ClaimOutcome drainPartition(PartitionKey partition) {
    if (!inFlight.add(partition)) {
      return ClaimOutcome.CANCELLED;
    }
    try {
      PartitionProgress progress = progressFor(partition);
      if (!progress.isDue(clock.instant())) {
        return ClaimOutcome.CANCELLED;
      }
      while (true) {
        ClaimOutcome outcome = runClaim(partition, progress);
        if (outcome != ClaimOutcome.MORE_WORK) {
          return outcome;
        }
      }
    } finally {
      inFlight.remove(partition);
    }
  }

  private void runClaimAndRelease(PartitionKey partition, PartitionProgress progress) {
    try {
      runClaim(partition, progress);
    } finally {
      inFlight.remove(partition);
      permits.release();
    }
  }

  ClaimOutcome runClaim(PartitionKey partition, PartitionProgress progress) {
    int maxCycles = properties.effectiveMaxCyclesPerClaim();
    boolean leased = false;
    try {
      for (int cycle = 0; cycle < maxCycles; cycle++) {
        if (stopping.get() || halted.get()) {
          return ClaimOutcome.CANCELLED;
        }
        boolean acquired =
            leaseRepository.tryAcquire(
                partition, ownerId, clock.instant(), properties.getLeaseTtl());
        if (!acquired) {
          log.debug("Partition lease held by another worker partition={}", partition);
          return leased ? ClaimOutcome.CANCELLED : ClaimOutcome.LEASE_UNAVAILABLE;
        }
        leased = true;
        CycleResult result =
            cycleRunner.runCycle(partition, stopping::get, progress, this::renewLease);
        if (result.outcome() == CycleOutcome.LEASE_LOST) {
          leased = false;
          progress.onTransition(partition, PartitionCycleState.IDLE);
          return ClaimOutcome.LEASE_UNAVAILABLE;
        }
        onSuccess(progress, result);
        if (!result.outcome().progressed()) {
          return result.outcome() == CycleOutcome.CANCELLED
              ? ClaimOutcome.CANCELLED
              : ClaimOutcome.DRAINED;
        }
      }
      return ClaimOutcome.MORE_WORK;
    } catch (PartitionCycleException ex) {
      onFailure(progress, ex);
      return ClaimOutcome.FAILED;
    } catch (RuntimeException ex) {
      onFailure(
          progress,
          new PartitionCycleException(
              partition, CycleFailureClassifier.classifyBeforeCommit(ex), 0L, 0L, ex));
      return ClaimOutcome.FAILED;
    } finally {
      if (leased) {
        releaseLease(partition);
      }
    }
  }

  private boolean renewLease(PartitionKey partition) {
    try {
      return leaseRepository.tryAcquire(
          partition, ownerId, clock.instant(), properties.getLeaseTtl());
    } catch (DataAccessException ex) {
      log.warn(
          "Failed to renew partition lease partition={} error={}", partition, ex.getMessage(), ex);
      return false;
    }
  }

  private void onSuccess(PartitionProgress progress, CycleResult result) {
    boolean recovered = progress.consecutiveFailures() > 0;
    progress.recordSuccess();
    if (!result.outcome().progressed() && !recovered) {
      return;
    }
    if (result.outcome().progressed()) {
      log.info(
          "Aggregation cycle finished partition={} outcome={} fromSequence={} toSequence={} rawRows={} aggregatedRows={}",
          result.partition(),
          result.outcome(),
          result.fromSequence(),
          result.toSequence(),
          result.rawRows(),
          result.aggregatedRows());
    }
    try {
      statusRepository.recordSuccess(result.partition(), result.watermark(), clock.instant());
    } catch (DataAccessException ex) {
      log.warn(
          "Failed to record partition success partition={} error={}",
          result.partition(),
          ex.getMessage(),
          ex);
    }
  }

  private void onFailure(PartitionProgress progress, PartitionCycleException failure) {
    Instant now = clock.instant();
    int failures = progress.recordFailure();
    CycleFailureKind kind = failure.kind();
    if (kind == CycleFailureKind.CONSISTENCY_CONFLICT || kind == CycleFailureKind.UNEXPECTED) {
      progress.suspend();
      log.error(
          "Partition suspended until resumed partition={} kind={} fromSequence={} toSequence={} observedWatermark={} error={}",
          failure.partition(),
          kind,
          failure.fromSequence(),
          failure.toSequence(),
          observedWatermark(failure),
          failure.errorMessage(),
          failure);
    } else {
      Instant nextAttemptAt = backoff.nextAttemptAt(now, failures);
      progress.backOffUntil(nextAttemptAt);
      if (kind == CycleFailureKind.FATAL) {
        halted.set(true);
        log.error(
            "Aggregation halted after fatal failure partition={} kind={} fromSequence={} toSequence={} error={}",
            failure.partition(),
            kind,
            failure.fromSequence(),
            failure.toSequence(),
            failure.errorMessage(),
            failure);
      } else {
        log.warn(
            "Aggregation cycle failed partition={} kind={} fromSequence={} toSequence={} consecutiveFailures={} nextAttemptAt={} error={}",
            failure.partition(),
            kind,
            failure.fromSequence(),
            failure.toSequence(),
            failures,
            nextAttemptAt,
            failure.errorMessage());
      }
    }
    try {
      statusRepository.recordFailure(failure, failures, now);
    } catch (DataAccessException ex) {
      log.warn(
          "Failed to record partition failure partition={} error={}",
          failure.partition(),
          ex.getMessage(),
          ex);
    }
  }

  private static Long observedWatermark(Throwable failure) {
    for (Throwable cause = failure; cause != null; cause = cause.getCause()) {
      if (cause instanceof CommitConsistencyException conflict) {
        return conflict.observedWatermark();
      }
    }
    return null;
  }

  private void releaseLease(PartitionKey partition) {
    try {
      leaseRepository.release(partition, ownerId);
    } catch (DataAccessException ex) {
      log.warn(
          "Failed to release partition lease, it expires on its own partition={} error={}",
          partition,
          ex.getMessage(),
          ex);
    }
  }

  private PartitionProgress progressFor(PartitionKey partition) {
    return progressByPartition.computeIfAbsent(partition, PartitionProgress::new);
  }

  private static String resolveOwnerId(String configured) {
    if (configured != null && !configured.isBlank()) {
      return configured.trim();
    }
    String host;
    try {
      host = InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      host = "unknown-host";
    }
    return host + "-" + UUID.randomUUID().toString().substring(0, 8);
  }
}

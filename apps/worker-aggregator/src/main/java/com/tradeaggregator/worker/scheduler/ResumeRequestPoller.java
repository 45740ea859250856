package com.tradeaggregator.worker.scheduler;

import com.tradeaggregator.worker.partition.ResumeRequest;
import com.tradeaggregator.worker.partition.ResumeRequestRepository;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Applies operator resume requests from {@code aggregation_resume_requests} to this worker's
 * scheduler. Every worker reads every request filed after it started, since suspension state is
 * held per process.
 */
@Component
@ConditionalOnProperty(
    prefix = "aggregator",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ResumeRequestPoller {
  private static final Logger log = LoggerFactory.getLogger(ResumeRequestPoller.class);
  private static final String RESUME_TOTAL_METRIC = "worker.aggregation.resume.requests.total";
  private static final int PAGE_SIZE = 100;

  private final ResumeRequestRepository requestRepository;
  private final PartitionScheduler scheduler;
  private final MeterRegistry meterRegistry;
  private final Instant startedAt;
  private long lastSeenId = -1L;

  @Autowired
  public ResumeRequestPoller(
      ResumeRequestRepository requestRepository,
      PartitionScheduler scheduler,
      MeterRegistry meterRegistry) {
    this(requestRepository, scheduler, meterRegistry, Clock.systemUTC());
  }

  ResumeRequestPoller(
      ResumeRequestRepository requestRepository,
      PartitionScheduler scheduler,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.requestRepository = requestRepository;
    this.scheduler = scheduler;
    this.meterRegistry = meterRegistry;
    this.startedAt = clock.instant();
  }

  @Scheduled(
      fixedDelayString = "${aggregator.resume-poll-delay-ms:5000}",
      initialDelayString = "${aggregator.resume-poll-delay-ms:5000}")
  public void runScheduled() {
    pollOnce();
  }

  /** Applies requests filed since the last poll. Returns how many were applied. */
  public synchronized int pollOnce() {
    try {
      if (lastSeenId < 0) {
        lastSeenId = requestRepository.latestRequestIdBefore(startedAt);
      }
      int applied = 0;
      List<ResumeRequest> requests;
      do {
        requests = requestRepository.findAfter(lastSeenId, PAGE_SIZE);
        for (ResumeRequest request : requests) {
          apply(request);
          lastSeenId = request.id();
          applied++;
        }
      } while (requests.size() == PAGE_SIZE);
      return applied;
    } catch (DataAccessException ex) {
      log.warn("Failed to poll partition resume requests error={}", ex.getMessage(), ex);
      return 0;
    }
  }

  private void apply(ResumeRequest request) {
    if (request.appliesToAll()) {
      boolean wasHalted = scheduler.isHalted();
      int resumed = scheduler.resumeAll();
      log.info(
          "Resume request applied requestId={} scope=all haltLifted={} resumedPartitions={} requestedBy={} reason={}",
          request.id(),
          wasHalted,
          resumed,
          request.requestedBy(),
          request.reason());
      increment("all", wasHalted || resumed > 0 ? "resumed" : "noop");
      return;
    }
    boolean resumed = scheduler.resume(request.partition());
    log.info(
        "Resume request applied requestId={} partition={} resumed={} requestedBy={} reason={}",
        request.id(),
        request.partition(),
        resumed,
        request.requestedBy(),
        request.reason());
    increment("partition", resumed ? "resumed" : "noop");
  }

  private void increment(String scope, String result) {
    meterRegistry.counter(RESUME_TOTAL_METRIC, "scope", scope, "result", result).increment();
  }
}

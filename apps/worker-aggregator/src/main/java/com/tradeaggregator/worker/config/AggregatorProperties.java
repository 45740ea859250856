package com.tradeaggregator.worker.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "aggregator")
public class AggregatorProperties {
  private boolean enabled = true;
  private RunMode runMode = RunMode.CONTINUOUS;
  private int batchSize = 10_000;
  private int concurrency = 4;
  private long fixedDelayMs = 1_000L;
  private long resumePollDelayMs = 5_000L;
  private int maxCyclesPerClaim = 10;
  private Duration settleDelay = Duration.ofSeconds(5);
  private Duration fetchTimeout = Duration.ofSeconds(30);
  private Duration commitTimeout = Duration.ofSeconds(60);
  private Duration leaseTtl = Duration.ofMinutes(3);
  private Duration shutdownAwait = Duration.ofSeconds(90);
  private String ownerId = "";
  private Backoff backoff = new Backoff();
  private Staging staging = new Staging();
  private Partitions partitions = new Partitions();
  private Discovery discovery = new Discovery();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public RunMode getRunMode() {
    return runMode;
  }

  public void setRunMode(RunMode runMode) {
    this.runMode = runMode;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public int getConcurrency() {
    return concurrency;
  }

  public void setConcurrency(int concurrency) {
    this.concurrency = concurrency;
  }

  public long getFixedDelayMs() {
    return fixedDelayMs;
  }

  public void setFixedDelayMs(long fixedDelayMs) {
    this.fixedDelayMs = fixedDelayMs;
  }

  public long getResumePollDelayMs() {
    return resumePollDelayMs;
  }

  public void setResumePollDelayMs(long resumePollDelayMs) {
    this.resumePollDelayMs = resumePollDelayMs;
  }

  public int getMaxCyclesPerClaim() {
    return maxCyclesPerClaim;
  }

  public void setMaxCyclesPerClaim(int maxCyclesPerClaim) {
    this.maxCyclesPerClaim = maxCyclesPerClaim;
  }

  public Duration getSettleDelay() {
    return settleDelay;
  }

  public void setSettleDelay(Duration settleDelay) {
    this.settleDelay = settleDelay;
  }

  public Duration getFetchTimeout() {
    return fetchTimeout;
  }

  public void setFetchTimeout(Duration fetchTimeout) {
    this.fetchTimeout = fetchTimeout;
  }

  public Duration getCommitTimeout() {
    return commitTimeout;
  }

  public void setCommitTimeout(Duration commitTimeout) {
    this.commitTimeout = commitTimeout;
  }

  public Duration getLeaseTtl() {
    return leaseTtl;
  }

  public void setLeaseTtl(Duration leaseTtl) {
    this.leaseTtl = leaseTtl;
  }

  public Duration getShutdownAwait() {
    return shutdownAwait;
  }

  public void setShutdownAwait(Duration shutdownAwait) {
    this.shutdownAwait = shutdownAwait;
  }

  public String getOwnerId() {
    return ownerId;
  }

  public void setOwnerId(String ownerId) {
    this.ownerId = ownerId;
  }

  public Backoff getBackoff() {
    return backoff;
  }

  public void setBackoff(Backoff backoff) {
    this.backoff = backoff;
  }

  public Staging getStaging() {
    return staging;
  }

  public void setStaging(Staging staging) {
    this.staging = staging;
  }

  public Partitions getPartitions() {
    return partitions;
  }

  public void setPartitions(Partitions partitions) {
    this.partitions = partitions;
  }

  public Discovery getDiscovery() {
    return discovery;
  }

  public void setDiscovery(Discovery discovery) {
    this.discovery = discovery;
  }

  public int effectiveBatchSize() {
    return Math.max(1, batchSize);
  }

  public int effectiveConcurrency() {
    return Math.max(1, concurrency);
  }

  public int effectiveMaxCyclesPerClaim() {
    return Math.max(1, maxCyclesPerClaim);
  }

  /**
   * A lease is renewed after the fetch and before the commit, so it must outlive one fetch plus one
   * commit.
   */
  public void validateLeaseTimings() {
    if (leaseTtl == null || fetchTimeout == null || commitTimeout == null) {
      throw new IllegalStateException(
          "aggregator.lease-ttl, aggregator.fetch-timeout and aggregator.commit-timeout are required");
    }
    Duration required = fetchTimeout.plus(commitTimeout);
    if (leaseTtl.compareTo(required) <= 0) {
      throw new IllegalStateException(
          "aggregator.lease-ttl="
              + leaseTtl
              + " must exceed aggregator.fetch-timeout + aggregator.commit-timeout="
              + required);
    }
  }

  public enum RunMode {
    CONTINUOUS,
    DRAIN
  }

  public static class Backoff {
    private long baseMs = 1_000L;
    private long maxMs = 60_000L;
    private boolean jitterEnabled = true;

    public long getBaseMs() {
      return baseMs;
    }

    public void setBaseMs(long baseMs) {
      this.baseMs = baseMs;
    }

    public long getMaxMs() {
      return maxMs;
    }

    public void setMaxMs(long maxMs) {
      this.maxMs = maxMs;
    }

    public boolean isJitterEnabled() {
      return jitterEnabled;
    }

    public void setJitterEnabled(boolean jitterEnabled) {
      this.jitterEnabled = jitterEnabled;
    }
  }

  public static class Staging {
    private StagingMode mode = StagingMode.MEMORY;
    private Path directory = Path.of(System.getProperty("java.io.tmpdir"));

    public StagingMode getMode() {
      return mode;
    }

    public void setMode(StagingMode mode) {
      this.mode = mode;
    }

    public Path getDirectory() {
      return directory;
    }

    public void setDirectory(Path directory) {
      this.directory = directory;
    }
  }

  public enum StagingMode {
    MEMORY,
    FILE
  }

  public static class Partitions {
    private List<String> enabled = new ArrayList<>();
    private List<String> disabled = new ArrayList<>();

    public List<String> getEnabled() {
      return enabled;
    }

    public void setEnabled(List<String> enabled) {
      this.enabled = enabled;
    }

    public List<String> getDisabled() {
      return disabled;
    }

    public void setDisabled(List<String> disabled) {
      this.disabled = disabled;
    }
  }

  public static class Discovery {
    private boolean enabled = true;
    private long fixedDelayMs = 60_000L;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public long getFixedDelayMs() {
      return fixedDelayMs;
    }

    public void setFixedDelayMs(long fixedDelayMs) {
      this.fixedDelayMs = fixedDelayMs;
    }
  }
}

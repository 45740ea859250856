package com.tradeaggregator.worker.config;

import com.tradeaggregator.domain.aggregation.AggregatedRowCsvEncoder;
import com.tradeaggregator.domain.aggregation.ExecutionAggregator;
import com.tradeaggregator.worker.commit.BulkLoader;
import com.tradeaggregator.worker.commit.BulkPayloadStager;
import com.tradeaggregator.worker.commit.CommitCoordinator;
import com.tradeaggregator.worker.commit.PostgresCopyBulkLoader;
import com.tradeaggregator.worker.cycle.PartitionCycleRunner;
import com.tradeaggregator.worker.scheduler.JitteredExponentialBackoff;
import com.tradeaggregator.worker.source.RawExecutionReader;
import com.tradeaggregator.worker.watermark.WatermarkStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import javax.sql.DataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration
public class AggregatorConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock aggregatorClock() {
    return Clock.systemUTC();
  }

  // Declaring any JdbcTemplate disables the auto-configured one, so the default is declared too.
  @Bean
  @Primary
  public JdbcTemplate jdbcTemplate(DataSource dataSource) {
    return new JdbcTemplate(dataSource);
  }

  @Bean
  public JdbcTemplate sourceJdbcTemplate(DataSource dataSource, AggregatorProperties properties) {
    JdbcTemplate template = new JdbcTemplate(dataSource);
    template.setQueryTimeout(seconds(properties.getFetchTimeout()));
    template.setFetchSize(Math.min(properties.effectiveBatchSize(), 5_000));
    return template;
  }

  @Bean
  public TransactionTemplate commitTransactionTemplate(
      PlatformTransactionManager transactionManager, AggregatorProperties properties) {
    TransactionTemplate template = new TransactionTemplate(transactionManager);
    template.setTimeout(seconds(properties.getCommitTimeout()));
    template.setName("aggregation-commit");
    return template;
  }

  @Bean(name = "aggregationExecutor")
  public ThreadPoolTaskExecutor aggregationExecutor(AggregatorProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.effectiveConcurrency());
    executor.setMaxPoolSize(properties.effectiveConcurrency());
    executor.setThreadNamePrefix("aggregation-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationMillis(properties.getShutdownAwait().toMillis());
    return executor;
  }

  @Bean
  public ExecutionAggregator executionAggregator() {
    return new ExecutionAggregator();
  }

  @Bean
  public AggregatedRowCsvEncoder aggregatedRowCsvEncoder() {
    return new AggregatedRowCsvEncoder();
  }

  @Bean
  public BulkPayloadStager bulkPayloadStager(
      AggregatorProperties properties, Clock aggregatorClock) {
    AggregatorProperties.Staging staging = properties.getStaging();
    return new BulkPayloadStager(staging.getMode(), staging.getDirectory(), aggregatorClock);
  }

  @Bean
  public BulkLoader bulkLoader(DataSource dataSource, AggregatorProperties properties) {
    return new PostgresCopyBulkLoader(dataSource, properties.getCommitTimeout());
  }

  @Bean
  public CommitCoordinator commitCoordinator(
      TransactionTemplate commitTransactionTemplate,
      BulkLoader bulkLoader,
      WatermarkStore watermarkStore,
      BulkPayloadStager bulkPayloadStager) {
    return new CommitCoordinator(
        commitTransactionTemplate, bulkLoader, watermarkStore, bulkPayloadStager);
  }

  @Bean
  public PartitionCycleRunner partitionCycleRunner(
      WatermarkStore watermarkStore,
      RawExecutionReader rawExecutionReader,
      ExecutionAggregator executionAggregator,
      AggregatedRowCsvEncoder aggregatedRowCsvEncoder,
      CommitCoordinator commitCoordinator,
      AggregatorProperties properties,
      MeterRegistry meterRegistry,
      Clock aggregatorClock) {
    return new PartitionCycleRunner(
        watermarkStore,
        rawExecutionReader,
        executionAggregator,
        aggregatedRowCsvEncoder,
        commitCoordinator,
        properties.effectiveBatchSize(),
        properties.getSettleDelay(),
        meterRegistry,
        aggregatorClock);
  }

  @Bean
  public JitteredExponentialBackoff partitionBackoff(AggregatorProperties properties) {
    AggregatorProperties.Backoff backoff = properties.getBackoff();
    return new JitteredExponentialBackoff(
        backoff.getBaseMs(), backoff.getMaxMs(), backoff.isJitterEnabled());
  }

  @Bean
  public PartitionFilter partitionFilter(AggregatorProperties properties) {
    return PartitionFilter.from(properties.getPartitions());
  }

  private static int seconds(Duration duration) {
    if (duration == null || duration.isZero() || duration.isNegative()) {
      return -1;
    }
    return (int) Math.max(1L, (duration.toMillis() + 999L) / 1000L);
  }
}

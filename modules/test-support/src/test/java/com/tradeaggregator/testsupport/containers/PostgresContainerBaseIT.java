package com.tradeaggregator.testsupport.containers;

import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/** Base for Spring Boot tests that need the real schema; Flyway migrates it on context start. */
@Testcontainers(disabledWithoutDocker = true)
public abstract class PostgresContainerBaseIT {
  @Container @ServiceConnection
  protected static final PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>(PostgresTestDatabase.IMAGE)
          .withDatabaseName("trade_aggregator")
          .withUsername("aggregator")
          .withPassword("aggregator_pass");
}

package com.tradeaggregator.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class WorkerAggregatorApplication {
  public static void main(String[] args) {
    SpringApplication.run(WorkerAggregatorApplication.class, args);
  }
}

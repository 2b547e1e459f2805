package com.cario.contract.app.config;

import com.cario.contract.app.scheduler.ContractProcessingDispatcher;
import com.cario.contract.app.service.ContractProcessingOrchestrator;
import java.time.Clock;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Log4j2
@Configuration
public class SchedulerConfig {

  @Value("${scheduled.threadpool.size:4}")
  private int poolSize;

  @Value("${scheduled.threadpool.await-termination-seconds:30}")
  private int awaitTerminationSeconds;

  /** Worker pool for processing attempts and re-attempts. */
  @Bean
  public ThreadPoolTaskScheduler taskScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(poolSize);
    scheduler.setThreadNamePrefix("contract-worker-");

    // Log any uncaught exception thrown by a scheduled attempt
    scheduler.setErrorHandler(t -> log.error("Uncaught exception in contract worker", t));

    // Be nice on shutdown
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(awaitTerminationSeconds);

    RejectedExecutionHandler reh = new ThreadPoolExecutor.CallerRunsPolicy();
    scheduler.setRejectedExecutionHandler(reh);

    scheduler.initialize();
    log.info(
        "ThreadPoolTaskScheduler initialized poolSize={} awaitTerminationSeconds={}",
        poolSize,
        awaitTerminationSeconds);
    return scheduler;
  }

  /**
   * Single thread that fires hard-limit watchdogs. Kept apart from {@link #taskScheduler()} so
   * watchdogs still run while every worker is blocked.
   */
  @Bean
  public ThreadPoolTaskScheduler watchdogScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("contract-watchdog-");
    scheduler.setErrorHandler(t -> log.error("Uncaught exception in contract watchdog", t));
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.initialize();
    log.info("Watchdog ThreadPoolTaskScheduler initialized");
    return scheduler;
  }

  @Bean
  public ContractProcessingDispatcher contractProcessingDispatcher(
      @Qualifier("taskScheduler") ThreadPoolTaskScheduler taskScheduler,
      @Qualifier("watchdogScheduler") ThreadPoolTaskScheduler watchdogScheduler,
      ContractProcessingOrchestrator orchestrator,
      ContractProcessingProperties properties,
      Clock clock) {
    return new ContractProcessingDispatcher(
        taskScheduler, watchdogScheduler, orchestrator, properties, clock);
  }
}

package com.cario.contract.app.scheduler;

import com.cario.contract.app.config.ContractProcessingProperties;
import com.cario.contract.app.model.DocumentRef;
import com.cario.contract.app.model.ProcessingJob;
import com.cario.contract.app.model.ProcessingOutcome;
import com.cario.contract.app.service.ContractProcessingOrchestrator;
import com.cario.contract.app.service.ProcessingDeadline;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.log4j.Log4j2;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.scheduling.TaskScheduler;

/**
 * Runs processing attempts on the worker pool and schedules re-attempts.
 *
 * <ul>
 *   <li>One run per contract id at a time: an id already in flight (including a pending
 *       re-attempt) is rejected
 *   <li>Each attempt gets a soft deadline that the orchestrator checks between stages
 *   <li>A watchdog interrupts the worker thread once the hard limit passes; no terminal write is
 *       guaranteed after that. Watchdogs run on their own scheduler so a saturated worker pool
 *       cannot delay them
 *   <li>The contract id is put in the log4j {@link ThreadContext} while an attempt runs
 * </ul>
 */
@Log4j2
public class ContractProcessingDispatcher {

  public static final String CONTEXT_CONTRACT_ID = "contractId";

  private final TaskScheduler scheduler;
  private final TaskScheduler watchdogScheduler;
  private final ContractProcessingOrchestrator orchestrator;
  private final ContractProcessingProperties properties;
  private final Clock clock;

  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

  public ContractProcessingDispatcher(
      TaskScheduler scheduler,
      TaskScheduler watchdogScheduler,
      ContractProcessingOrchestrator orchestrator,
      ContractProcessingProperties properties,
      Clock clock) {
    this.scheduler = Objects.requireNonNull(scheduler);
    this.watchdogScheduler = Objects.requireNonNull(watchdogScheduler);
    this.orchestrator = Objects.requireNonNull(orchestrator);
    this.properties = Objects.requireNonNull(properties);
    this.clock = Objects.requireNonNull(clock);
  }

  /**
   * Schedules attempt 0 for a contract. Returns immediately.
   *
   * @return {@code false} if the id already has a run in flight
   */
  public boolean enqueue(String contractId, DocumentRef document) {
    Objects.requireNonNull(contractId, "contractId");
    Objects.requireNonNull(document, "document");
    if (!inFlight.add(contractId)) {
      log.warn("dispatcher.rejected contractId={} reason=inFlight", contractId);
      return false;
    }
    ProcessingJob job = ProcessingJob.builder().contractId(contractId).document(document).build();
    try {
      schedule(job, 0, clock.instant());
    } catch (RuntimeException e) {
      inFlight.remove(contractId);
      throw e;
    }
    log.info("dispatcher.enqueued contractId={} uri={}", contractId, document.toS3Uri());
    return true;
  }

  public boolean isInFlight(String contractId) {
    return inFlight.contains(contractId);
  }

  // -------- internals --------

  private void schedule(ProcessingJob job, int attempt, Instant at) {
    scheduler.schedule(() -> runAttempt(job, attempt), at);
  }

  void runAttempt(ProcessingJob job, int attempt) {
    String id = job.getContractId();
    ThreadContext.put(CONTEXT_CONTRACT_ID, id);

    AtomicReference<Thread> worker = new AtomicReference<>(Thread.currentThread());
    ScheduledFuture<?> watchdog =
        watchdogScheduler.schedule(
            () -> onHardLimit(id, attempt, worker),
            clock.instant().plus(properties.getHardTimeLimit()));

    ProcessingOutcome outcome = null;
    try {
      outcome =
          orchestrator.process(
              job, attempt, ProcessingDeadline.after(clock, properties.getSoftTimeLimit()));
    } catch (RuntimeException e) {
      log.error("dispatcher.attempt error contractId={} attempt={}", id, attempt, e);
    } catch (Error e) {
      log.error("dispatcher.attempt fatal contractId={} attempt={}", id, attempt, e);
      release(id, "fatal");
      throw e;
    } finally {
      worker.set(null);
      if (watchdog != null) watchdog.cancel(false);
      // drop a late watchdog interrupt so the pool thread is reused clean
      Thread.interrupted();
      ThreadContext.remove(CONTEXT_CONTRACT_ID);
    }
    handle(job, attempt, outcome);
  }

  private void handle(ProcessingJob job, int attempt, ProcessingOutcome outcome) {
    String id = job.getContractId();
    if (outcome == null) {
      release(id, "error");
      return;
    }
    switch (outcome.getKind()) {
      case SUCCESS -> release(id, "completed");
      case TERMINAL_FAILURE -> release(id, "failed");
      case RETRYABLE_FAILURE -> {
        Instant at = clock.instant().plus(outcome.getRetryAfter());
        log.info(
            "dispatcher.retry contractId={} nextAttempt={} at={} remaining={}",
            id,
            attempt + 1,
            at,
            outcome.getAttemptsRemaining());
        try {
          schedule(job, attempt + 1, at);
        } catch (RuntimeException e) {
          log.error("dispatcher.retry.schedule error contractId={}", id, e);
          release(id, "scheduleError");
        }
      }
    }
  }

  private void onHardLimit(String id, int attempt, AtomicReference<Thread> worker) {
    Thread t = worker.get();
    if (t == null) return;
    log.error(
        "dispatcher.hardLimit contractId={} attempt={} limit={} interrupting={}",
        id,
        attempt,
        properties.getHardTimeLimit(),
        t.getName());
    t.interrupt();
  }

  private void release(String id, String reason) {
    inFlight.remove(id);
    log.info("dispatcher.released contractId={} reason={}", id, reason);
  }
}

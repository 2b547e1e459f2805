package com.cario.contract.app.service;

import com.cario.contract.app.config.ContractProcessingProperties;
import com.cario.contract.app.error.ContractIntelligenceException;
import com.cario.contract.app.error.ErrorCategory;
import com.cario.contract.app.error.InternalProcessingException;
import com.cario.contract.app.model.CompletenessScore;
import com.cario.contract.app.model.ContractDraft;
import com.cario.contract.app.model.ContractRecordUpdate;
import com.cario.contract.app.model.ProcessingJob;
import com.cario.contract.app.model.ProcessingOutcome;
import com.cario.contract.app.model.ProcessingStatus;
import com.cario.contract.app.repository.ContractRecordGateway;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;

/**
 * Runs one processing attempt for a contract: extraction, scoring and the progress checkpoints in
 * between.
 *
 * <p>Checkpoints, each written on its own:
 *
 * <ul>
 *   <li>{@code 10} – attempt accepted, status PROCESSING, previous failure cleared
 *   <li>{@code 20} – extraction begins
 *   <li>{@code 60} – extraction returned a draft
 *   <li>{@code 70} – scoring begins
 *   <li>{@code 90} – scoring complete
 *   <li>{@code 100} – results stored, status COMPLETED
 * </ul>
 *
 * <p>Every failure is caught here, written to the record as FAILED with progress 0, and turned
 * into a {@link ProcessingOutcome}. Scheduling a re-attempt is the caller's job.
 */
@Log4j2
public class ContractProcessingOrchestrator {

  public static final int PROGRESS_ACCEPTED = 10;
  public static final int PROGRESS_EXTRACTING = 20;
  public static final int PROGRESS_EXTRACTED = 60;
  public static final int PROGRESS_SCORING = 70;
  public static final int PROGRESS_SCORED = 90;
  public static final int PROGRESS_COMPLETED = 100;

  private final ContractRecordGateway gateway;
  private final ContractExtractor extractor;
  private final ScoringService scoringService;
  private final ContractProcessingProperties properties;
  private final Clock clock;

  public ContractProcessingOrchestrator(
      ContractRecordGateway gateway,
      ContractExtractor extractor,
      ScoringService scoringService,
      ContractProcessingProperties properties,
      Clock clock) {
    this.gateway = Objects.requireNonNull(gateway);
    this.extractor = Objects.requireNonNull(extractor);
    this.scoringService = Objects.requireNonNull(scoringService);
    this.properties = Objects.requireNonNull(properties);
    this.clock = Objects.requireNonNull(clock);
  }

  /**
   * Runs a full attempt. Never throws for pipeline failures.
   *
   * @param job contract id and document location
   * @param attempt 0-based attempt number
   * @param deadline soft time limit, checked before each checkpoint after the first and handed to
   *     the extractor
   * @return success with the score, or a retryable / terminal failure
   */
  public ProcessingOutcome process(ProcessingJob job, int attempt, ProcessingDeadline deadline) {
    String id = job.getContractId();
    Instant startedAt = clock.instant();
    String stage = "accept";
    log.info("orchestrator.start contractId={} attempt={}", id, attempt);

    try {
      checkpoint(
          id,
          ContractRecordUpdate.builder()
              .status(ProcessingStatus.PROCESSING)
              .progress(PROGRESS_ACCEPTED)
              .attempt(attempt)
              .processingStartedAt(startedAt)
              .clearFailure(true)
              .build());

      stage = "extraction";
      deadline.check(stage);
      checkpoint(id, ContractRecordUpdate.progress(PROGRESS_EXTRACTING));
      ContractDraft draft = extractor.extract(job.getDocument(), deadline);
      deadline.check(stage);
      checkpoint(id, ContractRecordUpdate.progress(PROGRESS_EXTRACTED));

      stage = "scoring";
      deadline.check(stage);
      checkpoint(id, ContractRecordUpdate.progress(PROGRESS_SCORING));
      CompletenessScore score = scoringService.score(draft);
      deadline.check(stage);
      checkpoint(id, ContractRecordUpdate.progress(PROGRESS_SCORED));

      stage = "complete";
      deadline.check(stage);
      Instant endedAt = clock.instant();
      checkpoint(
          id,
          ContractRecordUpdate.builder()
              .status(ProcessingStatus.COMPLETED)
              .progress(PROGRESS_COMPLETED)
              .completenessScore(score.getTotal())
              .scoreBreakdown(score.getBreakdown())
              .missingFields(score.getMissingFields())
              .draft(draft)
              .processingEndedAt(endedAt)
              .processingTimeSeconds(seconds(startedAt, endedAt))
              .build());

      log.info(
          "orchestrator.success contractId={} attempt={} score={} missing={}",
          id,
          attempt,
          score.getTotal(),
          score.getMissingFields().size());
      return ProcessingOutcome.success(score);

    } catch (ContractIntelligenceException e) {
      return fail(id, attempt, stage, startedAt, e);
    } catch (RuntimeException e) {
      return fail(
          id,
          attempt,
          stage,
          startedAt,
          new InternalProcessingException("Unexpected error during " + stage, e));
    }
  }

  // -------- failure path --------

  private ProcessingOutcome fail(
      String id, int attempt, String stage, Instant startedAt, ContractIntelligenceException e) {
    log.error(
        "orchestrator.error contractId={} attempt={} stage={} code={} msg={}",
        id,
        attempt,
        stage,
        e.getErrorCode(),
        e.getMessage(),
        e);

    Instant endedAt = clock.instant();
    try {
      gateway.upsert(
          id,
          ContractRecordUpdate.builder()
              .status(ProcessingStatus.FAILED)
              .progress(0)
              .errorMessage(errorMessage(e))
              .processingEndedAt(endedAt)
              .processingTimeSeconds(seconds(startedAt, endedAt))
              .build());
    } catch (RuntimeException writeError) {
      // the retry decision below does not depend on this write
      log.error(
          "orchestrator.failureWrite error contractId={} msg={}",
          id,
          writeError.getMessage(),
          writeError);
    }

    int maxRetries = properties.getMaxRetries();
    if (attempt < maxRetries && isRetryEligible(e)) {
      Duration backoff = properties.getRetryBackoff();
      log.warn(
          "orchestrator.retryable contractId={} attempt={} remaining={} backoff={}",
          id,
          attempt,
          maxRetries - attempt,
          backoff);
      return ProcessingOutcome.retryable(e, maxRetries - attempt, backoff);
    }
    log.warn(
        "orchestrator.terminal contractId={} attempt={} category={}", id, attempt, e.getCategory());
    return ProcessingOutcome.terminal(e);
  }

  boolean isRetryEligible(ContractIntelligenceException e) {
    if (properties.getRetry().isFailFastOnPermanent()) {
      return e.getCategory() != ErrorCategory.PERMANENT;
    }
    return true;
  }

  private void checkpoint(String id, ContractRecordUpdate update) {
    gateway.upsert(id, update);
    log.debug(
        "orchestrator.checkpoint contractId={} progress={} status={}",
        id,
        update.getProgress(),
        update.getStatus());
  }

  private static String errorMessage(ContractIntelligenceException e) {
    String msg = e.getMessage();
    return (msg == null || msg.isBlank()) ? e.getErrorCode().getDefaultMessage() : msg;
  }

  private static double seconds(Instant start, Instant end) {
    return Duration.between(start, end).toMillis() / 1000.0;
  }
}

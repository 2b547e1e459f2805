package com.cario.contract.app.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.cario.contract.app.config.ContractProcessingProperties;
import com.cario.contract.app.error.ErrorCode;
import com.cario.contract.app.error.ExtractionException;
import com.cario.contract.app.error.PersistenceException;
import com.cario.contract.app.model.ContractDraft;
import com.cario.contract.app.model.ContractRecordUpdate;
import com.cario.contract.app.model.DocumentRef;
import com.cario.contract.app.model.FinancialDetails;
import com.cario.contract.app.model.PartyInfo;
import com.cario.contract.app.model.ProcessingJob;
import com.cario.contract.app.model.ProcessingOutcome;
import com.cario.contract.app.model.ProcessingStatus;
import com.cario.contract.app.repository.ContractRecordGateway;
import com.cario.contract.app.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class ContractProcessingOrchestratorTest {

  private static final String ID = "c-123";
  private static final DocumentRef DOC =
      DocumentRef.builder()
          .bucket("docs")
          .key("contracts/c-123.pdf")
          .contentType("application/pdf")
          .filename("msa.pdf")
          .build();

  private ContractRecordGateway gateway;
  private ContractExtractor extractor;
  private ContractProcessingProperties properties;
  private MutableClock clock;
  private ContractProcessingOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    gateway = mock(ContractRecordGateway.class);
    extractor = mock(ContractExtractor.class);
    properties = new ContractProcessingProperties();
    clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
    orchestrator =
        new ContractProcessingOrchestrator(
            gateway, extractor, new ScoringService(), properties, clock);
  }

  private ProcessingJob job() {
    return ProcessingJob.builder().contractId(ID).document(DOC).build();
  }

  private List<ContractRecordUpdate> capturedUpdates(int expected) {
    ArgumentCaptor<ContractRecordUpdate> captor =
        ArgumentCaptor.forClass(ContractRecordUpdate.class);
    verify(gateway, times(expected)).upsert(eq(ID), captor.capture());
    return captor.getAllValues();
  }

  @Test
  void successWritesCheckpointsInOrder() {
    ContractDraft draft =
        ContractDraft.builder()
            .customer(PartyInfo.builder().name("Acme").build())
            .financialDetails(FinancialDetails.builder().totalValue(1000.0).build())
            .build();
    when(extractor.extract(eq(DOC), any())).thenReturn(draft);

    ProcessingOutcome outcome = orchestrator.process(job(), 0, ProcessingDeadline.none(clock));

    assertTrue(outcome.isSuccess());
    assertEquals(14.0, outcome.getScore().getTotal());

    List<ContractRecordUpdate> updates = capturedUpdates(6);
    assertThat(updates)
        .extracting(ContractRecordUpdate::getProgress)
        .containsExactly(10, 20, 60, 70, 90, 100);

    ContractRecordUpdate accepted = updates.get(0);
    assertEquals(ProcessingStatus.PROCESSING, accepted.getStatus());
    assertThat(accepted.getAttempt()).isEqualTo(0);
    assertTrue(accepted.isClearFailure());
    assertEquals(clock.instant(), accepted.getProcessingStartedAt());

    ContractRecordUpdate done = updates.get(5);
    assertEquals(ProcessingStatus.COMPLETED, done.getStatus());
    assertThat(done.getCompletenessScore()).isEqualTo(14.0);
    assertSame(draft, done.getDraft());
    assertThat(done.getMissingFields()).contains(ScoringService.MISSING_VENDOR_NAME);
    assertThat(done.getProcessingTimeSeconds()).isEqualTo(0.0);
  }

  @Test
  void transientFailureIsRetryableAndRecordedAsFailed() {
    when(extractor.extract(eq(DOC), any()))
        .thenThrow(ExtractionException.transientFailure("Textract throttled", null));

    ProcessingOutcome outcome = orchestrator.process(job(), 0, ProcessingDeadline.none(clock));

    assertTrue(outcome.isRetryable());
    assertEquals(2, outcome.getAttemptsRemaining());
    assertEquals(Duration.ofSeconds(60), outcome.getRetryAfter());
    assertEquals(ErrorCode.EXTRACTION_TRANSIENT, outcome.getError().getErrorCode());

    List<ContractRecordUpdate> updates = capturedUpdates(3);
    ContractRecordUpdate failed = updates.get(2);
    assertEquals(ProcessingStatus.FAILED, failed.getStatus());
    assertThat(failed.getProgress()).isEqualTo(0);
    assertEquals("Textract throttled", failed.getErrorMessage());
    assertThat(failed.getProcessingEndedAt()).isNotNull();
  }

  @Test
  void lastAttemptFailureIsTerminal() {
    when(extractor.extract(eq(DOC), any()))
        .thenThrow(ExtractionException.transientFailure("LLM temporarily unavailable", null));

    ProcessingOutcome outcome = orchestrator.process(job(), 2, ProcessingDeadline.none(clock));

    assertEquals(ProcessingOutcome.Kind.TERMINAL_FAILURE, outcome.getKind());
    verify(gateway).upsert(eq(ID), argThat(u -> u.getStatus() == ProcessingStatus.FAILED));
  }

  @Test
  void permanentFailureIsRetriedByDefault() {
    when(extractor.extract(eq(DOC), any()))
        .thenThrow(ExtractionException.permanentFailure("Unsupported document", null));

    ProcessingOutcome outcome = orchestrator.process(job(), 0, ProcessingDeadline.none(clock));

    assertTrue(outcome.isRetryable());
  }

  @Test
  void permanentFailureIsTerminalWhenFailFastEnabled() {
    properties.getRetry().setFailFastOnPermanent(true);
    when(extractor.extract(eq(DOC), any()))
        .thenThrow(ExtractionException.permanentFailure("Unsupported document", null));

    ProcessingOutcome outcome = orchestrator.process(job(), 0, ProcessingDeadline.none(clock));

    assertEquals(ProcessingOutcome.Kind.TERMINAL_FAILURE, outcome.getKind());
    assertEquals(ErrorCode.EXTRACTION_PERMANENT, outcome.getError().getErrorCode());
  }

  @Test
  void unexpectedExceptionBecomesInternalError() {
    when(extractor.extract(eq(DOC), any())).thenThrow(new IllegalStateException("boom"));

    ProcessingOutcome outcome = orchestrator.process(job(), 0, ProcessingDeadline.none(clock));

    assertTrue(outcome.isRetryable());
    assertEquals(ErrorCode.INTERNAL_ERROR, outcome.getError().getErrorCode());
    assertEquals("Unexpected error during extraction", outcome.getError().getMessage());
  }

  @Test
  void failureWriteErrorDoesNotChangeOutcome() {
    when(extractor.extract(eq(DOC), any()))
        .thenThrow(ExtractionException.transientFailure("Textract throttled", null));
    doThrow(new PersistenceException("table unavailable", null))
        .when(gateway)
        .upsert(eq(ID), argThat(u -> u != null && u.getStatus() == ProcessingStatus.FAILED));

    ProcessingOutcome outcome = orchestrator.process(job(), 1, ProcessingDeadline.none(clock));

    assertTrue(outcome.isRetryable());
    assertEquals(1, outcome.getAttemptsRemaining());
  }

  @Test
  void checkpointWriteFailureFailsTheAttempt() {
    doThrow(new PersistenceException("table unavailable", null))
        .when(gateway)
        .upsert(eq(ID), argThat(u -> u != null && Integer.valueOf(10).equals(u.getProgress())));

    ProcessingOutcome outcome = orchestrator.process(job(), 0, ProcessingDeadline.none(clock));

    assertTrue(outcome.isRetryable());
    assertEquals(ErrorCode.PERSISTENCE_ERROR, outcome.getError().getErrorCode());
    verify(extractor, never()).extract(any(), any());
  }

  @Test
  void softDeadlineStopsAttemptBeforeNextCheckpoint() {
    ProcessingDeadline deadline = ProcessingDeadline.after(clock, Duration.ofSeconds(540));
    when(extractor.extract(eq(DOC), any()))
        .thenAnswer(
            inv -> {
              clock.advance(Duration.ofSeconds(541));
              return ContractDraft.empty();
            });

    ProcessingOutcome outcome = orchestrator.process(job(), 0, deadline);

    assertTrue(outcome.isRetryable());
    assertEquals(ErrorCode.PROCESSING_TIMEOUT, outcome.getError().getErrorCode());

    List<ContractRecordUpdate> updates = capturedUpdates(3);
    assertThat(updates).extracting(ContractRecordUpdate::getProgress).containsExactly(10, 20, 0);
    assertThat(updates.get(2).getProcessingTimeSeconds()).isEqualTo(541.0);
  }

  @Test
  void extractorReceivesTheAttemptDeadline() {
    ProcessingDeadline deadline = ProcessingDeadline.after(clock, Duration.ofSeconds(540));
    when(extractor.extract(DOC, deadline)).thenReturn(ContractDraft.empty());

    assertTrue(orchestrator.process(job(), 0, deadline).isSuccess());
    verify(extractor).extract(DOC, deadline);
  }

  @Test
  void retryEligibilityFollowsCategory() {
    assertTrue(
        orchestrator.isRetryEligible(ExtractionException.permanentFailure("bad input", null)));

    properties.getRetry().setFailFastOnPermanent(true);

    assertFalse(
        orchestrator.isRetryEligible(ExtractionException.permanentFailure("bad input", null)));
    assertTrue(orchestrator.isRetryEligible(ExtractionException.transientFailure("slow", null)));
  }
}

package com.cario.contract.app.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.cario.contract.app.error.ContractNotFoundException;
import com.cario.contract.app.error.ContractNotReadyException;
import com.cario.contract.app.error.ContractProcessingFailedException;
import com.cario.contract.app.error.ErrorCode;
import com.cario.contract.app.error.GlobalExceptionHandler;
import com.cario.contract.app.error.InvalidDocumentException;
import com.cario.contract.app.error.PersistenceException;
import com.cario.contract.app.model.ContractDraft;
import com.cario.contract.app.model.ContractRecord;
import com.cario.contract.app.model.ContractStatusView;
import com.cario.contract.app.model.ContractUploadResult;
import com.cario.contract.app.model.ProcessingStatus;
import com.cario.contract.app.model.ScoreBreakdown;
import com.cario.contract.app.service.ContractStatusService;
import com.cario.contract.app.service.ContractSubmissionService;
import com.cario.contract.app.service.DocumentStorageService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.multipart.MultipartFile;

class ContractControllerTest {

  private static final Instant SUBMITTED = Instant.parse("2025-03-01T10:00:00Z");
  private static final String PRESIGNED =
      "https://docs.s3.amazonaws.com/contracts/c-1.pdf?X-Amz-Signature=abc";

  private ContractSubmissionService submissionService;
  private ContractStatusService statusService;
  private DocumentStorageService storageService;
  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    submissionService = mock(ContractSubmissionService.class);
    statusService = mock(ContractStatusService.class);
    storageService = mock(DocumentStorageService.class);
    mvc =
        MockMvcBuilders.standaloneSetup(
                new ContractController(submissionService, statusService, storageService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  private static MockMultipartFile pdf() {
    return new MockMultipartFile("file", "msa.pdf", "application/pdf", "%PDF-1.7".getBytes());
  }

  @Test
  void uploadIsAccepted() throws Exception {
    when(submissionService.submit(any(MultipartFile.class)))
        .thenReturn(
            ContractUploadResult.builder()
                .contractId("c-1")
                .message("Contract uploaded successfully. Processing started.")
                .filename("msa.pdf")
                .fileSize(8)
                .build());

    mvc.perform(multipart("/contracts/upload").file(pdf()))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.contract_id").value("c-1"))
        .andExpect(jsonPath("$.file_size").value(8));
  }

  @Test
  void invalidUploadIsBadRequest() throws Exception {
    when(submissionService.submit(any(MultipartFile.class)))
        .thenThrow(new InvalidDocumentException(ErrorCode.INVALID_DOCUMENT));

    mvc.perform(multipart("/contracts/upload").file(pdf()))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_DOCUMENT"))
        .andExpect(jsonPath("$.path").value("/contracts/upload"));
  }

  @Test
  void oversizeUploadIsPayloadTooLarge() throws Exception {
    when(submissionService.submit(any(MultipartFile.class)))
        .thenThrow(new InvalidDocumentException(ErrorCode.DOCUMENT_TOO_LARGE));

    mvc.perform(multipart("/contracts/upload").file(pdf()))
        .andExpect(status().isPayloadTooLarge())
        .andExpect(jsonPath("$.code").value("DOCUMENT_TOO_LARGE"));
  }

  @Test
  void storeOutageIsServiceUnavailable() throws Exception {
    when(submissionService.submit(any(MultipartFile.class)))
        .thenThrow(new PersistenceException("Failed to create contract c-1", null));

    mvc.perform(multipart("/contracts/upload").file(pdf()))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("PERSISTENCE_ERROR"));
  }

  @Test
  void statusReturnsProgress() throws Exception {
    when(statusService.getStatus("c-1"))
        .thenReturn(
            ContractStatusView.builder()
                .contractId("c-1")
                .status(ProcessingStatus.PROCESSING)
                .progress(60)
                .attempt(0)
                .submittedAt(SUBMITTED)
                .build());

    mvc.perform(get("/contracts/c-1/status"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("PROCESSING"))
        .andExpect(jsonPath("$.progress").value(60))
        .andExpect(jsonPath("$.error_message").doesNotExist());
  }

  @Test
  void unknownContractIsNotFound() throws Exception {
    when(statusService.getStatus("nope")).thenThrow(new ContractNotFoundException("nope"));

    mvc.perform(get("/contracts/nope/status"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("CONTRACT_NOT_FOUND"))
        .andExpect(jsonPath("$.metadata.contractId").value("nope"));
  }

  @Test
  void resultBeforeCompletionIsAcceptedWithProgress() throws Exception {
    when(statusService.getCompleted("c-1"))
        .thenThrow(new ContractNotReadyException("c-1", ProcessingStatus.PROCESSING, 20));

    mvc.perform(get("/contracts/c-1"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.code").value("CONTRACT_NOT_READY"))
        .andExpect(jsonPath("$.metadata.status").value("PROCESSING"))
        .andExpect(jsonPath("$.metadata.progress").value(20));
  }

  @Test
  void failedContractIsServerError() throws Exception {
    when(statusService.getCompleted("c-1"))
        .thenThrow(new ContractProcessingFailedException("c-1", "Textract throttled"));

    mvc.perform(get("/contracts/c-1"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.message").value("Contract processing failed: Textract throttled"));
  }

  @Test
  void completedContractRendersDraftFlat() throws Exception {
    when(statusService.getCompleted("c-1"))
        .thenReturn(
            ContractRecord.newPending("c-1", SUBMITTED).toBuilder()
                .status(ProcessingStatus.COMPLETED)
                .progress(100)
                .completenessScore(12.0)
                .scoreBreakdown(
                    ScoreBreakdown.builder().partyIdentification(4.0).paymentTerms(8.0).build())
                .missingFields(List.of("Vendor name"))
                .draft(ContractDraft.builder().contractTitle("Master Services Agreement").build())
                .build());

    mvc.perform(get("/contracts/c-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.completeness_score").value(12.0))
        .andExpect(jsonPath("$.score_breakdown.payment_terms").value(8.0))
        .andExpect(jsonPath("$.missing_fields[0]").value("Vendor name"))
        .andExpect(jsonPath("$.contract_title").value("Master Services Agreement"))
        .andExpect(jsonPath("$.draft").doesNotExist());
  }

  @Test
  void downloadRedirectsToPresignedUrl() throws Exception {
    when(statusService.getRecord("c-1"))
        .thenReturn(
            ContractRecord.newPending("c-1", SUBMITTED).toBuilder()
                .documentKey("contracts/c-1.pdf")
                .filename("msa.pdf")
                .build());
    when(storageService.presignDownload("contracts/c-1.pdf", "msa.pdf"))
        .thenReturn(PRESIGNED);

    mvc.perform(get("/contracts/c-1/download"))
        .andExpect(status().isFound())
        .andExpect(header().string("Location", PRESIGNED));
  }
}

package com.cario.contract.app.service;

import com.cario.contract.app.error.ExtractionException;
import com.cario.contract.app.model.DocumentRef;
import com.cario.contract.app.model.DocumentText;
import java.time.Duration;
import java.util.*;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.*;

/**
 * Service that wraps AWS Textract text detection: - Sync {@code DetectDocumentText} for images -
 * Async {@code StartDocumentTextDetection} + polling for PDFs
 *
 * <p>SDK failures are translated to {@link ExtractionException}s whose kind tells the pipeline
 * whether another attempt can help.
 */
@Log4j2
public class TextractService {

  private static final String PDF_CONTENT_TYPE = "application/pdf";

  private final TextractClient textractClient;
  private final float minLineConfidence;
  private final Duration pollInterval;
  private final int maxPolls;

  public TextractService(
      final TextractClient textractClient,
      float minLineConfidence,
      Duration pollInterval,
      int maxPolls) {
    this.textractClient = Objects.requireNonNull(textractClient, "textractClient must not be null");
    this.minLineConfidence = minLineConfidence;
    this.pollInterval = pollInterval == null ? Duration.ofSeconds(5) : pollInterval;
    this.maxPolls = maxPolls;
  }

  /**
   * Detects the text of a document stored in S3.
   *
   * @param ref document location
   * @param deadline soft limit of the running attempt, checked before every poll of an async job
   * @return page-tagged text and confidence stats
   * @throws ExtractionException if detection fails or the document has no text
   * @throws com.cario.contract.app.error.ProcessingTimeoutException if the deadline passes while
   *     an async job is still running
   */
  public DocumentText extractText(DocumentRef ref, ProcessingDeadline deadline) {
    Objects.requireNonNull(ref, "ref");
    Objects.requireNonNull(deadline, "deadline");
    Document document =
        Document.builder()
            .s3Object(S3Object.builder().bucket(ref.getBucket()).name(ref.getKey()).build())
            .build();

    try {
      DocumentText result;
      if (isPdf(ref)) {
        log.info("textract.async.start uri={}", ref.toS3Uri());
        result = detectAsync(document, deadline);
      } else {
        log.info("textract.sync.start uri={}", ref.toS3Uri());
        DetectDocumentTextResponse response =
            textractClient.detectDocumentText(
                DetectDocumentTextRequest.builder().document(document).build());
        result = toDocumentText(response.blocks(), null);
      }

      if (result.getText() == null || result.getText().isBlank()) {
        throw ExtractionException.permanentFailure(
            "No text content extracted from document " + ref.toS3Uri(), null);
      }
      log.info(
          "textract.done uri={} pages={} lines={} avgConf={}",
          ref.toS3Uri(),
          result.getPageCount(),
          result.getLineCount(),
          String.format("%.1f", result.getAverageConfidence()));
      return result;

    } catch (TextractException e) {
      log.warn("textract.error uri={} code={} msg={}", ref.toS3Uri(), errorCode(e), e.getMessage());
      throw classify(e);
    } catch (SdkClientException e) {
      log.warn("textract.clientError uri={} msg={}", ref.toS3Uri(), e.getMessage());
      throw ExtractionException.transientFailure("Textract unreachable: " + e.getMessage(), e);
    }
  }

  // ---------- async (PDF) ----------

  private DocumentText detectAsync(Document document, ProcessingDeadline deadline) {
    StartDocumentTextDetectionResponse start =
        textractClient.startDocumentTextDetection(
            StartDocumentTextDetectionRequest.builder()
                .documentLocation(DocumentLocation.builder().s3Object(document.s3Object()).build())
                .build());

    String jobId = start.jobId();
    log.info("textract.async.job jobId={}", jobId);

    GetDocumentTextDetectionResponse result = null;
    int polls = 0;
    while (true) {
      if (polls++ >= maxPolls) {
        throw ExtractionException.transientFailure(
            "Textract job " + jobId + " did not finish after " + maxPolls + " polls", null);
      }
      if (deadline.isExpired()) {
        log.warn("textract.async.deadline jobId={} polls={}", jobId, polls - 1);
      }
      deadline.check("extraction");
      sleep(pollInterval);

      result =
          textractClient.getDocumentTextDetection(
              GetDocumentTextDetectionRequest.builder().jobId(jobId).build());
      JobStatus status = result.jobStatus();
      log.debug("textract.async.poll jobId={} status={}", jobId, status);

      if (status == JobStatus.SUCCEEDED || status == JobStatus.PARTIAL_SUCCESS) {
        break;
      } else if (status == JobStatus.FAILED) {
        throw ExtractionException.permanentFailure(
            "Textract job failed: jobId=" + jobId + " reason=" + result.statusMessage(), null);
      }
    }

    // Collect blocks across all result pages
    List<Block> blocks = new ArrayList<>(result.blocks());
    String nextToken = result.nextToken();
    while (nextToken != null) {
      result =
          textractClient.getDocumentTextDetection(
              GetDocumentTextDetectionRequest.builder().jobId(jobId).nextToken(nextToken).build());
      blocks.addAll(result.blocks());
      nextToken = result.nextToken();
    }
    return toDocumentText(blocks, jobId);
  }

  private static void sleep(Duration d) {
    if (d.isZero() || d.isNegative()) return;
    try {
      Thread.sleep(d.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw ExtractionException.transientFailure("Textract polling interrupted", e);
    }
  }

  // ---------- text assembly ----------

  DocumentText toDocumentText(List<Block> blocks, String jobId) {
    Map<Integer, List<String>> linesByPage = new TreeMap<>();
    List<Float> confidences = new ArrayList<>();

    for (Block b : blocks) {
      if (b.blockType() != BlockType.LINE || b.text() == null) continue;
      if (b.confidence() != null && b.confidence() < minLineConfidence) continue;
      int page = b.page() == null ? 1 : b.page();
      linesByPage.computeIfAbsent(page, k -> new ArrayList<>()).add(b.text());
      if (b.confidence() != null) confidences.add(b.confidence());
    }

    String text =
        linesByPage.entrySet().stream()
            .map(e -> "--- Page " + e.getKey() + " ---\n" + String.join("\n", e.getValue()))
            .collect(Collectors.joining("\n\n"));

    return DocumentText.builder()
        .text(text)
        .pageCount(linesByPage.size())
        .lineCount(linesByPage.values().stream().mapToInt(List::size).sum())
        .averageConfidence(
            confidences.stream().mapToDouble(Float::doubleValue).average().orElse(0.0))
        .minConfidence(confidences.stream().mapToDouble(Float::doubleValue).min().orElse(0.0))
        .jobId(jobId)
        .build();
  }

  // ---------- error classification ----------

  static ExtractionException classify(TextractException e) {
    if (e instanceof ThrottlingException
        || e instanceof ProvisionedThroughputExceededException
        || e instanceof InternalServerErrorException
        || e instanceof LimitExceededException) {
      return ExtractionException.transientFailure("Textract unavailable: " + e.getMessage(), e);
    }
    if (e instanceof InvalidS3ObjectException
        || e instanceof UnsupportedDocumentException
        || e instanceof BadDocumentException
        || e instanceof DocumentTooLargeException
        || e instanceof InvalidParameterException) {
      return ExtractionException.permanentFailure(
          "Textract rejected document: " + e.getMessage(), e);
    }
    // Anything else: server-side trouble is worth retrying, client-side is not
    return e.statusCode() >= 500 || e.isThrottlingException()
        ? ExtractionException.transientFailure("Textract error: " + e.getMessage(), e)
        : ExtractionException.permanentFailure("Textract error: " + e.getMessage(), e);
  }

  private static boolean isPdf(DocumentRef ref) {
    if (PDF_CONTENT_TYPE.equalsIgnoreCase(ref.getContentType())) return true;
    return ref.getKey() != null && ref.getKey().toLowerCase(Locale.ROOT).endsWith(".pdf");
  }

  private static String errorCode(TextractException e) {
    return e.awsErrorDetails() == null ? null : e.awsErrorDetails().errorCode();
  }
}

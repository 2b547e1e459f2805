package com.cario.contract.app.service;

import com.cario.contract.app.error.DocumentStorageException;
import com.cario.contract.app.error.ErrorCode;
import com.cario.contract.app.error.InvalidDocumentException;
import com.cario.contract.app.model.StoredDocument;
import java.io.IOException;
import java.io.InputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.io.FilenameUtils;
import org.springframework.web.multipart.MultipartFile;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

/** Validates contract uploads, stores them in S3 and presigns downloads. */
@Log4j2
public class DocumentStorageService {

  private static final String PDF_EXTENSION = "pdf";

  private final S3Client s3;
  private final S3Presigner presigner;
  private final String bucket;
  private final String prefix;
  private final long maxFileSize;
  private final List<String> allowedContentTypes;
  private final Duration presignTtl;

  public DocumentStorageService(
      S3Client s3,
      S3Presigner presigner,
      String bucket,
      String prefix,
      long maxFileSize,
      List<String> allowedContentTypes,
      Duration presignTtl) {
    this.s3 = Objects.requireNonNull(s3, "S3Client must not be null");
    this.presigner = Objects.requireNonNull(presigner, "S3Presigner must not be null");
    this.bucket = Objects.requireNonNull(bucket, "bucket must not be null");
    this.prefix = normalizePrefix(prefix);
    this.maxFileSize = maxFileSize;
    this.allowedContentTypes = List.copyOf(allowedContentTypes);
    this.presignTtl = presignTtl;
  }

  // ------------------ Public API ------------------

  /**
   * Rejects anything that is not a non-empty PDF within the size limit.
   *
   * @throws InvalidDocumentException with {@code INVALID_DOCUMENT}, {@code EMPTY_DOCUMENT} or
   *     {@code DOCUMENT_TOO_LARGE}
   */
  public void validate(MultipartFile file) {
    if (file == null) {
      throw new InvalidDocumentException(ErrorCode.EMPTY_DOCUMENT);
    }
    String contentType = file.getContentType();
    if (contentType == null
        || allowedContentTypes.stream().noneMatch(t -> t.equalsIgnoreCase(contentType))) {
      throw new InvalidDocumentException(
          ErrorCode.INVALID_DOCUMENT, "Only PDF files are supported, got " + contentType);
    }
    String ext = FilenameUtils.getExtension(file.getOriginalFilename());
    if (!PDF_EXTENSION.equalsIgnoreCase(ext)) {
      throw new InvalidDocumentException(
          ErrorCode.INVALID_DOCUMENT, "File must have .pdf extension");
    }
    if (file.isEmpty() || file.getSize() <= 0) {
      throw new InvalidDocumentException(ErrorCode.EMPTY_DOCUMENT);
    }
    if (file.getSize() > maxFileSize) {
      throw new InvalidDocumentException(
          ErrorCode.DOCUMENT_TOO_LARGE,
          "File size exceeds maximum of " + (maxFileSize / (1024 * 1024)) + "MB");
    }
  }

  /** Writes the upload under {@code <prefix><contractId>.pdf}. */
  public StoredDocument store(String contractId, MultipartFile file) {
    String key = keyFor(contractId, file.getOriginalFilename());
    String contentType = file.getContentType();
    try (InputStream in = file.getInputStream()) {
      PutObjectRequest req =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .contentLength(file.getSize())
              .metadata(
                  Map.of(
                      "original-filename", safe(file.getOriginalFilename()),
                      "contract-id", contractId))
              .build();

      PutObjectResponse resp = s3.putObject(req, RequestBody.fromInputStream(in, file.getSize()));

      StoredDocument result =
          StoredDocument.builder()
              .bucket(bucket)
              .key(key)
              .eTag(resp.eTag())
              .contentType(contentType)
              .size(file.getSize())
              .s3Uri("s3://" + bucket + "/" + key)
              .filename(file.getOriginalFilename())
              .build();

      log.info(
          "s3.upload ok contractId={} key={} size={} eTag={}",
          contractId,
          key,
          result.getSize(),
          result.getETag());
      return result;
    } catch (IOException | SdkException e) {
      log.error("s3.upload error contractId={} key={} msg={}", contractId, key, e.getMessage(), e);
      throw new DocumentStorageException("Failed to store document: " + e.getMessage(), e);
    }
  }

  /** Removes a stored document. */
  public void delete(String key) {
    try {
      s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
      log.info("s3.delete ok key={}", key);
    } catch (SdkException e) {
      log.warn("s3.delete error key={} msg={}", key, e.getMessage());
      throw new DocumentStorageException("Failed to delete document: " + e.getMessage(), e);
    }
  }

  /** Presigned GET for the stored document, served as an attachment named {@code filename}. */
  public String presignDownload(String key, String filename) {
    try {
      GetObjectRequest.Builder get = GetObjectRequest.builder().bucket(bucket).key(key);
      if (filename != null && !filename.isBlank()) {
        get.responseContentDisposition("attachment; filename=\"" + safe(filename) + "\"");
      }
      GetObjectPresignRequest presign =
          GetObjectPresignRequest.builder()
              .signatureDuration(presignTtl)
              .getObjectRequest(get.build())
              .build();
      return presigner.presignGetObject(presign).url().toString();
    } catch (SdkException e) {
      log.error("s3.presign error key={} msg={}", key, e.getMessage(), e);
      throw new DocumentStorageException("Failed to presign download: " + e.getMessage(), e);
    }
  }

  public String getBucket() {
    return bucket;
  }

  // ------------------ Helpers ------------------

  String keyFor(String contractId, String originalFilename) {
    String ext = FilenameUtils.getExtension(originalFilename);
    String suffix = (ext == null || ext.isBlank()) ? "" : ("." + ext.toLowerCase(Locale.ROOT));
    return prefix + contractId + suffix;
  }

  private static String normalizePrefix(String p) {
    if (p == null || p.isBlank()) return "";
    return p.endsWith("/") ? p : p + "/";
  }

  private static String safe(String s) {
    return s == null ? "" : URLEncoder.encode(s, StandardCharsets.UTF_8);
  }
}

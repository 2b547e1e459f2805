package com.cario.contract.app.model;

import lombok.Builder;
import lombok.Data;

/** Returned after a document was written to S3. */
@Data
@Builder
public class StoredDocument {
  private String bucket;
  private String key;
  private String eTag; // S3 ETag from PutObjectResponse
  private String contentType; // As stored on S3
  private long size; // Bytes uploaded
  private String s3Uri; // s3://bucket/key
  private String filename; // Original client filename
}

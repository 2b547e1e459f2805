package com.cario.contract.app.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Location of a stored contract document.
 *
 * <ul>
 *   <li>{@code bucket} / {@code key} – S3 coordinates of the original upload
 *   <li>{@code contentType} – MIME type recorded at upload
 *   <li>{@code filename} – Original client filename
 * </ul>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentRef {

  private String bucket;

  private String key;

  private String contentType;

  private String filename;

  public String toS3Uri() {
    return "s3://" + bucket + "/" + key;
  }
}

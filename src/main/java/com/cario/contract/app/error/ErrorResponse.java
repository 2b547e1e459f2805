package com.cario.contract.app.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/** Body of every non-2xx API response (and of the 202 "not ready" response). */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

  private String code;

  private String message;

  private int status;

  private Instant timestamp;

  /** Request path that caused the error. */
  private String path;

  private List<FieldError> fieldErrors;

  private Map<String, Object> metadata;

  @Data
  @Builder
  public static class FieldError {
    private String field;
    private String message;
  }
}

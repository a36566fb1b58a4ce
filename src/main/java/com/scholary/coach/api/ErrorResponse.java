package com.scholary.coach.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned for every non-2xx answer.
 *
 * <p>Messages are generic; upstream response bodies and model output never appear here.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String error,
    String message,
    @JsonProperty("retry_after") Long retryAfter,
    @JsonProperty("max_techniques") Integer maxTechniques) {

  public static ErrorResponse of(String error) {
    return new ErrorResponse(error, null, null, null);
  }

  public static ErrorResponse of(String error, String message) {
    return new ErrorResponse(error, message, null, null);
  }
}

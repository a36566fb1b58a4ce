package com.scholary.coach.api;

import com.scholary.coach.analysis.MalformedResponseException;
import com.scholary.coach.auth.DomainNotAllowedException;
import com.scholary.coach.auth.UnauthenticatedException;
import com.scholary.coach.gemini.GeminiException;
import com.scholary.coach.ratelimit.RateLimitedException;
import com.scholary.coach.readiness.ProcessingFailedException;
import com.scholary.coach.readiness.ProcessingTimedOutException;
import com.scholary.coach.service.AnalysisCancelledException;
import com.scholary.coach.service.EmptyCompletionException;
import com.scholary.coach.service.InvalidRequestException;
import com.scholary.coach.service.ReadinessCheckFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures to status codes and generic error bodies.
 *
 * <p>Upstream status codes, response bodies and model output are logged here at most, never
 * returned.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
    return ResponseEntity.badRequest().body(ErrorResponse.of("Invalid JSON body"));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleInvalidArgument(MethodArgumentNotValidException e) {
    String field =
        e.getBindingResult().getFieldError() == null
            ? "request"
            : e.getBindingResult().getFieldError().getField();
    return ResponseEntity.badRequest().body(ErrorResponse.of("Missing or invalid " + field));
  }

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException e) {
    return ResponseEntity.badRequest()
        .body(new ErrorResponse(e.getMessage(), null, null, e.getMaxTechniques()));
  }

  @ExceptionHandler(UnauthenticatedException.class)
  public ResponseEntity<ErrorResponse> handleUnauthenticated(UnauthenticatedException e) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(ErrorResponse.of("Unauthorized", e.getMessage()));
  }

  @ExceptionHandler(DomainNotAllowedException.class)
  public ResponseEntity<ErrorResponse> handleDomainNotAllowed(DomainNotAllowedException e) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(ErrorResponse.of("Forbidden", e.getMessage()));
  }

  @ExceptionHandler(RateLimitedException.class)
  public ResponseEntity<ErrorResponse> handleRateLimited(RateLimitedException e) {
    return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
        .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()))
        .body(
            new ErrorResponse(
                "Rate limit exceeded", e.getMessage(), e.getRetryAfterSeconds(), null));
  }

  @ExceptionHandler(ProcessingFailedException.class)
  public ResponseEntity<ErrorResponse> handleProcessingFailed(ProcessingFailedException e) {
    LOGGER.warn("Video processing failed: {}", e.getMessage());
    return serverError("Video processing failed");
  }

  @ExceptionHandler(ProcessingTimedOutException.class)
  public ResponseEntity<ErrorResponse> handleProcessingTimedOut(ProcessingTimedOutException e) {
    LOGGER.warn("Video processing timed out: {}", e.getMessage());
    return serverError("Video processing timed out");
  }

  @ExceptionHandler(ReadinessCheckFailedException.class)
  public ResponseEntity<ErrorResponse> handleReadinessCheckFailed(ReadinessCheckFailedException e) {
    LOGGER.error("Readiness check failed: {}", e.getMessage(), e.getCause());
    return serverError("Failed to check video processing state");
  }

  @ExceptionHandler(GeminiException.class)
  public ResponseEntity<ErrorResponse> handleGemini(GeminiException e) {
    LOGGER.error(
        "Generation call failed: status={}, body={}", e.getStatusCode(), e.getResponseBody(), e);
    return badGateway("Analysis service request failed");
  }

  @ExceptionHandler(EmptyCompletionException.class)
  public ResponseEntity<ErrorResponse> handleEmptyCompletion(EmptyCompletionException e) {
    LOGGER.warn("Unusable completion: {}, blockReason={}", e.getMessage(), e.getBlockReason());
    return badGateway("Analysis blocked or returned no results");
  }

  @ExceptionHandler(MalformedResponseException.class)
  public ResponseEntity<ErrorResponse> handleMalformed(MalformedResponseException e) {
    return badGateway("Analysis service returned an unreadable response");
  }

  @ExceptionHandler(AnalysisCancelledException.class)
  public ResponseEntity<ErrorResponse> handleCancelled(AnalysisCancelledException e) {
    LOGGER.warn("Analysis cancelled: {}", e.getMessage());
    return serverError("Analysis cancelled");
  }

  @ExceptionHandler(TaskRejectedException.class)
  public ResponseEntity<ErrorResponse> handleRejected(TaskRejectedException e) {
    LOGGER.warn("Analysis executor saturated");
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(ErrorResponse.of("Too many analyses in progress, please retry shortly"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(RuntimeException e) {
    LOGGER.error("Unexpected failure", e);
    return serverError("Internal server error");
  }

  private static ResponseEntity<ErrorResponse> serverError(String error) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(error));
  }

  private static ResponseEntity<ErrorResponse> badGateway(String error) {
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorResponse.of(error));
  }
}

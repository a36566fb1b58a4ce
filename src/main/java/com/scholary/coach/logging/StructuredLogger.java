package com.scholary.coach.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event sets {@code event_type} plus its own fields so they can be queried in the log
 * store, then clears them again. Request-wide fields ({@code correlationId}, {@code userId}) are
 * managed separately with {@link #setRequestContext} and {@link #clearRequestContext}.
 *
 * <p>Model output is never passed to these methods; at most its length is.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log the start of an analysis request. */
  public void logAnalysisStarted(String resource, int techniqueCount, boolean includeRatings) {
    try {
      MDC.put("event_type", "analysis_started");
      MDC.put("resource", resource);
      MDC.put("techniqueCount", String.valueOf(techniqueCount));
      MDC.put("includeRatings", String.valueOf(includeRatings));

      logger.info(
          "Analysis started: resource={}, techniques={}, ratings={}",
          resource,
          techniqueCount,
          includeRatings);
    } finally {
      clearEventFields();
    }
  }

  /** Log a state transition of the analysis pipeline. */
  public void logStateTransition(String from, String to) {
    try {
      MDC.put("event_type", "state_transition");
      MDC.put("fromState", from);
      MDC.put("toState", to);

      logger.debug("State transition: {} -> {}", from, to);
    } finally {
      clearEventFields();
    }
  }

  /** Log a request turned away by the rate limit. */
  public void logRateDenied(String resource, long limit, long retryAfterSeconds) {
    try {
      MDC.put("event_type", "rate_denied");
      MDC.put("resource", resource);
      MDC.put("limit", String.valueOf(limit));
      MDC.put("retryAfterSeconds", String.valueOf(retryAfterSeconds));

      logger.info(
          "Rate limit denied: resource={}, limit={}, retryAfter={}s",
          resource,
          limit,
          retryAfterSeconds);
    } finally {
      clearEventFields();
    }
  }

  /** Log a single readiness status query. */
  public void logReadinessPoll(String fileName, int attempt, String state, long elapsedMs) {
    try {
      MDC.put("event_type", "readiness_poll");
      MDC.put("fileName", fileName);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("fileState", state);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.debug(
          "Readiness poll: file={}, attempt={}, state={}, elapsed={}ms",
          fileName,
          attempt,
          state,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log the terminal outcome of a readiness poll. */
  public void logReadinessResolved(String fileName, String state, int attempts, long elapsedMs) {
    try {
      MDC.put("event_type", "readiness_resolved");
      MDC.put("fileName", fileName);
      MDC.put("fileState", state);
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Readiness resolved: file={}, state={}, attempts={}, elapsed={}ms",
          fileName,
          state,
          attempts,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a completed generation call with its token usage. */
  public void logGenerationCompleted(
      String model, Integer inputTokens, Integer outputTokens, long durationMs) {
    try {
      MDC.put("event_type", "generation_completed");
      MDC.put("model", model);
      MDC.put("inputTokens", String.valueOf(inputTokens));
      MDC.put("outputTokens", String.valueOf(outputTokens));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Generation completed: model={}, inputTokens={}, outputTokens={}, duration={}ms",
          model,
          inputTokens,
          outputTokens,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log model output that could not be decoded. Only the length is recorded. */
  public void logNormalizeFailed(int textLength, String errorType) {
    try {
      MDC.put("event_type", "normalize_failed");
      MDC.put("textLength", String.valueOf(textLength));
      MDC.put("errorType", errorType);

      logger.error("Normalize failed: length={}, error={}", textLength, errorType);
    } finally {
      clearEventFields();
    }
  }

  /** Log a failed best-effort delete. */
  public void logCleanupFailed(String fileName, String errorType, String message) {
    try {
      MDC.put("event_type", "cleanup_failed");
      MDC.put("fileName", fileName);
      MDC.put("errorType", errorType);

      logger.warn("Cleanup failed: file={}, error={}, message={}", fileName, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Set request context in MDC. */
  public static void setRequestContext(String correlationId, String userId) {
    MDC.put("correlationId", correlationId);
    MDC.put("userId", userId);
  }

  /** Clear request context from MDC. */
  public static void clearRequestContext() {
    MDC.remove("correlationId");
    MDC.remove("userId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("resource");
    MDC.remove("techniqueCount");
    MDC.remove("includeRatings");
    MDC.remove("fromState");
    MDC.remove("toState");
    MDC.remove("limit");
    MDC.remove("retryAfterSeconds");
    MDC.remove("fileName");
    MDC.remove("attempt");
    MDC.remove("fileState");
    MDC.remove("elapsedMs");
    MDC.remove("model");
    MDC.remove("inputTokens");
    MDC.remove("outputTokens");
    MDC.remove("durationMs");
    MDC.remove("textLength");
    MDC.remove("errorType");
  }
}

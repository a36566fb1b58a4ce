package com.scholary.coach.api;

import com.scholary.coach.config.AnalysisProperties;
import com.scholary.coach.service.AnalysisCancelledException;
import com.scholary.coach.service.MediaAnalysisOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpHeaders;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

/**
 * REST API for teaching video analysis.
 *
 * <p>Analyses run on the analysis executor. If the request times out or the connection fails, the
 * worker is interrupted; it stops polling and still deletes the upload. A worker that never left
 * the queue is dropped and the upload is deleted on its behalf.
 */
@RestController
@RequestMapping("/analyze")
@Tag(name = "Analysis", description = "Teaching video analysis against a technique catalog")
public class AnalysisController {

  private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisController.class);

  private final MediaAnalysisOrchestrator orchestrator;
  private final ThreadPoolTaskExecutor analysisExecutor;
  private final long requestTimeoutMs;

  public AnalysisController(
      MediaAnalysisOrchestrator orchestrator,
      @Qualifier("analysisExecutor") ThreadPoolTaskExecutor analysisExecutor,
      AnalysisProperties properties) {
    this.orchestrator = orchestrator;
    this.analysisExecutor = analysisExecutor;
    this.requestTimeoutMs = properties.requestTimeout().toMillis();
  }

  @PostMapping("/video")
  @Operation(
      summary = "Analyze an uploaded teaching video",
      description =
          "Waits for the uploaded file to finish processing, evaluates it against the given "
              + "techniques and deletes the upload afterwards. Counts against the hourly video "
              + "quota only when it succeeds.")
  public DeferredResult<AnalysisResponse> analyzeVideo(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
      @RequestBody(required = false) MediaAnalysisRequest request) {
    DeferredResult<AnalysisResponse> result = new DeferredResult<>(requestTimeoutMs);
    AtomicBoolean claimed = new AtomicBoolean(false);

    Future<?> worker =
        analysisExecutor.submit(
            () -> {
              if (!claimed.compareAndSet(false, true)) {
                return;
              }
              try {
                result.setResult(orchestrator.analyzeMedia(authorization, request));
              } catch (RuntimeException e) {
                result.setErrorResult(e);
              }
            });

    result.onTimeout(
        () -> {
          LOGGER.warn("Analysis timed out after {}ms, cancelling", requestTimeoutMs);
          cancel(worker, claimed, authorization, request);
          result.setErrorResult(new AnalysisCancelledException("Analysis timed out", null));
        });
    result.onError(
        error -> {
          LOGGER.warn("Analysis request failed, cancelling: {}", error.getMessage());
          cancel(worker, claimed, authorization, request);
        });
    return result;
  }

  @GetMapping("/video/rate-limit")
  @Operation(
      summary = "Current video quota",
      description = "Returns how many video analyses the caller has used in the current hour.")
  public RateLimitStatusResponse videoRateLimit(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    return orchestrator.mediaRateLimitStatus(authorization);
  }

  /**
   * Stop an analysis. A running worker is interrupted and cleans up itself; a worker still waiting
   * in the queue never will, so its upload is discarded separately.
   */
  private void cancel(
      Future<?> worker,
      AtomicBoolean claimed,
      String authorization,
      MediaAnalysisRequest request) {
    if (!claimed.compareAndSet(false, true)) {
      worker.cancel(true);
      return;
    }
    worker.cancel(false);
    Runnable discard = () -> orchestrator.discardUpload(authorization, request);
    try {
      analysisExecutor.execute(discard);
    } catch (TaskRejectedException e) {
      LOGGER.warn("Analysis executor saturated, discarding upload on the calling thread");
      discard.run();
    }
  }
}

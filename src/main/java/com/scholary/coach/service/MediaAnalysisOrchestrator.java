package com.scholary.coach.service;

import com.scholary.coach.analysis.AnalysisResult;
import com.scholary.coach.analysis.MalformedResponseException;
import com.scholary.coach.analysis.ResponseNormalizer;
import com.scholary.coach.api.AnalysisResponse;
import com.scholary.coach.api.MediaAnalysisRequest;
import com.scholary.coach.api.RateLimitStatusResponse;
import com.scholary.coach.auth.AuthenticatedUser;
import com.scholary.coach.auth.SessionVerifier;
import com.scholary.coach.auth.UnauthenticatedException;
import com.scholary.coach.config.AnalysisProperties;
import com.scholary.coach.gemini.GeminiClient;
import com.scholary.coach.gemini.GeminiException;
import com.scholary.coach.gemini.GeminiFile;
import com.scholary.coach.gemini.GeminiProperties;
import com.scholary.coach.gemini.GenerateContentRequest;
import com.scholary.coach.gemini.GenerateContentResponse;
import com.scholary.coach.logging.StructuredLogger;
import com.scholary.coach.prompt.AnalysisPromptBuilder;
import com.scholary.coach.ratelimit.RateAccountant;
import com.scholary.coach.ratelimit.RateDecision;
import com.scholary.coach.ratelimit.RateLimitProperties;
import com.scholary.coach.ratelimit.RateLimitedException;
import com.scholary.coach.ratelimit.ResourceClass;
import com.scholary.coach.readiness.PollingCancelledException;
import com.scholary.coach.readiness.ReadinessPoller;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one video analysis from credential to normalized result.
 *
 * <p>The steps are strictly ordered: authenticate, reserve quota, validate, wait for the upload to
 * become ACTIVE, generate, normalize, commit quota, delete the upload. A request that fails
 * validation makes no downstream call at all. Any later failure releases the quota reservation and
 * still deletes the upload; a failed delete is logged and never changes the outcome.
 *
 * <p>Interrupting the calling thread cancels the analysis. Cleanup still runs in that case.
 */
@Service
public class MediaAnalysisOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaAnalysisOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final Pattern FILE_NAME = Pattern.compile(MediaAnalysisRequest.FILE_NAME_PATTERN);

  private final SessionVerifier sessionVerifier;
  private final RateAccountant rateAccountant;
  private final ReadinessPoller readinessPoller;
  private final AnalysisPromptBuilder promptBuilder;
  private final GeminiClient geminiClient;
  private final ResponseNormalizer responseNormalizer;
  private final Validator validator;
  private final GeminiProperties geminiProperties;
  private final RateLimitProperties rateLimitProperties;
  private final int maxTechniques;

  public MediaAnalysisOrchestrator(
      SessionVerifier sessionVerifier,
      RateAccountant rateAccountant,
      ReadinessPoller readinessPoller,
      AnalysisPromptBuilder promptBuilder,
      GeminiClient geminiClient,
      ResponseNormalizer responseNormalizer,
      Validator validator,
      GeminiProperties geminiProperties,
      RateLimitProperties rateLimitProperties,
      AnalysisProperties analysisProperties) {
    this.sessionVerifier = sessionVerifier;
    this.rateAccountant = rateAccountant;
    this.readinessPoller = readinessPoller;
    this.promptBuilder = promptBuilder;
    this.geminiClient = geminiClient;
    this.responseNormalizer = responseNormalizer;
    this.validator = validator;
    this.geminiProperties = geminiProperties;
    this.rateLimitProperties = rateLimitProperties;
    this.maxTechniques = analysisProperties.maxTechniques();
  }

  /**
   * Analyze an uploaded video.
   *
   * @param authorizationHeader the raw {@code Authorization} header, may be null
   * @param request the parsed request body, may be null
   * @return the normalized analysis
   * @throws com.scholary.coach.auth.UnauthenticatedException if the credential is rejected
   * @throws RateLimitedException if the hourly quota is used up
   * @throws InvalidRequestException if the request is malformed
   * @throws AnalysisCancelledException if the calling thread was interrupted
   */
  public AnalysisResponse analyzeMedia(String authorizationHeader, MediaAnalysisRequest request) {
    String correlationId = UUID.randomUUID().toString();
    AnalysisState state = AnalysisState.UNAUTHENTICATED;

    AuthenticatedUser user = sessionVerifier.verify(authorizationHeader);
    StructuredLogger.setRequestContext(correlationId, user.userId());
    try {
      state = advance(state, AnalysisState.RATE_CHECKING);
      int limit = rateLimitProperties.limitFor(ResourceClass.MEDIA_ANALYSIS);
      RateDecision decision =
          rateAccountant.checkAndReserve(user, ResourceClass.MEDIA_ANALYSIS, limit);
      if (!decision.allowed()) {
        structuredLogger.logRateDenied(
            ResourceClass.MEDIA_ANALYSIS.keySegment(), limit, decision.retryAfterSeconds());
        advance(state, AnalysisState.ERRORED);
        throw new RateLimitedException(
            String.format("Maximum %d video analyses per hour. Please try again later.", limit),
            limit,
            decision.retryAfterSeconds());
      }

      String uploadedFile = null;
      try {
        validate(request);
        uploadedFile = request.geminiFileName();
        boolean includeRatings = request.ratingsRequested();
        structuredLogger.logAnalysisStarted(
            ResourceClass.MEDIA_ANALYSIS.keySegment(), request.techniques().size(), includeRatings);

        state = advance(state, AnalysisState.AWAITING_READINESS);
        GeminiFile file = awaitReady(uploadedFile);

        state = advance(state, AnalysisState.GENERATING);
        String prompt = promptBuilder.buildVideoPrompt(request.techniques(), includeRatings);
        String model = geminiProperties.mediaModel();
        GenerateContentRequest body =
            GenerateContentRequest.forFile(
                file.mimeType(),
                file.uri(),
                prompt,
                geminiProperties.temperature(),
                geminiProperties.mediaMaxOutputTokens());
        long startTime = System.currentTimeMillis();
        GenerateContentResponse completion = geminiClient.generateContent(model, body);
        logGeneration(model, completion, System.currentTimeMillis() - startTime);
        String text = completionText(completion);

        state = advance(state, AnalysisState.NORMALIZING);
        AnalysisResult result = normalize(text, includeRatings);

        state = advance(state, AnalysisState.COMMITTING);
        rateAccountant.commit(decision);

        state = advance(state, AnalysisState.CLEANUP);
        deleteQuietly(uploadedFile);

        advance(state, AnalysisState.DONE);
        return AnalysisResponse.from(result, model, completion.usageMetadata());

      } catch (RuntimeException e) {
        advance(state, AnalysisState.ERRORED);
        rateAccountant.release(decision);
        if (uploadedFile != null) {
          deleteQuietly(uploadedFile);
        }
        if (e instanceof PollingCancelledException || Thread.currentThread().isInterrupted()) {
          throw new AnalysisCancelledException("Analysis cancelled", e);
        }
        throw e;
      }
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  /**
   * Delete the upload of an analysis that was cancelled before it started.
   *
   * <p>No quota was reserved for such a request, so only the delete runs. It is skipped when the
   * caller is not authenticated or the handle is not a well-formed file name.
   */
  public void discardUpload(String authorizationHeader, MediaAnalysisRequest request) {
    if (request == null
        || request.geminiFileName() == null
        || !FILE_NAME.matcher(request.geminiFileName()).matches()) {
      return;
    }
    AuthenticatedUser user;
    try {
      user = sessionVerifier.verify(authorizationHeader);
    } catch (UnauthenticatedException e) {
      LOGGER.debug("Skipping cleanup of cancelled analysis: {}", e.getMessage());
      return;
    }
    StructuredLogger.setRequestContext(UUID.randomUUID().toString(), user.userId());
    try {
      advance(AnalysisState.ERRORED, AnalysisState.CLEANUP);
      deleteQuietly(request.geminiFileName());
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  /**
   * Current media quota usage for the caller. Never reserves anything.
   *
   * @throws com.scholary.coach.auth.UnauthenticatedException if the credential is rejected
   */
  public RateLimitStatusResponse mediaRateLimitStatus(String authorizationHeader) {
    AuthenticatedUser user = sessionVerifier.verify(authorizationHeader);
    return RateLimitStatusResponse.from(
        rateAccountant.status(
            user,
            ResourceClass.MEDIA_ANALYSIS,
            rateLimitProperties.limitFor(ResourceClass.MEDIA_ANALYSIS)));
  }

  private void validate(MediaAnalysisRequest request) {
    if (request == null) {
      throw new InvalidRequestException("Invalid JSON body");
    }
    if (request.geminiFileName() == null
        || request.geminiFileName().isBlank()
        || request.techniques() == null
        || request.techniques().isEmpty()) {
      throw new InvalidRequestException("Missing geminiFileName or techniques");
    }
    if (!FILE_NAME.matcher(request.geminiFileName()).matches()) {
      throw new InvalidRequestException("Invalid geminiFileName format");
    }
    if (request.techniques().size() > maxTechniques) {
      throw new InvalidRequestException("Too many techniques", maxTechniques);
    }

    Set<ConstraintViolation<MediaAnalysisRequest>> violations = validator.validate(request);
    if (!violations.isEmpty()) {
      ConstraintViolation<MediaAnalysisRequest> first = violations.iterator().next();
      throw new InvalidRequestException(
          "Invalid request: " + first.getPropertyPath() + " " + first.getMessage());
    }
  }

  private GeminiFile awaitReady(String fileName) {
    try {
      return readinessPoller.awaitReady(fileName);
    } catch (GeminiException e) {
      throw new ReadinessCheckFailedException(fileName, e);
    }
  }

  private String completionText(GenerateContentResponse completion) {
    if (!completion.hasCandidates()) {
      throw new EmptyCompletionException(
          "Generation returned no candidates", completion.blockReason());
    }
    return completion
        .firstCandidateText()
        .orElseThrow(() -> new EmptyCompletionException("Generation returned no text", null));
  }

  private AnalysisResult normalize(String text, boolean includeRatings) {
    try {
      return responseNormalizer.normalize(text, includeRatings);
    } catch (MalformedResponseException e) {
      structuredLogger.logNormalizeFailed(e.getTextLength(), e.getClass().getSimpleName());
      throw e;
    }
  }

  private void logGeneration(String model, GenerateContentResponse completion, long durationMs) {
    GenerateContentResponse.UsageMetadata usage = completion.usageMetadata();
    structuredLogger.logGenerationCompleted(
        model,
        usage == null ? null : usage.promptTokenCount(),
        usage == null ? null : usage.candidatesTokenCount(),
        durationMs);
  }

  /** Delete the upload, logging instead of throwing. Runs even on an interrupted thread. */
  private void deleteQuietly(String fileName) {
    boolean interrupted = Thread.interrupted();
    try {
      geminiClient.deleteFile(fileName);
    } catch (RuntimeException e) {
      structuredLogger.logCleanupFailed(fileName, e.getClass().getSimpleName(), e.getMessage());
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private AnalysisState advance(AnalysisState from, AnalysisState to) {
    structuredLogger.logStateTransition(from.name(), to.name());
    return to;
  }
}

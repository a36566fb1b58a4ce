package com.scholary.coach.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.coach.analysis.AnalysisResult;
import com.scholary.coach.analysis.TechniqueEvaluation;
import com.scholary.coach.gemini.GenerateContentResponse.UsageMetadata;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response for a completed video analysis.
 *
 * <p>Field names are snake_case on the wire.
 */
public record AnalysisResponse(
    @JsonProperty("overall_summary") String overallSummary,
    List<String> strengths,
    @JsonProperty("growth_areas") List<String> growthAreas,
    @JsonProperty("actionable_next_steps") List<String> actionableNextSteps,
    @JsonProperty("technique_evaluations") List<Evaluation> techniqueEvaluations,
    @JsonProperty("model_used") String modelUsed,
    Usage usage) {

  public static AnalysisResponse from(AnalysisResult result, String model, UsageMetadata usage) {
    List<Evaluation> evaluations =
        result.techniqueEvaluations().stream()
            .map(Evaluation::from)
            .collect(Collectors.toUnmodifiableList());
    return new AnalysisResponse(
        result.overallSummary(),
        result.strengths(),
        result.growthAreas(),
        result.actionableNextSteps(),
        evaluations,
        model,
        Usage.from(usage));
  }

  public record Evaluation(
      @JsonProperty("technique_id") String techniqueId,
      @JsonProperty("was_observed") boolean wasObserved,
      Integer rating,
      List<String> evidence,
      String feedback,
      List<String> suggestions) {

    static Evaluation from(TechniqueEvaluation evaluation) {
      return new Evaluation(
          evaluation.techniqueId(),
          evaluation.wasObserved(),
          evaluation.rating(),
          evaluation.evidence(),
          evaluation.feedback(),
          evaluation.suggestions());
    }
  }

  /** Token counts as reported by the backend; either may be null. */
  public record Usage(
      @JsonProperty("input_tokens") Integer inputTokens,
      @JsonProperty("output_tokens") Integer outputTokens) {

    static Usage from(UsageMetadata metadata) {
      if (metadata == null) {
        return new Usage(null, null);
      }
      return new Usage(metadata.promptTokenCount(), metadata.candidatesTokenCount());
    }
  }
}

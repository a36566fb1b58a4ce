package com.scholary.coach.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * The JSON shape the prompt asks the model to produce (camelCase keys).
 *
 * <p>Every field is optional at this level; {@link ResponseNormalizer} fills in defaults. The
 * observed flag and the rating stay raw so a mistyped value only loses that field.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record ModelAnalysisPayload(
    String overallSummary,
    List<String> strengths,
    List<String> growthAreas,
    List<String> actionableNextSteps,
    List<Evaluation> techniqueEvaluations) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Evaluation(
      String techniqueId,
      JsonNode wasObserved,
      JsonNode rating,
      List<String> evidence,
      String feedback,
      List<String> suggestions) {}
}

package com.scholary.coach.gemini;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Optional;

/**
 * Response body from {@code generateContent}.
 *
 * <p>Only the first candidate is ever used. Token counts are passed through to the caller for
 * observability.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GenerateContentResponse(
    List<Candidate> candidates, UsageMetadata usageMetadata, PromptFeedback promptFeedback) {

  /** Text of the first part of the first candidate, if there is any. */
  public Optional<String> firstCandidateText() {
    if (candidates == null || candidates.isEmpty()) {
      return Optional.empty();
    }
    Candidate first = candidates.get(0);
    if (first == null || first.content() == null || first.content().parts() == null) {
      return Optional.empty();
    }
    return first.content().parts().stream()
        .findFirst()
        .map(Part::text)
        .filter(text -> !text.isEmpty());
  }

  public boolean hasCandidates() {
    return candidates != null && !candidates.isEmpty();
  }

  /** Block reason reported when safety filters rejected the prompt, or null. */
  public String blockReason() {
    return promptFeedback == null ? null : promptFeedback.blockReason();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Candidate(CandidateContent content, String finishReason) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record CandidateContent(List<Part> parts, String role) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Part(String text) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record UsageMetadata(
      Integer promptTokenCount, Integer candidatesTokenCount, Integer totalTokenCount) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record PromptFeedback(String blockReason) {}
}

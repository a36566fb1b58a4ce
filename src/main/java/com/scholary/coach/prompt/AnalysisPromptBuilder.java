package com.scholary.coach.prompt;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.springframework.stereotype.Component;

/**
 * Assembles analysis prompts from a technique catalog.
 *
 * <p>Layout of both prompt variants:
 *
 * <pre>
 * system preamble
 * [transcript + pause data]       (text only)
 * techniques header + techniques
 * response schema (with or without rating)
 * [rating scale]                  (ratings only)
 * guidelines
 * </pre>
 *
 * <p>Pure and stateless.
 */
@Component
public class AnalysisPromptBuilder {

  /** Technique id that triggers the pause-data section in text prompts. */
  public static final String WAIT_TIME_TECHNIQUE_ID = "wait-time";

  /** Build the prompt sent alongside an uploaded video. */
  public String buildVideoPrompt(List<TechniqueDefinition> techniques, boolean includeRatings) {
    StringBuilder prompt = new StringBuilder(PromptTemplates.VIDEO_SYSTEM);
    prompt.append(PromptTemplates.VIDEO_TECHNIQUES_HEADER);
    prompt.append(formatTechniques(techniques));
    appendResponseContract(prompt, PromptTemplates.GUIDELINES_VIDEO, includeRatings);
    return prompt.toString();
  }

  /**
   * Build the prompt for a plain transcript.
   *
   * <p>Pause data is only included when the wait-time technique is among those requested.
   */
  public String buildTextPrompt(
      String transcript,
      List<TechniqueDefinition> techniques,
      boolean includeRatings,
      PauseData pauseData) {
    StringBuilder prompt = new StringBuilder(PromptTemplates.TEXT_SYSTEM);
    prompt.append(fill(PromptTemplates.TEXT_TRANSCRIPT_SECTION, Map.of("transcript", transcript)));

    boolean waitTimeRequested =
        techniques.stream().anyMatch(t -> WAIT_TIME_TECHNIQUE_ID.equals(t.id()));
    if (pauseData != null && pauseData.summary() != null && waitTimeRequested) {
      prompt.append(formatPauseData(pauseData));
    }

    prompt.append(PromptTemplates.TEXT_TECHNIQUES_HEADER);
    prompt.append(formatTechniques(techniques));
    appendResponseContract(prompt, PromptTemplates.GUIDELINES_TEXT, includeRatings);
    return prompt.toString();
  }

  /** Render the technique catalog section. */
  public String formatTechniques(List<TechniqueDefinition> techniques) {
    return techniques.stream().map(this::formatTechnique).collect(Collectors.joining("\n"));
  }

  private String formatTechnique(TechniqueDefinition technique) {
    StringBuilder sb = new StringBuilder();
    sb.append("\n### ").append(technique.name()).append('\n');
    sb.append("**ID:** ").append(technique.id()).append('\n');
    sb.append("**Description:** ").append(technique.description()).append('\n');
    sb.append("\n**Look-fors (observable indicators):**\n");
    sb.append(
        technique.lookFors().stream().map(lf -> "- " + lf).collect(Collectors.joining("\n")));
    sb.append("\n\n**Exemplar phrases:**\n");
    sb.append(
        technique.exemplarPhrases().stream()
            .map(p -> "- \"" + p + "\"")
            .collect(Collectors.joining("\n")));
    sb.append('\n');
    return sb.toString();
  }

  private void appendResponseContract(
      StringBuilder prompt, String guidelines, boolean includeRatings) {
    prompt.append(
        includeRatings
            ? PromptTemplates.RESPONSE_SCHEMA_WITH_RATINGS
            : PromptTemplates.RESPONSE_SCHEMA_WITHOUT_RATINGS);
    if (includeRatings) {
      prompt.append(PromptTemplates.RATING_SCALE);
    }
    String ratingGuideline =
        includeRatings
            ? PromptTemplates.RATING_GUIDELINE_WITH
            : PromptTemplates.RATING_GUIDELINE_WITHOUT;
    prompt.append(fill(guidelines, Map.of("ratingGuideline", ratingGuideline)));
  }

  private String formatPauseData(PauseData pauseData) {
    List<PauseData.Pause> pauses = pauseData.pauses();
    String details =
        IntStream.range(0, pauses.size())
            .mapToObj(
                i ->
                    String.format(
                        Locale.ROOT,
                        "%d. %.1fs pause after \"%s\" → before \"%s\"",
                        i + 1,
                        pauses.get(i).duration(),
                        pauses.get(i).precedingText(),
                        pauses.get(i).followingText()))
            .collect(Collectors.joining("\n"));

    PauseData.Summary summary = pauseData.summary();
    return fill(
        PromptTemplates.TEXT_PAUSE_SECTION,
        Map.of(
            "pauseCount", String.valueOf(summary.count()),
            "pauseAvgDuration", oneDecimal(summary.averageDuration()),
            "pauseMaxDuration", oneDecimal(summary.maxDuration()),
            "pauseTotalTime", oneDecimal(summary.totalPauseTime()),
            "pauseDetails", details));
  }

  private static String oneDecimal(double value) {
    return String.format(Locale.ROOT, "%.1f", value);
  }

  private static String fill(String template, Map<String, String> vars) {
    String result = template;
    for (Map.Entry<String, String> var : vars.entrySet()) {
      result = result.replace("{{" + var.getKey() + "}}", var.getValue());
    }
    return result;
  }
}

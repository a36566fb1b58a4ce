package com.scholary.coach.analysis;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns free-form model text into an {@link AnalysisResult}.
 *
 * <p>Models often wrap the JSON in a markdown fence and add prose around it. If a {@code ```json}
 * fence is present only its interior is decoded, otherwise the whole text is. Missing fields get
 * defaults and unreadable ratings or observed flags are treated as absent; only text that does not
 * decode into the expected object at all is rejected.
 */
@Component
public class ResponseNormalizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResponseNormalizer.class);

  private static final Pattern JSON_FENCE =
      Pattern.compile("```(?i:json)\\s*([\\s\\S]*?)\\s*```");

  private static final Pattern RATING_TEXT = Pattern.compile("\\s*(\\d{1,2})\\s*");

  private static final int MIN_RATING = 1;
  private static final int MAX_RATING = 5;

  private final ObjectReader payloadReader;

  public ResponseNormalizer(ObjectMapper objectMapper) {
    this.payloadReader =
        objectMapper
            .readerFor(ModelAnalysisPayload.class)
            .with(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
            .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  /**
   * Normalize raw model output.
   *
   * @param rawText the first candidate's text
   * @param includeRatings whether ratings were requested; if not, any ratings are dropped
   * @return the normalized result
   * @throws MalformedResponseException if the text does not decode into an analysis object
   */
  public AnalysisResult normalize(String rawText, boolean includeRatings) {
    int length = rawText == null ? 0 : rawText.length();
    String candidate = extractJson(rawText == null ? "" : rawText);

    ModelAnalysisPayload payload;
    try {
      payload = payloadReader.readValue(candidate);
    } catch (IOException e) {
      throw new MalformedResponseException("Model output is not a valid analysis", length, e);
    }
    if (payload == null) {
      throw new MalformedResponseException("Model output is empty", length, null);
    }

    List<TechniqueEvaluation> evaluations =
        nullSafe(payload.techniqueEvaluations()).stream()
            .filter(Objects::nonNull)
            .filter(e -> e.techniqueId() != null && !e.techniqueId().isBlank())
            .map(e -> toEvaluation(e, includeRatings))
            .collect(Collectors.toUnmodifiableList());

    int dropped = nullSafe(payload.techniqueEvaluations()).size() - evaluations.size();
    if (dropped > 0) {
      LOGGER.warn("Dropped {} technique evaluations without a technique id", dropped);
    }

    return new AnalysisResult(
        payload.overallSummary() == null ? "" : payload.overallSummary(),
        strings(payload.strengths()),
        strings(payload.growthAreas()),
        strings(payload.actionableNextSteps()),
        evaluations);
  }

  /** Interior of the first {@code ```json} fence, or the trimmed text if there is none. */
  static String extractJson(String text) {
    Matcher matcher = JSON_FENCE.matcher(text);
    if (matcher.find()) {
      return matcher.group(1);
    }
    return text.trim();
  }

  private static TechniqueEvaluation toEvaluation(
      ModelAnalysisPayload.Evaluation evaluation, boolean includeRatings) {
    Integer rating = includeRatings ? ratingOf(evaluation.rating()) : null;
    if (rating != null && (rating < MIN_RATING || rating > MAX_RATING)) {
      LOGGER.debug(
          "Discarding out-of-range rating: techniqueId={}, rating={}",
          evaluation.techniqueId(),
          rating);
      rating = null;
    }
    return new TechniqueEvaluation(
        evaluation.techniqueId(),
        observed(evaluation.wasObserved()),
        rating,
        strings(evaluation.evidence()),
        evaluation.feedback() == null ? "" : evaluation.feedback(),
        strings(evaluation.suggestions()));
  }

  /** Whole-number rating from a number or numeric text; anything else counts as no rating. */
  static Integer ratingOf(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isIntegralNumber()) {
      return node.canConvertToInt() ? node.intValue() : null;
    }
    if (node.isFloatingPointNumber()) {
      double value = node.doubleValue();
      return value == Math.rint(value) && Math.abs(value) <= MAX_RATING ? (int) value : null;
    }
    if (node.isTextual()) {
      Matcher matcher = RATING_TEXT.matcher(node.textValue());
      return matcher.matches() ? Integer.valueOf(matcher.group(1)) : null;
    }
    return null;
  }

  /** {@code true}, or the text "true" / "yes" in any case. Everything else is not observed. */
  static boolean observed(JsonNode node) {
    if (node == null) {
      return false;
    }
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    if (node.isTextual()) {
      String text = node.textValue().trim();
      return "true".equalsIgnoreCase(text) || "yes".equalsIgnoreCase(text);
    }
    return false;
  }

  private static List<String> strings(List<String> values) {
    return nullSafe(values).stream()
        .filter(Objects::nonNull)
        .collect(Collectors.toUnmodifiableList());
  }

  private static <T> List<T> nullSafe(List<T> values) {
    return values == null ? List.of() : values;
  }
}

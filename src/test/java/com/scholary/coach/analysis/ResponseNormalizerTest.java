package com.scholary.coach.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class ResponseNormalizerTest {

  private static final String PAYLOAD =
      "{\"overallSummary\":\"Strong questioning.\","
          + "\"strengths\":[\"clear goals\"],"
          + "\"growthAreas\":[\"wait time\"],"
          + "\"actionableNextSteps\":[\"pause 3s\"],"
          + "\"techniqueEvaluations\":[{\"techniqueId\":\"cold-call\",\"wasObserved\":true,"
          + "\"rating\":4,\"evidence\":[\"Maria, what do you think?\"],"
          + "\"feedback\":\"Good spread.\",\"suggestions\":[\"include back row\"]}]}";

  private final ResponseNormalizer normalizer = new ResponseNormalizer(new ObjectMapper());

  @Test
  void normalize_shouldDecodeUnfencedJson() {
    AnalysisResult result = normalizer.normalize(PAYLOAD, true);

    assertThat(result.overallSummary()).isEqualTo("Strong questioning.");
    assertThat(result.strengths()).containsExactly("clear goals");
    assertThat(result.techniqueEvaluations()).hasSize(1);
    TechniqueEvaluation evaluation = result.techniqueEvaluations().get(0);
    assertThat(evaluation.techniqueId()).isEqualTo("cold-call");
    assertThat(evaluation.wasObserved()).isTrue();
    assertThat(evaluation.rating()).isEqualTo(4);
    assertThat(evaluation.suggestions()).containsExactly("include back row");
  }

  @Test
  void normalize_shouldIgnoreProseAroundFence() {
    String fenced = "Here is my analysis:\n```json\n" + PAYLOAD + "\n```\nHope this helps!";

    assertThat(normalizer.normalize(fenced, true)).isEqualTo(normalizer.normalize(PAYLOAD, true));
  }

  @Test
  void normalize_shouldAcceptUppercaseFenceTag() {
    String fenced = "```JSON\n" + PAYLOAD + "\n```";

    assertThat(normalizer.normalize(fenced, true).overallSummary())
        .isEqualTo("Strong questioning.");
  }

  @Test
  void normalize_shouldDefaultMissingFields() {
    AnalysisResult result =
        normalizer.normalize("{\"techniqueEvaluations\":[{\"techniqueId\":\"x\"}]}", true);

    assertThat(result.overallSummary()).isEmpty();
    assertThat(result.strengths()).isEmpty();
    assertThat(result.growthAreas()).isEmpty();
    assertThat(result.actionableNextSteps()).isEmpty();
    TechniqueEvaluation evaluation = result.techniqueEvaluations().get(0);
    assertThat(evaluation.wasObserved()).isFalse();
    assertThat(evaluation.rating()).isNull();
    assertThat(evaluation.evidence()).isEmpty();
    assertThat(evaluation.feedback()).isEmpty();
    assertThat(evaluation.suggestions()).isEmpty();
  }

  @Test
  void normalize_shouldDecodeEmptyObject() {
    AnalysisResult result = normalizer.normalize("{}", false);

    assertThat(result.overallSummary()).isEmpty();
    assertThat(result.techniqueEvaluations()).isEmpty();
  }

  @Test
  void normalize_shouldDiscardOutOfRangeRatings() {
    String json =
        "{\"techniqueEvaluations\":["
            + "{\"techniqueId\":\"a\",\"wasObserved\":true,\"rating\":0},"
            + "{\"techniqueId\":\"b\",\"wasObserved\":true,\"rating\":6},"
            + "{\"techniqueId\":\"c\",\"wasObserved\":true,\"rating\":5}]}";

    AnalysisResult result = normalizer.normalize(json, true);

    assertThat(result.techniqueEvaluations())
        .extracting(TechniqueEvaluation::rating)
        .containsExactly(null, null, 5);
  }

  @Test
  void normalize_shouldKeepAnalysisWhenRatingOrObservedFlagIsMistyped() {
    String json =
        "{\"overallSummary\":\"Kept.\",\"techniqueEvaluations\":["
            + "{\"techniqueId\":\"a\",\"wasObserved\":\"yes\",\"rating\":\"N/A\"},"
            + "{\"techniqueId\":\"b\",\"wasObserved\":\"maybe\",\"rating\":\"3\"},"
            + "{\"techniqueId\":\"c\",\"wasObserved\":\"TRUE\",\"rating\":4.0},"
            + "{\"techniqueId\":\"d\",\"wasObserved\":null,\"rating\":{\"score\":2}},"
            + "{\"techniqueId\":\"e\",\"wasObserved\":false,\"rating\":2.5}]}";

    AnalysisResult result = normalizer.normalize(json, true);

    assertThat(result.overallSummary()).isEqualTo("Kept.");
    assertThat(result.techniqueEvaluations())
        .extracting(TechniqueEvaluation::rating)
        .containsExactly(null, 3, 4, null, null);
    assertThat(result.techniqueEvaluations())
        .extracting(TechniqueEvaluation::wasObserved)
        .containsExactly(true, false, true, false, false);
  }

  @Test
  void normalize_shouldDropRatingsWhenNotRequested() {
    AnalysisResult result = normalizer.normalize(PAYLOAD, false);

    assertThat(result.techniqueEvaluations().get(0).rating()).isNull();
    assertThat(result.techniqueEvaluations().get(0).wasObserved()).isTrue();
  }

  @Test
  void normalize_shouldDropEvaluationsWithoutTechniqueId() {
    String json =
        "{\"techniqueEvaluations\":[{\"wasObserved\":true},{\"techniqueId\":\"  \"},"
            + "null,{\"techniqueId\":\"kept\"}]}";

    assertThat(normalizer.normalize(json, true).techniqueEvaluations())
        .extracting(TechniqueEvaluation::techniqueId)
        .containsExactly("kept");
  }

  @Test
  void normalize_shouldAcceptSingleStringWhereListExpected() {
    AnalysisResult result = normalizer.normalize("{\"strengths\":\"clear goals\"}", true);

    assertThat(result.strengths()).containsExactly("clear goals");
  }

  @Test
  void normalize_shouldRejectTextWithoutJson() {
    assertThatThrownBy(() -> normalizer.normalize("I cannot analyze this video.", true))
        .isInstanceOfSatisfying(
            MalformedResponseException.class,
            e -> assertThat(e.getTextLength()).isEqualTo(28));
  }

  @Test
  void normalize_shouldRejectTruncatedJson() {
    assertThatThrownBy(() -> normalizer.normalize("```json\n{\"overallSummary\": \"cut", true))
        .isInstanceOf(MalformedResponseException.class);
  }

  @Test
  void normalize_shouldRejectWrongTopLevelShape() {
    assertThatThrownBy(() -> normalizer.normalize("[1, 2, 3]", true))
        .isInstanceOf(MalformedResponseException.class);
  }

  @Test
  void normalize_shouldNotLeakModelTextInException() {
    String secret = "private classroom remark";

    assertThatThrownBy(() -> normalizer.normalize(secret, true))
        .isInstanceOf(MalformedResponseException.class)
        .hasMessageNotContaining(secret);
  }

  @Test
  void extractJson_shouldReturnTrimmedTextWithoutFence() {
    assertThat(ResponseNormalizer.extractJson("  {\"a\":1}\n")).isEqualTo("{\"a\":1}");
    assertThat(ResponseNormalizer.extractJson("x ```json\n{\"a\":1}\n``` y")).isEqualTo("{\"a\":1}");
  }
}

package com.scholary.coach.prompt;

/**
 * Prompt text blocks.
 *
 * <p>The response schema, rating scale and rating guidelines are shared by the text and video
 * prompts. Only the system preamble, the technique-section header and the guideline bullets about
 * evidence differ between the two. Placeholders use {@code {{name}}}.
 */
final class PromptTemplates {

  private PromptTemplates() {}

  // Shared

  static final String RATING_SCALE =
      "\n## Rating Scale\n"
          + "1 - Developing: Technique not observed or needs significant development\n"
          + "2 - Emerging: Beginning to implement technique with inconsistent results\n"
          + "3 - Proficient: Solid implementation of technique with room for refinement\n"
          + "4 - Accomplished: Effective and consistent use of technique\n"
          + "5 - Exemplary: Masterful implementation that could serve as a model\n";

  static final String RESPONSE_SCHEMA_WITH_RATINGS =
      "\n## Response Format\n"
          + "Provide your analysis as a JSON object with the following structure:\n"
          + "{\n"
          + "    \"overallSummary\": \"2-3 sentence summary of the teaching session's"
          + " effectiveness\",\n"
          + "    \"strengths\": [\"strength 1\", \"strength 2\", \"strength 3\"],\n"
          + "    \"growthAreas\": [\"growth area 1\", \"growth area 2\"],\n"
          + "    \"actionableNextSteps\": [\"specific action 1\", \"specific action 2\","
          + " \"specific action 3\"],\n"
          + "    \"techniqueEvaluations\": [\n"
          + "        {\n"
          + "            \"techniqueId\": \"exact-id-from-technique-definition\",\n"
          + "            \"wasObserved\": true/false,\n"
          + "            \"rating\": 1-5 (null if not observed),\n"
          + "            \"evidence\": [\"specific quote or behavior from transcript\"],\n"
          + "            \"feedback\": \"Detailed feedback about technique usage\",\n"
          + "            \"suggestions\": [\"specific improvement suggestion\"]\n"
          + "        }\n"
          + "    ]\n"
          + "}\n";

  static final String RESPONSE_SCHEMA_WITHOUT_RATINGS =
      RESPONSE_SCHEMA_WITH_RATINGS.replace(
          "            \"rating\": 1-5 (null if not observed),\n", "");

  static final String GUIDELINES_TEXT =
      "\n## Guidelines\n"
          + "- IMPORTANT: Use the exact \"ID\" value shown for each technique as the"
          + " \"techniqueId\" in your response\n"
          + "- Be specific and cite evidence from the transcript\n"
          + "- Provide actionable, growth-oriented feedback\n"
          + "- Balance recognition of strengths with constructive suggestions\n"
          + "{{ratingGuideline}}\n"
          + "- Focus on patterns rather than isolated instances\n"
          + "\n"
          + "Respond ONLY with the JSON object, no additional text.";

  static final String GUIDELINES_VIDEO =
      "\n## Guidelines\n"
          + "- IMPORTANT: Use the exact \"ID\" value shown for each technique as the"
          + " \"techniqueId\" in your response\n"
          + "- Be specific and cite observable evidence from the video (actions, quotes,"
          + " interactions)\n"
          + "- Include timestamps when referencing specific moments if possible\n"
          + "- Consider both verbal and non-verbal teacher behaviors\n"
          + "- Provide actionable, growth-oriented feedback\n"
          + "- Balance recognition of strengths with constructive suggestions\n"
          + "{{ratingGuideline}}\n"
          + "- Focus on patterns rather than isolated instances\n"
          + "\n"
          + "Respond ONLY with the JSON object, no additional text.";

  static final String RATING_GUIDELINE_WITH =
      "- If a technique was not observed, set wasObserved to false and rating to null";

  static final String RATING_GUIDELINE_WITHOUT =
      "- If a technique was not observed, set wasObserved to false";

  // Text

  static final String TEXT_SYSTEM =
      "You are an expert instructional coach analyzing a teaching session transcript. Your task"
          + " is to evaluate the teacher's use of specific teaching techniques and provide"
          + " constructive feedback.";

  static final String TEXT_TRANSCRIPT_SECTION =
      "\n## Teaching Session Transcript\n```\n{{transcript}}\n```\n";

  static final String TEXT_PAUSE_SECTION =
      "\n## Wait Time Data (Detected Pauses >= 3 seconds)\n"
          + "This data shows pauses detected in the recording that may indicate wait time after"
          + " questions.\n"
          + "\n"
          + "**Summary:**\n"
          + "- Total pauses: {{pauseCount}}\n"
          + "- Average duration: {{pauseAvgDuration}}s\n"
          + "- Longest pause: {{pauseMaxDuration}}s\n"
          + "- Total pause time: {{pauseTotalTime}}s\n"
          + "\n"
          + "**Pause Details:**\n"
          + "{{pauseDetails}}\n"
          + "\n"
          + "Use this quantitative data to provide specific feedback on wait time usage. Consider"
          + " whether pauses occur after questions and if the duration is adequate (research"
          + " suggests 3+ seconds is optimal).\n";

  static final String TEXT_TECHNIQUES_HEADER =
      "\n## Techniques to Evaluate\n"
          + "Analyze the transcript for evidence of the following teaching techniques:\n";

  // Video

  static final String VIDEO_SYSTEM =
      "You are an expert instructional coach analyzing a teaching session video. Your task is to"
          + " evaluate the teacher's use of specific teaching techniques and provide constructive"
          + " feedback.\n"
          + "\n"
          + "Watch the entire video carefully, paying attention to:\n"
          + "- Teacher verbal communication and questioning techniques\n"
          + "- Teacher non-verbal communication (body language, positioning, gestures)\n"
          + "- Student engagement and responses\n"
          + "- Classroom management and pacing\n"
          + "- Use of instructional materials and technology";

  static final String VIDEO_TECHNIQUES_HEADER =
      "\n## Techniques to Evaluate\n"
          + "Analyze the video for evidence of the following teaching techniques:\n";
}

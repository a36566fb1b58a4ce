package com.scholary.coach.analysis;

import java.util.List;

/**
 * Normalized analysis of one teaching session.
 *
 * <p>All lists are non-null and immutable; the summary is never null but may be empty.
 */
public record AnalysisResult(
    String overallSummary,
    List<String> strengths,
    List<String> growthAreas,
    List<String> actionableNextSteps,
    List<TechniqueEvaluation> techniqueEvaluations) {}

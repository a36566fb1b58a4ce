package com.scholary.coach.analysis;

import java.util.List;

/**
 * The model's verdict on one requested technique.
 *
 * <p>{@code rating} is 1 to 5, or null when ratings were not requested or the technique was not
 * observed.
 */
public record TechniqueEvaluation(
    String techniqueId,
    boolean wasObserved,
    Integer rating,
    List<String> evidence,
    String feedback,
    List<String> suggestions) {}

package com.scholary.coach.prompt;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * A teaching technique the model evaluates evidence against.
 *
 * <p>The id is echoed back by the model as {@code techniqueId} and is the only correlation key
 * between the request and the evaluations, so it is rendered verbatim.
 */
public record TechniqueDefinition(
    @NotBlank String id,
    @NotBlank String name,
    String description,
    List<String> lookFors,
    List<String> exemplarPhrases) {

  public TechniqueDefinition {
    description = description == null ? "" : description;
    lookFors = lookFors == null ? List.of() : List.copyOf(lookFors);
    exemplarPhrases = exemplarPhrases == null ? List.of() : List.copyOf(exemplarPhrases);
  }
}

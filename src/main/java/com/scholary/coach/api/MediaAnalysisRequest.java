package com.scholary.coach.api;

import com.scholary.coach.prompt.TechniqueDefinition;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import java.util.List;

/**
 * Request to analyze an already uploaded teaching video.
 *
 * <p>{@code includeRatings} defaults to true when absent.
 */
public record MediaAnalysisRequest(
    @NotBlank @Pattern(regexp = MediaAnalysisRequest.FILE_NAME_PATTERN) String geminiFileName,
    @NotEmpty List<@Valid TechniqueDefinition> techniques,
    Boolean includeRatings) {

  public static final String FILE_NAME_PATTERN = "^files/[A-Za-z0-9_-]+$";

  public boolean ratingsRequested() {
    return includeRatings == null || includeRatings;
  }
}

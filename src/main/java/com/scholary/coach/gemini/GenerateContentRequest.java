package com.scholary.coach.gemini;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Request body for {@code models/{model}:generateContent}.
 *
 * <p>Media requests put the file reference before the prompt text in a single content entry.
 */
public record GenerateContentRequest(List<Content> contents, GenerationConfig generationConfig) {

  /** Prompt about an uploaded file. */
  public static GenerateContentRequest forFile(
      String mimeType, String fileUri, String prompt, double temperature, int maxOutputTokens) {
    return new GenerateContentRequest(
        List.of(
            new Content(
                List.of(Part.fileData(mimeType, fileUri), Part.text(prompt)), null)),
        new GenerationConfig(temperature, maxOutputTokens));
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Content(List<Part> parts, String role) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Part(String text, FileData fileData) {

    static Part text(String text) {
      return new Part(text, null);
    }

    static Part fileData(String mimeType, String fileUri) {
      return new Part(null, new FileData(mimeType, fileUri));
    }
  }

  public record FileData(String mimeType, String fileUri) {}

  public record GenerationConfig(double temperature, int maxOutputTokens) {}
}

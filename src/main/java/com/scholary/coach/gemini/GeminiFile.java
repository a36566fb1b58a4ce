package com.scholary.coach.gemini;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** File metadata returned by the Gemini Files API. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeminiFile(
    String name, String displayName, String mimeType, String sizeBytes, String uri, String state) {

  public FileState fileState() {
    return FileState.fromApiValue(state);
  }
}

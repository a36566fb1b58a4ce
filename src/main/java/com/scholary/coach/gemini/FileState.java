package com.scholary.coach.gemini;

/**
 * Server-side processing state of an uploaded file.
 *
 * <p>ACTIVE and FAILED are terminal. Values the API may add later are read as PROCESSING so the
 * caller keeps polling until its deadline.
 */
public enum FileState {
  PROCESSING,
  ACTIVE,
  FAILED;

  static FileState fromApiValue(String value) {
    if ("ACTIVE".equals(value)) {
      return ACTIVE;
    }
    if ("FAILED".equals(value)) {
      return FAILED;
    }
    return PROCESSING;
  }
}

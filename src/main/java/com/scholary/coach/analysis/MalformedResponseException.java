package com.scholary.coach.analysis;

/**
 * Exception thrown when model output cannot be decoded into an analysis.
 *
 * <p>Only the length of the offending text is kept, never the text itself.
 */
public class MalformedResponseException extends RuntimeException {

  private final int textLength;

  public MalformedResponseException(String message, int textLength, Throwable cause) {
    super(message, cause);
    this.textLength = textLength;
  }

  public int getTextLength() {
    return textLength;
  }
}

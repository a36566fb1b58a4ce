package com.scholary.coach.readiness;

import java.time.Duration;

/** Exception thrown when a file is still processing after the readiness deadline. */
public class ProcessingTimedOutException extends RuntimeException {

  public ProcessingTimedOutException(String fileName, Duration elapsed) {
    super(
        String.format(
            "File processing timed out after %ds: %s", elapsed.toSeconds(), fileName));
  }
}

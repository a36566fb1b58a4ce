package com.scholary.coach.readiness;

/**
 * Exception thrown when the thread running a readiness poll is interrupted.
 *
 * <p>The interrupt flag is restored before this is thrown.
 */
public class PollingCancelledException extends RuntimeException {

  public PollingCancelledException(String fileName, Throwable cause) {
    super("Readiness polling cancelled: " + fileName, cause);
  }
}

package com.scholary.coach.service;

/**
 * Exception thrown when the upload's processing state could not be determined.
 *
 * <p>Wraps the failed status query so that it is reported as a server error rather than as an
 * unusable generation response.
 */
public class ReadinessCheckFailedException extends RuntimeException {

  public ReadinessCheckFailedException(String fileName, Throwable cause) {
    super("Could not check processing state of " + fileName, cause);
  }
}

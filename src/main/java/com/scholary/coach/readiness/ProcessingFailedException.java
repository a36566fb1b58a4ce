package com.scholary.coach.readiness;

/** Exception thrown when the backend reports that it could not process an uploaded file. */
public class ProcessingFailedException extends RuntimeException {

  public ProcessingFailedException(String fileName) {
    super("File processing failed: " + fileName);
  }
}

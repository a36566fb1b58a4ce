package com.scholary.coach.service;

/** Exception thrown when an analysis is abandoned because its worker was interrupted. */
public class AnalysisCancelledException extends RuntimeException {

  public AnalysisCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}

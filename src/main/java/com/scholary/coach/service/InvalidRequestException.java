package com.scholary.coach.service;

/**
 * Exception thrown when an analysis request is rejected before any downstream call.
 *
 * <p>{@code maxTechniques} is set only when the request asked for too many techniques.
 */
public class InvalidRequestException extends RuntimeException {

  private final Integer maxTechniques;

  public InvalidRequestException(String message) {
    this(message, null);
  }

  public InvalidRequestException(String message, Integer maxTechniques) {
    super(message);
    this.maxTechniques = maxTechniques;
  }

  public Integer getMaxTechniques() {
    return maxTechniques;
  }
}

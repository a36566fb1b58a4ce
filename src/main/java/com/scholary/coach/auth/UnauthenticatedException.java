package com.scholary.coach.auth;

/**
 * Exception thrown when a request carries no usable session credential.
 *
 * <p>The message is safe to show to the caller; it never contains token material.
 */
public class UnauthenticatedException extends RuntimeException {

  public UnauthenticatedException(String message) {
    super(message);
  }

  public UnauthenticatedException(String message, Throwable cause) {
    super(message, cause);
  }
}

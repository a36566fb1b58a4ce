package com.scholary.coach.auth;

/** Exception thrown when a verified identity belongs to a domain outside the allow-list. */
public class DomainNotAllowedException extends RuntimeException {

  public DomainNotAllowedException(String message) {
    super(message);
  }
}

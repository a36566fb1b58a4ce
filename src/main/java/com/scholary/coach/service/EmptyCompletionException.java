package com.scholary.coach.service;

/**
 * Exception thrown when a generation call succeeds but yields no usable text.
 *
 * <p>That happens when safety filters block the prompt (no candidates) or when the first candidate
 * carries no text part.
 */
public class EmptyCompletionException extends RuntimeException {

  private final String blockReason;

  public EmptyCompletionException(String message, String blockReason) {
    super(message);
    this.blockReason = blockReason;
  }

  /** Block reason reported by the backend, or null. */
  public String getBlockReason() {
    return blockReason;
  }
}

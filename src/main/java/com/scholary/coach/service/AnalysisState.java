package com.scholary.coach.service;

/**
 * Stages of a single analysis request.
 *
 * <p>The happy path runs in declaration order up to {@link #DONE}; {@link #ERRORED} can follow any
 * stage.
 */
public enum AnalysisState {
  UNAUTHENTICATED,
  RATE_CHECKING,
  AWAITING_READINESS,
  GENERATING,
  NORMALIZING,
  COMMITTING,
  CLEANUP,
  DONE,
  ERRORED
}

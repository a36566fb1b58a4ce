package com.scholary.coach.readiness;

import com.scholary.coach.gemini.FileState;
import java.time.Duration;

/**
 * States of the readiness poll.
 *
 * <p>The initial state is whatever the first status query reports. PROCESSING is the only
 * non-terminal state; from it the poll either observes a new file state or runs out of time.
 */
public enum ReadinessState {
  PROCESSING,
  ACTIVE,
  FAILED,
  TIMED_OUT;

  public boolean isTerminal() {
    return this != PROCESSING;
  }

  /** State after a status query reported {@code observed}. */
  public static ReadinessState observed(FileState observed) {
    if (observed == FileState.ACTIVE) {
      return ACTIVE;
    }
    if (observed == FileState.FAILED) {
      return FAILED;
    }
    return PROCESSING;
  }

  /** State after waiting; PROCESSING becomes TIMED_OUT once {@code elapsed} exceeds the deadline. */
  public ReadinessState afterWait(Duration elapsed, Duration timeout) {
    if (this == PROCESSING && elapsed.compareTo(timeout) > 0) {
      return TIMED_OUT;
    }
    return this;
  }
}

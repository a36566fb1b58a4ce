package com.scholary.coach.prompt;

import java.util.List;

/**
 * Pauses detected on-device in a recording, used as wait-time evidence in text analysis.
 *
 * <p>Times are in seconds.
 */
public record PauseData(List<Pause> pauses, Summary summary) {

  public PauseData {
    pauses = pauses == null ? List.of() : List.copyOf(pauses);
  }

  public record Pause(
      double startTime,
      double endTime,
      double duration,
      String precedingText,
      String followingText) {}

  public record Summary(
      int count, double averageDuration, double maxDuration, double totalPauseTime) {}
}

package com.scholary.coach.readiness;

import com.scholary.coach.gemini.GeminiClient;
import com.scholary.coach.gemini.GeminiFile;
import com.scholary.coach.logging.StructuredLogger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Waits for an uploaded file to finish server-side processing.
 *
 * <p>Queries the file status, then while it is PROCESSING sleeps for the poll interval and queries
 * again. Once more than the timeout has passed since the first query the poll stops without
 * issuing another query.
 *
 * <p>Any failed status query is fatal for the whole poll; transient and permanent failures are not
 * told apart. Interrupting the polling thread cancels the poll.
 */
@Component
public class ReadinessPoller {

  private static final Logger LOGGER = LoggerFactory.getLogger(ReadinessPoller.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final GeminiClient geminiClient;
  private final Clock clock;
  private final Sleeper sleeper;
  private final Duration pollInterval;
  private final Duration timeout;

  @Autowired
  public ReadinessPoller(GeminiClient geminiClient, Clock clock, ReadinessProperties properties) {
    this(geminiClient, clock, Sleeper.THREAD_SLEEP, properties);
  }

  public ReadinessPoller(
      GeminiClient geminiClient, Clock clock, Sleeper sleeper, ReadinessProperties properties) {
    this.geminiClient = geminiClient;
    this.clock = clock;
    this.sleeper = sleeper;
    this.pollInterval = properties.pollInterval();
    this.timeout = properties.timeout();
  }

  /**
   * Block until the file is ACTIVE.
   *
   * @param fileName the file resource name
   * @return the ACTIVE file's metadata
   * @throws ProcessingFailedException if the backend reports FAILED
   * @throws ProcessingTimedOutException if the file is still processing after the timeout
   * @throws PollingCancelledException if the thread is interrupted while polling
   * @throws com.scholary.coach.gemini.GeminiException if a status query fails
   */
  public GeminiFile awaitReady(String fileName) {
    Instant start = clock.instant();
    int attempts = 0;

    while (true) {
      if (Thread.currentThread().isInterrupted()) {
        throw new PollingCancelledException(fileName, null);
      }

      GeminiFile file = geminiClient.getFile(fileName);
      attempts++;
      ReadinessState state = ReadinessState.observed(file.fileState());
      structuredLogger.logReadinessPoll(fileName, attempts, state.name(), elapsedMs(start));

      if (state.isTerminal()) {
        structuredLogger.logReadinessResolved(fileName, state.name(), attempts, elapsedMs(start));
        if (state == ReadinessState.FAILED) {
          throw new ProcessingFailedException(fileName);
        }
        return file;
      }

      try {
        sleeper.sleep(pollInterval);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new PollingCancelledException(fileName, e);
      }

      Duration elapsed = Duration.between(start, clock.instant());
      state = state.afterWait(elapsed, timeout);
      if (state == ReadinessState.TIMED_OUT) {
        structuredLogger.logReadinessResolved(fileName, state.name(), attempts, elapsed.toMillis());
        throw new ProcessingTimedOutException(fileName, elapsed);
      }
    }
  }

  private long elapsedMs(Instant start) {
    return Duration.between(start, clock.instant()).toMillis();
  }
}

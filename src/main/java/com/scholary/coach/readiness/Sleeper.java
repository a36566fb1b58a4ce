package com.scholary.coach.readiness;

import java.time.Duration;

/** Blocks the current thread between polls. Interruption ends the wait early. */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}

package com.scholary.coach.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * UTC wall-clock hour buckets.
 *
 * <p>Quotas reset on the hour boundary, not on a rolling window from first use, so a caller can
 * burst across the boundary.
 */
public final class HourBucket {

  static final long SECONDS_PER_HOUR = 3600;

  private static final DateTimeFormatter BUCKET_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH").withZone(ZoneOffset.UTC);

  private HourBucket() {}

  /** Bucket id for the hour containing {@code now}, e.g. {@code 2024-05-01T14}. */
  public static String bucketId(Instant now) {
    return BUCKET_FORMAT.format(now);
  }

  /** Whole seconds until the next hour boundary, always in [0, 3600). */
  public static long secondsUntilNextHour(Instant now) {
    Instant nextHour = now.truncatedTo(ChronoUnit.HOURS).plus(1, ChronoUnit.HOURS);
    long seconds = Duration.between(now, nextHour).toSeconds();
    return Math.min(seconds, SECONDS_PER_HOUR - 1);
  }

  /** Counter key for a user, resource and bucket. */
  public static String counterKey(ResourceClass resourceClass, String userId, Instant now) {
    return String.format("rate:%s:%s:%s", resourceClass.keySegment(), userId, bucketId(now));
  }
}

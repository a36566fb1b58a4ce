package com.scholary.coach.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class HourBucketTest {

  @Test
  void bucketId_shouldUseUtcHour() {
    assertThat(HourBucket.bucketId(Instant.parse("2024-05-01T14:59:59Z")))
        .isEqualTo("2024-05-01T14");
  }

  @Test
  void counterKey_shouldCombineResourceUserAndBucket() {
    assertThat(
            HourBucket.counterKey(
                ResourceClass.MEDIA_ANALYSIS, "user-1", Instant.parse("2024-05-01T09:10:00Z")))
        .isEqualTo("rate:video:user-1:2024-05-01T09");
    assertThat(
            HourBucket.counterKey(
                ResourceClass.TEXT_ANALYSIS, "user-1", Instant.parse("2024-05-01T09:10:00Z")))
        .isEqualTo("rate:text:user-1:2024-05-01T09");
  }

  @Test
  void secondsUntilNextHour_shouldCountDownToBoundary() {
    assertThat(HourBucket.secondsUntilNextHour(Instant.parse("2024-05-01T14:59:00Z")))
        .isEqualTo(60);
    assertThat(HourBucket.secondsUntilNextHour(Instant.parse("2024-05-01T14:59:59.500Z")))
        .isEqualTo(0);
  }

  @Test
  void secondsUntilNextHour_shouldStayBelowOneHourOnBoundary() {
    long seconds = HourBucket.secondsUntilNextHour(Instant.parse("2024-05-01T15:00:00Z"));
    assertThat(seconds).isBetween(0L, 3599L);
  }
}

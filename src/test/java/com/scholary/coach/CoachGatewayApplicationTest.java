package com.scholary.coach;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.coach.ratelimit.InMemoryRateCounterStore;
import com.scholary.coach.ratelimit.RateCounterStore;
import com.scholary.coach.service.MediaAnalysisOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

/** Boots the full context with the in-memory counter store. */
@SpringBootTest
class CoachGatewayApplicationTest {

  @Autowired private MediaAnalysisOrchestrator orchestrator;
  @Autowired private RateCounterStore rateCounterStore;

  @Test
  void contextLoads() {
    assertThat(orchestrator).isNotNull();
    assertThat(rateCounterStore).isInstanceOf(InMemoryRateCounterStore.class);
  }
}

package com.scholary.coach.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Health")
public class HealthController {

  private final String name;
  private final String version;

  public HealthController(
      @Value("${spring.application.name}") String name,
      @Value("${coach.version:dev}") String version) {
    this.name = name;
    this.version = version;
  }

  @GetMapping("/")
  @Operation(summary = "Liveness check")
  public HealthResponse health() {
    return new HealthResponse(name, version, "ok");
  }
}

package com.scholary.coach.auth;

import com.scholary.coach.config.AuthConfig;
import java.time.Clock;
import java.time.Duration;
import org.springframework.security.oauth2.jwt.JwtDecoder;

/** Real HS256 codecs wired the way the application wires them. */
final class AuthFixtures {

  static final AuthProperties PROPERTIES =
      new AuthProperties(
          "test-secret-that-is-at-least-32-bytes-long",
          "psd401.net",
          "test-client-id",
          "http://localhost:0/certs",
          Duration.ofDays(7),
          Duration.ofDays(30));

  private static final AuthConfig CONFIG = new AuthConfig();

  private AuthFixtures() {}

  static JwtDecoder sessionDecoder() {
    return CONFIG.sessionJwtDecoder(PROPERTIES);
  }

  static SessionTokenIssuer issuer(Clock clock) {
    return new SessionTokenIssuer(CONFIG.sessionJwtEncoder(PROPERTIES), clock, PROPERTIES);
  }
}

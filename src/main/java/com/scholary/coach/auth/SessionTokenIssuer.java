package com.scholary.coach.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.stereotype.Component;

/**
 * Issues HS256 access and refresh tokens for verified users.
 *
 * <p>Both token kinds carry the user id as subject and the email claim; the {@code token_use}
 * claim tells them apart.
 */
@Component
public class SessionTokenIssuer {

  static final String TOKEN_USE = "token_use";
  static final String ACCESS_TOKEN = "access";
  static final String REFRESH_TOKEN = "refresh";
  static final String EMAIL = "email";
  static final String NAME = "name";

  private final JwtEncoder sessionJwtEncoder;
  private final Clock clock;
  private final Duration accessTokenTtl;
  private final Duration refreshTokenTtl;

  public SessionTokenIssuer(
      @Qualifier("sessionJwtEncoder") JwtEncoder sessionJwtEncoder,
      Clock clock,
      AuthProperties properties) {
    this.sessionJwtEncoder = sessionJwtEncoder;
    this.clock = clock;
    this.accessTokenTtl = properties.accessTokenTtl();
    this.refreshTokenTtl = properties.refreshTokenTtl();
  }

  /** Issue a fresh access/refresh pair. */
  public SessionTokens issue(String userId, String email, String displayName) {
    String accessToken = encode(userId, email, displayName, ACCESS_TOKEN, accessTokenTtl);
    String refreshToken = encode(userId, email, displayName, REFRESH_TOKEN, refreshTokenTtl);
    return new SessionTokens(accessToken, refreshToken, accessTokenTtl.toSeconds());
  }

  /** Issue a new access token only; the caller keeps its refresh token. */
  public String issueAccessToken(String userId, String email, String displayName) {
    return encode(userId, email, displayName, ACCESS_TOKEN, accessTokenTtl);
  }

  public Duration accessTokenTtl() {
    return accessTokenTtl;
  }

  private String encode(
      String userId, String email, String displayName, String tokenUse, Duration ttl) {
    Instant now = clock.instant();
    JwtClaimsSet.Builder claims =
        JwtClaimsSet.builder()
            .subject(userId)
            .issuedAt(now)
            .expiresAt(now.plus(ttl))
            .claim(TOKEN_USE, tokenUse)
            .claim(EMAIL, email);
    if (displayName != null) {
      claims.claim(NAME, displayName);
    }

    JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
    return sessionJwtEncoder
        .encode(JwtEncoderParameters.from(header, claims.build()))
        .getTokenValue();
  }

  /** Token pair returned to the client after a successful exchange. */
  public record SessionTokens(String accessToken, String refreshToken, long expiresInSeconds) {}
}

package com.scholary.coach.auth;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;

/**
 * Verifies HS256 session tokens issued by {@link SessionTokenIssuer}.
 *
 * <p>Signature and expiry are checked by the decoder. On top of that the token must be an access
 * token (refresh tokens are not accepted as credentials) and its email claim must belong to the
 * allowed domain.
 */
@Component
public class JwtSessionVerifier implements SessionVerifier {

  private static final Logger LOGGER = LoggerFactory.getLogger(JwtSessionVerifier.class);

  private static final String BEARER_PREFIX = "Bearer ";

  private final JwtDecoder sessionJwtDecoder;
  private final String allowedDomain;

  public JwtSessionVerifier(
      @Qualifier("sessionJwtDecoder") JwtDecoder sessionJwtDecoder, AuthProperties properties) {
    this.sessionJwtDecoder = sessionJwtDecoder;
    this.allowedDomain = properties.allowedDomain().toLowerCase(Locale.ROOT);
  }

  @Override
  public AuthenticatedUser verify(String authorizationHeader) {
    if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
      throw new UnauthenticatedException("Missing or invalid Authorization header");
    }

    String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
    if (token.isEmpty()) {
      throw new UnauthenticatedException("Missing or invalid Authorization header");
    }

    Jwt jwt;
    try {
      jwt = sessionJwtDecoder.decode(token);
    } catch (JwtException e) {
      LOGGER.debug("Session token rejected: {}", e.getMessage());
      throw new UnauthenticatedException("Invalid or expired token", e);
    }

    if (!SessionTokenIssuer.ACCESS_TOKEN.equals(jwt.getClaimAsString(SessionTokenIssuer.TOKEN_USE))) {
      throw new UnauthenticatedException("Invalid or expired token");
    }

    String userId = jwt.getSubject();
    if (userId == null || userId.isBlank()) {
      throw new UnauthenticatedException("Invalid or expired token");
    }

    String email = jwt.getClaimAsString(SessionTokenIssuer.EMAIL);
    if (!belongsToDomain(email, allowedDomain)) {
      LOGGER.warn("Session token rejected for domain: userId={}", userId);
      throw new UnauthenticatedException("Account domain is not allowed");
    }

    return new AuthenticatedUser(userId, email, jwt.getExpiresAt());
  }

  static boolean belongsToDomain(String email, String domain) {
    if (email == null) {
      return false;
    }
    int at = email.lastIndexOf('@');
    return at > 0 && email.substring(at + 1).toLowerCase(Locale.ROOT).equals(domain);
  }
}

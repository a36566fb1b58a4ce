package com.scholary.coach.auth;

import com.scholary.coach.auth.SessionTokenIssuer.SessionTokens;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Service;

/**
 * Exchanges identity-provider tokens for session tokens.
 *
 * <p>The hosted-domain check happens here, on the server, so a client cannot obtain a session for
 * an account outside the allowed domain even with a valid Google ID token.
 */
@Service
public class SessionTokenService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionTokenService.class);

  private final JwtDecoder googleIdTokenDecoder;
  private final JwtDecoder sessionJwtDecoder;
  private final SessionTokenIssuer issuer;
  private final String allowedDomain;

  public SessionTokenService(
      @Qualifier("googleIdTokenDecoder") JwtDecoder googleIdTokenDecoder,
      @Qualifier("sessionJwtDecoder") JwtDecoder sessionJwtDecoder,
      SessionTokenIssuer issuer,
      AuthProperties properties) {
    this.googleIdTokenDecoder = googleIdTokenDecoder;
    this.sessionJwtDecoder = sessionJwtDecoder;
    this.issuer = issuer;
    this.allowedDomain = properties.allowedDomain().toLowerCase(Locale.ROOT);
  }

  /**
   * Validate a Google ID token and issue a session.
   *
   * @param idToken the ID token obtained by the client from Google sign-in
   * @return the new session and the user it belongs to
   * @throws UnauthenticatedException if the ID token does not verify
   * @throws DomainNotAllowedException if the account is outside the allowed domain or unverified
   */
  public Exchange exchangeGoogleIdToken(String idToken) {
    Jwt jwt;
    try {
      jwt = googleIdTokenDecoder.decode(idToken);
    } catch (JwtException e) {
      LOGGER.warn("Google ID token verification failed: {}", e.getMessage());
      throw new UnauthenticatedException("Invalid token", e);
    }

    String email = jwt.getClaimAsString("email");
    String hostedDomain = jwt.getClaimAsString("hd");
    if (hostedDomain == null || !hostedDomain.toLowerCase(Locale.ROOT).equals(allowedDomain)) {
      LOGGER.warn("Domain rejection: userId={}, hd={}", jwt.getSubject(), hostedDomain);
      throw new DomainNotAllowedException("Only @" + allowedDomain + " accounts are allowed");
    }
    if (!Boolean.TRUE.equals(jwt.getClaimAsBoolean("email_verified"))) {
      throw new DomainNotAllowedException("Email not verified");
    }

    SessionUser user =
        new SessionUser(
            jwt.getSubject(), email, jwt.getClaimAsString("name"), jwt.getClaimAsString("picture"));
    SessionTokens tokens = issuer.issue(user.id(), user.email(), user.displayName());

    LOGGER.info("Issued session: userId={}", user.id());
    return new Exchange(tokens, user);
  }

  /**
   * Issue a new access token from a refresh token.
   *
   * @throws UnauthenticatedException if the refresh token is invalid, expired or not a refresh token
   */
  public SessionTokens refresh(String refreshToken) {
    Jwt jwt;
    try {
      jwt = sessionJwtDecoder.decode(refreshToken);
    } catch (JwtException e) {
      throw new UnauthenticatedException("Invalid or expired refresh token", e);
    }
    if (!SessionTokenIssuer.REFRESH_TOKEN.equals(
        jwt.getClaimAsString(SessionTokenIssuer.TOKEN_USE))) {
      throw new UnauthenticatedException("Invalid or expired refresh token");
    }

    String accessToken =
        issuer.issueAccessToken(
            jwt.getSubject(),
            jwt.getClaimAsString(SessionTokenIssuer.EMAIL),
            jwt.getClaimAsString(SessionTokenIssuer.NAME));

    LOGGER.info("Refreshed session: userId={}", jwt.getSubject());
    return new SessionTokens(accessToken, refreshToken, issuer.accessTokenTtl().toSeconds());
  }

  /** User details returned alongside a freshly issued session. */
  public record SessionUser(String id, String email, String displayName, String photoUrl) {}

  /** Result of a successful identity exchange. */
  public record Exchange(SessionTokens tokens, SessionUser user) {}
}

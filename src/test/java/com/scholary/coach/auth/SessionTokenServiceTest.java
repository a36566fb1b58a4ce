package com.scholary.coach.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.scholary.coach.auth.SessionTokenIssuer.SessionTokens;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;

@ExtendWith(MockitoExtension.class)
class SessionTokenServiceTest {

  @Mock private JwtDecoder googleIdTokenDecoder;

  private SessionTokenIssuer issuer;
  private SessionTokenService service;
  private JwtSessionVerifier verifier;

  @BeforeEach
  void setUp() {
    issuer = AuthFixtures.issuer(Clock.systemUTC());
    service =
        new SessionTokenService(
            googleIdTokenDecoder, AuthFixtures.sessionDecoder(), issuer, AuthFixtures.PROPERTIES);
    verifier = new JwtSessionVerifier(AuthFixtures.sessionDecoder(), AuthFixtures.PROPERTIES);
  }

  @Test
  void exchangeGoogleIdToken_shouldIssueUsableSession() {
    when(googleIdTokenDecoder.decode("id-token"))
        .thenReturn(
            googleToken(
                Map.of(
                    "sub", "google-123",
                    "email", "teacher@psd401.net",
                    "hd", "psd401.net",
                    "email_verified", true,
                    "name", "A Teacher",
                    "picture", "https://example.com/p.png")));

    SessionTokenService.Exchange exchange = service.exchangeGoogleIdToken("id-token");

    assertThat(exchange.user().id()).isEqualTo("google-123");
    assertThat(exchange.user().displayName()).isEqualTo("A Teacher");
    assertThat(exchange.user().photoUrl()).isEqualTo("https://example.com/p.png");
    assertThat(exchange.tokens().expiresInSeconds()).isEqualTo(7 * 24 * 3600);
    assertThat(verifier.verify("Bearer " + exchange.tokens().accessToken()).userId())
        .isEqualTo("google-123");
  }

  @Test
  void exchangeGoogleIdToken_shouldRejectOtherHostedDomain() {
    when(googleIdTokenDecoder.decode("id-token"))
        .thenReturn(
            googleToken(
                Map.of(
                    "sub", "google-123",
                    "email", "someone@other.org",
                    "hd", "other.org",
                    "email_verified", true)));

    assertThatThrownBy(() -> service.exchangeGoogleIdToken("id-token"))
        .isInstanceOf(DomainNotAllowedException.class);
  }

  @Test
  void exchangeGoogleIdToken_shouldRejectConsumerAccountWithoutHostedDomain() {
    when(googleIdTokenDecoder.decode("id-token"))
        .thenReturn(
            googleToken(
                Map.of("sub", "google-123", "email", "someone@gmail.com", "email_verified", true)));

    assertThatThrownBy(() -> service.exchangeGoogleIdToken("id-token"))
        .isInstanceOf(DomainNotAllowedException.class);
  }

  @Test
  void exchangeGoogleIdToken_shouldRejectUnverifiedEmail() {
    when(googleIdTokenDecoder.decode("id-token"))
        .thenReturn(
            googleToken(
                Map.of(
                    "sub", "google-123",
                    "email", "teacher@psd401.net",
                    "hd", "psd401.net",
                    "email_verified", false)));

    assertThatThrownBy(() -> service.exchangeGoogleIdToken("id-token"))
        .isInstanceOf(DomainNotAllowedException.class)
        .hasMessage("Email not verified");
  }

  @Test
  void exchangeGoogleIdToken_shouldRejectUnverifiableToken() {
    when(googleIdTokenDecoder.decode("bad")).thenThrow(new BadJwtException("bad signature"));

    assertThatThrownBy(() -> service.exchangeGoogleIdToken("bad"))
        .isInstanceOf(UnauthenticatedException.class);
  }

  @Test
  void refresh_shouldIssueNewAccessTokenAndKeepRefreshToken() {
    SessionTokens original = issuer.issue("user-1", "teacher@psd401.net", "A Teacher");

    SessionTokens refreshed = service.refresh(original.refreshToken());

    assertThat(refreshed.refreshToken()).isEqualTo(original.refreshToken());
    AuthenticatedUser user = verifier.verify("Bearer " + refreshed.accessToken());
    assertThat(user.userId()).isEqualTo("user-1");
    assertThat(user.email()).isEqualTo("teacher@psd401.net");
  }

  @Test
  void refresh_shouldRejectAccessToken() {
    String accessToken = issuer.issueAccessToken("user-1", "teacher@psd401.net", null);

    assertThatThrownBy(() -> service.refresh(accessToken))
        .isInstanceOf(UnauthenticatedException.class);
  }

  @Test
  void refresh_shouldRejectGarbage() {
    assertThatThrownBy(() -> service.refresh("not-a-jwt"))
        .isInstanceOf(UnauthenticatedException.class);
  }

  private static Jwt googleToken(Map<String, Object> claims) {
    Instant now = Instant.now();
    return Jwt.withTokenValue("id-token")
        .header("alg", "RS256")
        .claims(c -> c.putAll(claims))
        .issuedAt(now)
        .expiresAt(now.plusSeconds(3600))
        .build();
  }
}

package com.scholary.coach.api;

import com.scholary.coach.auth.SessionTokenIssuer.SessionTokens;
import com.scholary.coach.auth.SessionTokenService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST API for establishing and renewing sessions. */
@RestController
@RequestMapping("/auth")
@Tag(name = "Auth", description = "Session token exchange")
public class AuthController {

  private final SessionTokenService sessionTokenService;

  public AuthController(SessionTokenService sessionTokenService) {
    this.sessionTokenService = sessionTokenService;
  }

  @PostMapping("/validate")
  @Operation(
      summary = "Exchange a Google ID token for a session",
      description = "Only verified accounts of the allowed domain are accepted.")
  public TokenResponse validate(@Valid @RequestBody TokenRequests.IdTokenRequest request) {
    SessionTokenService.Exchange exchange =
        sessionTokenService.exchangeGoogleIdToken(request.idToken());
    return TokenResponse.of(exchange.tokens(), exchange.user());
  }

  @PostMapping("/refresh")
  @Operation(summary = "Issue a new access token from a refresh token")
  public TokenResponse refresh(@Valid @RequestBody TokenRequests.RefreshTokenRequest request) {
    SessionTokens tokens = sessionTokenService.refresh(request.refreshToken());
    return TokenResponse.of(tokens, null);
  }
}

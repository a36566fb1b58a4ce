package com.scholary.coach.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/** Request bodies of the session endpoints. */
public final class TokenRequests {

  private TokenRequests() {}

  public record IdTokenRequest(@JsonProperty("id_token") @NotBlank String idToken) {}

  public record RefreshTokenRequest(
      @JsonProperty("refresh_token") @NotBlank String refreshToken) {}
}

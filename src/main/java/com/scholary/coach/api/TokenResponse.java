package com.scholary.coach.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.coach.auth.SessionTokenIssuer.SessionTokens;
import com.scholary.coach.auth.SessionTokenService.SessionUser;

/**
 * Session tokens handed to the client.
 *
 * <p>{@code user} is only present right after an identity exchange.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("expires_in") long expiresIn,
    User user) {

  static TokenResponse of(SessionTokens tokens, SessionUser user) {
    return new TokenResponse(
        tokens.accessToken(),
        tokens.refreshToken(),
        tokens.expiresInSeconds(),
        user == null ? null : User.from(user));
  }

  public record User(
      String id,
      String email,
      @JsonProperty("display_name") String displayName,
      @JsonProperty("photo_url") String photoUrl) {

    static User from(SessionUser user) {
      return new User(user.id(), user.email(), user.displayName(), user.photoUrl());
    }
  }
}

package com.scholary.coach.auth;

/**
 * Verifies inbound session credentials.
 *
 * <p>The signing scheme lives behind this interface so callers only depend on the pass/fail
 * contract and the extracted user.
 */
public interface SessionVerifier {

  /**
   * Verify a bearer credential.
   *
   * @param authorizationHeader the raw Authorization header value, may be null
   * @return the authenticated user
   * @throws UnauthenticatedException if the credential is absent, malformed, expired, badly signed
   *     or issued for a domain outside the allow-list
   */
  AuthenticatedUser verify(String authorizationHeader);
}

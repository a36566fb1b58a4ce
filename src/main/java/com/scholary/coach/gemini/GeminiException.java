package com.scholary.coach.gemini;

/**
 * Exception thrown when a Gemini API call fails.
 *
 * <p>Carries the HTTP status (or -1 when no response was received) and a truncated response body.
 * Both are for server-side diagnostics only and must not be passed on to clients.
 */
public class GeminiException extends RuntimeException {

  static final int NO_RESPONSE = -1;
  private static final int MAX_BODY_CHARS = 500;

  private final int statusCode;
  private final String responseBody;

  public GeminiException(String message, int statusCode, String responseBody) {
    super(String.format("%s: status %d", message, statusCode));
    this.statusCode = statusCode;
    this.responseBody = truncate(responseBody);
  }

  public GeminiException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = NO_RESPONSE;
    this.responseBody = null;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getResponseBody() {
    return responseBody;
  }

  private static String truncate(String body) {
    if (body == null || body.length() <= MAX_BODY_CHARS) {
      return body;
    }
    return body.substring(0, MAX_BODY_CHARS) + "...";
  }
}

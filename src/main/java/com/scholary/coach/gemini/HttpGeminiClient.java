package com.scholary.coach.gemini;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the Gemini REST API.
 *
 * <p>Uses the JDK HttpClient with a connect timeout on the client and a request timeout on every
 * call, so no outbound call can block a request indefinitely. The API key travels in the {@code
 * x-goog-api-key} header rather than the query string to keep it out of URLs and access logs.
 *
 * <p>No retries: a failed status query aborts the whole analysis.
 */
@Component
public class HttpGeminiClient implements GeminiClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpGeminiClient.class);

  private static final String API_VERSION = "/v1beta/";
  private static final String API_KEY_HEADER = "x-goog-api-key";

  private final HttpClient httpClient;
  private final GeminiProperties properties;
  private final ObjectMapper objectMapper;

  public HttpGeminiClient(GeminiProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient = HttpClient.newBuilder().connectTimeout(properties.connectTimeout()).build();

    LOGGER.info("Initialized Gemini client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public GeminiFile getFile(String fileName) {
    HttpRequest request = requestBuilder(API_VERSION + fileName).GET().build();
    HttpResponse<String> response = send(request, "File status query");

    if (!isSuccess(response.statusCode())) {
      throw new GeminiException("File status query failed", response.statusCode(), response.body());
    }
    return readBody(response, GeminiFile.class, "File status query");
  }

  @Override
  public GenerateContentResponse generateContent(String model, GenerateContentRequest body) {
    String json;
    try {
      json = objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new GeminiException("Failed to encode generation request", e);
    }

    HttpRequest request =
        requestBuilder(API_VERSION + "models/" + model + ":generateContent")
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(json))
            .build();

    LOGGER.debug("Sending generation request: model={}, bytes={}", model, json.length());
    HttpResponse<String> response = send(request, "Generation");

    if (!isSuccess(response.statusCode())) {
      throw new GeminiException("Generation failed", response.statusCode(), response.body());
    }
    return readBody(response, GenerateContentResponse.class, "Generation");
  }

  @Override
  public void deleteFile(String fileName) {
    HttpRequest request = requestBuilder(API_VERSION + fileName).DELETE().build();
    HttpResponse<String> response = send(request, "File delete");

    if (response.statusCode() == 404) {
      LOGGER.debug("File already gone: {}", fileName);
      return;
    }
    if (!isSuccess(response.statusCode())) {
      throw new GeminiException("File delete failed", response.statusCode(), response.body());
    }
    LOGGER.info("Deleted file: {}", fileName);
  }

  private HttpRequest.Builder requestBuilder(String path) {
    return HttpRequest.newBuilder()
        .uri(URI.create(properties.baseUrl() + path))
        .timeout(properties.requestTimeout())
        .header(API_KEY_HEADER, properties.apiKey());
  }

  private HttpResponse<String> send(HttpRequest request, String operation) {
    try {
      return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new GeminiException(operation + " request failed", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GeminiException(operation + " request interrupted", e);
    }
  }

  private <T> T readBody(HttpResponse<String> response, Class<T> type, String operation) {
    try {
      return objectMapper.readValue(response.body(), type);
    } catch (JsonProcessingException e) {
      throw new GeminiException(operation + " returned an unreadable body", e);
    }
  }

  private static boolean isSuccess(int statusCode) {
    return statusCode >= 200 && statusCode < 300;
  }
}

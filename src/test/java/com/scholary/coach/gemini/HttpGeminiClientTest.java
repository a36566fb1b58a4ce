package com.scholary.coach.gemini;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Exercises the client against a local stub of the Gemini REST API. */
class HttpGeminiClientTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();

  private HttpServer server;
  private volatile int status = 200;
  private volatile String responseBody = "{}";
  private volatile long responseDelayMs = 0;

  private HttpGeminiClient client;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/", this::handle);
    server.start();

    GeminiProperties properties =
        new GeminiProperties(
            "http://127.0.0.1:" + server.getAddress().getPort(),
            "secret-key",
            "gemini-2.5-flash",
            Duration.ofSeconds(2),
            Duration.ofMillis(500),
            0.4,
            8192);
    client = new HttpGeminiClient(properties, objectMapper);
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  @Test
  void getFile_shouldParseMetadataAndSendApiKeyHeader() {
    responseBody =
        "{\"name\":\"files/abc123\",\"mimeType\":\"video/mp4\","
            + "\"uri\":\"https://generativelanguage.googleapis.com/v1beta/files/abc123\","
            + "\"state\":\"ACTIVE\",\"createTime\":\"2024-05-01T00:00:00Z\"}";

    GeminiFile file = client.getFile("files/abc123");

    assertThat(file.name()).isEqualTo("files/abc123");
    assertThat(file.mimeType()).isEqualTo("video/mp4");
    assertThat(file.fileState()).isEqualTo(FileState.ACTIVE);
    RecordedRequest request = requests.get(0);
    assertThat(request.method()).isEqualTo("GET");
    assertThat(request.path()).isEqualTo("/v1beta/files/abc123");
    assertThat(request.query()).isNull();
    assertThat(request.apiKey()).isEqualTo("secret-key");
  }

  @Test
  void getFile_shouldTreatUnknownStateAsProcessing() {
    responseBody = "{\"name\":\"files/abc123\",\"state\":\"STATE_UNSPECIFIED\"}";

    assertThat(client.getFile("files/abc123").fileState()).isEqualTo(FileState.PROCESSING);
  }

  @Test
  void getFile_shouldFailOnNon2xxWithStatus() {
    status = 503;
    responseBody = "{\"error\":{\"message\":\"backend unavailable\"}}";

    assertThatThrownBy(() -> client.getFile("files/abc123"))
        .isInstanceOfSatisfying(
            GeminiException.class,
            e -> {
              assertThat(e.getStatusCode()).isEqualTo(503);
              assertThat(e.getResponseBody()).contains("backend unavailable");
            });
    assertThat(requests).hasSize(1);
  }

  @Test
  void generateContent_shouldPostFileReferenceBeforePrompt() throws Exception {
    responseBody =
        "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"{}\"}],\"role\":\"model\"},"
            + "\"finishReason\":\"STOP\"}],"
            + "\"usageMetadata\":{\"promptTokenCount\":1200,\"candidatesTokenCount\":300,"
            + "\"totalTokenCount\":1500}}";

    GenerateContentResponse response =
        client.generateContent(
            "gemini-2.5-flash",
            GenerateContentRequest.forFile(
                "video/mp4", "https://example.com/files/abc123", "Evaluate this", 0.4, 8192));

    assertThat(response.firstCandidateText()).contains("{}");
    assertThat(response.usageMetadata().promptTokenCount()).isEqualTo(1200);
    assertThat(response.usageMetadata().candidatesTokenCount()).isEqualTo(300);

    RecordedRequest request = requests.get(0);
    assertThat(request.method()).isEqualTo("POST");
    assertThat(request.path()).isEqualTo("/v1beta/models/gemini-2.5-flash:generateContent");

    JsonNode body = objectMapper.readTree(request.body());
    JsonNode parts = body.path("contents").get(0).path("parts");
    assertThat(parts).hasSize(2);
    assertThat(parts.get(0).path("fileData").path("mimeType").asText()).isEqualTo("video/mp4");
    assertThat(parts.get(0).path("fileData").path("fileUri").asText())
        .isEqualTo("https://example.com/files/abc123");
    assertThat(parts.get(0).has("text")).isFalse();
    assertThat(parts.get(1).path("text").asText()).isEqualTo("Evaluate this");
    assertThat(body.path("generationConfig").path("temperature").asDouble()).isEqualTo(0.4);
    assertThat(body.path("generationConfig").path("maxOutputTokens").asInt()).isEqualTo(8192);
  }

  @Test
  void generateContent_shouldFailOnNon2xx() {
    status = 400;
    responseBody = "{\"error\":{\"message\":\"bad request\"}}";

    assertThatThrownBy(
            () ->
                client.generateContent(
                    "gemini-2.5-flash",
                    GenerateContentRequest.forFile("video/mp4", "u", "p", 0.4, 10)))
        .isInstanceOf(GeminiException.class)
        .hasMessageContaining("status 400");
  }

  @Test
  void generateContent_shouldReportMissingCandidates() {
    responseBody = "{\"promptFeedback\":{\"blockReason\":\"SAFETY\"}}";

    GenerateContentResponse response =
        client.generateContent(
            "gemini-2.5-flash", GenerateContentRequest.forFile("video/mp4", "u", "p", 0.4, 10));

    assertThat(response.hasCandidates()).isFalse();
    assertThat(response.firstCandidateText()).isEmpty();
    assertThat(response.blockReason()).isEqualTo("SAFETY");
  }

  @Test
  void deleteFile_shouldTreatNotFoundAsSuccess() {
    status = 404;

    assertThatCode(() -> client.deleteFile("files/abc123")).doesNotThrowAnyException();
    assertThat(requests.get(0).method()).isEqualTo("DELETE");
    assertThat(requests.get(0).path()).isEqualTo("/v1beta/files/abc123");
  }

  @Test
  void deleteFile_shouldFailOnServerError() {
    status = 500;

    assertThatThrownBy(() -> client.deleteFile("files/abc123"))
        .isInstanceOf(GeminiException.class);
  }

  @Test
  void calls_shouldGiveUpAfterRequestTimeout() {
    responseDelayMs = 2000;

    assertThatThrownBy(() -> client.getFile("files/slow"))
        .isInstanceOfSatisfying(
            GeminiException.class, e -> assertThat(e.getStatusCode()).isEqualTo(-1));
  }

  private void handle(HttpExchange exchange) throws IOException {
    String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    requests.add(
        new RecordedRequest(
            exchange.getRequestMethod(),
            exchange.getRequestURI().getPath(),
            exchange.getRequestURI().getQuery(),
            exchange.getRequestHeaders().getFirst("x-goog-api-key"),
            body));
    try {
      if (responseDelayMs > 0) {
        Thread.sleep(responseDelayMs);
      }
      byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
      exchange.getResponseHeaders().add("Content-Type", "application/json");
      exchange.sendResponseHeaders(status, bytes.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(bytes);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (IOException e) {
      // client already gave up
    } finally {
      exchange.close();
    }
  }

  private record RecordedRequest(
      String method, String path, String query, String apiKey, String body) {}
}

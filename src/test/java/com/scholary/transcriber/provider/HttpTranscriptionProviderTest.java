package com.scholary.transcriber.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcriber.error.ErrorKind;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Runs the provider client against a local HTTP server. */
class HttpTranscriptionProviderTest {

  private static final String VERBOSE_JSON =
      "{\"text\": \"hello world\", \"language\": \"en\", \"duration\": 2.5,"
          + " \"segments\": [{\"id\": 0, \"start\": 0.0, \"end\": 2.5,"
          + " \"text\": \" hello world\", \"avg_logprob\": -0.1}],"
          + " \"words\": [{\"word\": \"hello\", \"start\": 0.0, \"end\": 1.0},"
          + " {\"word\": \"world\", \"start\": 1.2, \"end\": 2.4}],"
          + " \"x_groq\": {\"id\": \"ignored\"}}";

  private HttpServer server;
  private final AtomicReference<String> lastBody = new AtomicReference<>();
  private final AtomicReference<String> lastAuthorization = new AtomicReference<>();
  private volatile int status = 200;
  private volatile String responseBody = VERBOSE_JSON;
  private volatile String retryAfter;

  private HttpTranscriptionProvider provider;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/v1/audio/transcriptions",
        exchange -> {
          lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
          lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
          if (retryAfter != null) {
            exchange.getResponseHeaders().add("Retry-After", retryAfter);
          }
          byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(status, bytes.length);
          try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
          }
        });
    server.start();

    ProviderProperties properties =
        new ProviderProperties(
            "http://127.0.0.1:" + server.getAddress().getPort() + "/v1",
            "test-key",
            "whisper-large-v3-turbo",
            5,
            5);
    provider = new HttpTranscriptionProvider(properties, new ObjectMapper());
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  @Test
  void transcribe_shouldSendMultipartRequestAndParseResponse() {
    ProviderResponse response =
        provider.transcribe(
            new ProviderRequest(
                new byte[] {1, 2, 3}, "talk.wav", "audio/wav", "en", null, 0.2, "names: Ada"));

    assertThat(response.text()).isEqualTo("hello world");
    assertThat(response.language()).isEqualTo("en");
    assertThat(response.duration()).isEqualTo(2.5);
    assertThat(response.segments()).hasSize(1);
    assertThat(response.segments().get(0).avgLogprob()).isEqualTo(-0.1);
    assertThat(response.words()).hasSize(2);

    assertThat(lastAuthorization.get()).isEqualTo("Bearer test-key");
    assertThat(lastBody.get())
        .contains("filename=\"talk.wav\"")
        .contains("whisper-large-v3-turbo")
        .contains("verbose_json")
        .contains("name=\"timestamp_granularities[]\"")
        .contains("name=\"language\"")
        .contains("names: Ada");
  }

  @Test
  void transcribe_shouldOmitBlankOptionalFields() {
    provider.transcribe(
        new ProviderRequest(new byte[] {1}, "a.wav", "audio/wav", null, "custom-model", 0.0, null));

    assertThat(lastBody.get())
        .contains("custom-model")
        .doesNotContain("name=\"language\"")
        .doesNotContain("name=\"prompt\"");
  }

  @Test
  void transcribe_shouldClassifyRateLimitWithRetryAfter() {
    status = 429;
    responseBody = "{\"error\":{\"message\":\"Rate limit reached\"}}";
    retryAfter = "3";

    assertThatThrownBy(() -> provider.transcribe(request()))
        .isInstanceOf(ProviderException.class)
        .satisfies(
            e -> {
              ProviderException pe = (ProviderException) e;
              assertThat(pe.getKind()).isEqualTo(ErrorKind.RATE_LIMIT);
              assertThat(pe.getRetryAfterMs()).isEqualTo(3000);
              assertThat(pe.getStatusCode()).isEqualTo(429);
            });
  }

  @Test
  void transcribe_shouldClassifyAuthenticationFailure() {
    status = 401;
    responseBody = "{\"error\":{\"message\":\"Invalid API key\"}}";

    assertThatThrownBy(() -> provider.transcribe(request()))
        .isInstanceOf(ProviderException.class)
        .satisfies(
            e -> assertThat(((ProviderException) e).getKind()).isEqualTo(ErrorKind.AUTHENTICATION));
  }

  @Test
  void transcribe_shouldReportUnreadableResponse() {
    responseBody = "<html>gateway</html>";

    assertThatThrownBy(() -> provider.transcribe(request()))
        .isInstanceOf(ProviderException.class)
        .satisfies(
            e ->
                assertThat(((ProviderException) e).getKind())
                    .isEqualTo(ErrorKind.TRANSCRIPTION_FAILED));
  }

  @Test
  void transcribe_shouldClassifyUnreachableProviderAsNetwork() {
    server.stop(0);

    assertThatThrownBy(() -> provider.transcribe(request()))
        .isInstanceOf(ProviderException.class)
        .satisfies(
            e -> assertThat(((ProviderException) e).isRetryable()).isTrue());
  }

  private static ProviderRequest request() {
    return new ProviderRequest(new byte[] {1, 2}, "a.wav", "audio/wav", null, null, 0.0, null);
  }
}

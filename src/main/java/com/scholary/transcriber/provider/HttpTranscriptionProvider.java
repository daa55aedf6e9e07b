package com.scholary.transcriber.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.transcriber.error.ErrorKind;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for an OpenAI-compatible {@code /audio/transcriptions} endpoint.
 *
 * <p>This handles the low-level HTTP communication: building the multipart request, sending the
 * audio, parsing the verbose JSON response and mapping failures to error kinds. It makes exactly
 * one attempt per call.
 *
 * <p>Why not use RestTemplate or WebClient? Because we need fine-grained control over multipart
 * encoding and the overall request timeout. The Java 11+ HttpClient gives us that with less
 * overhead.
 */
@Component
public class HttpTranscriptionProvider implements TranscriptionProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpTranscriptionProvider.class);

  private final HttpClient httpClient;
  private final ProviderProperties properties;
  private final ObjectMapper objectMapper;

  public HttpTranscriptionProvider(ProviderProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeoutSeconds()))
            .build();

    LOGGER.info(
        "Initialized transcription provider: baseUrl={}, defaultModel={}",
        properties.baseUrl(),
        properties.defaultModel());
  }

  @Override
  public ProviderResponse transcribe(ProviderRequest request) {
    String model = request.model() != null ? request.model() : properties.defaultModel();
    String boundary = UUID.randomUUID().toString();

    HttpRequest httpRequest =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/audio/transcriptions"))
            .timeout(Duration.ofSeconds(properties.requestTimeoutSeconds()))
            .header("Authorization", "Bearer " + properties.apiKey())
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(BodyPublishers.ofByteArray(buildMultipartBody(request, model, boundary)))
            .build();

    LOGGER.debug("Sending transcription request to {}: {}", httpRequest.uri(), request);

    HttpResponse<String> response;
    try {
      response =
          httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancellationException("Transcription request interrupted");
    } catch (IOException e) {
      throw ErrorClassifier.classify(e);
    }

    if (response.statusCode() / 100 != 2) {
      ProviderException error =
          ErrorClassifier.fromStatus(
              response.statusCode(), response.body(), response.headers().firstValue("Retry-After"));
      LOGGER.warn(
          "Provider rejected request: status={}, kind={}, file={}",
          response.statusCode(),
          error.getKind(),
          request.filename());
      throw error;
    }

    try {
      ProviderResponse parsed = objectMapper.readValue(response.body(), ProviderResponse.class);
      LOGGER.info(
          "Transcription successful: file={}, segments={}, words={}, language={}",
          request.filename(),
          parsed.segments() == null ? 0 : parsed.segments().size(),
          parsed.words() == null ? 0 : parsed.words().size(),
          parsed.language());
      return parsed;
    } catch (JsonProcessingException e) {
      throw new ProviderException(
          ErrorKind.TRANSCRIPTION_FAILED, "Provider returned an unreadable response", e);
    }
  }

  /**
   * Build a multipart/form-data body for the transcription request.
   *
   * <p>Java's HttpClient has no built-in multipart support, so the parts are written by hand: the
   * audio file, then one text part per option. Word and segment timestamps are both requested.
   */
  private byte[] buildMultipartBody(ProviderRequest request, String model, String boundary) {
    ByteArrayOutputStream body = new ByteArrayOutputStream(request.audio().length + 1024);

    StringBuilder sb = new StringBuilder();
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"file\"; filename=\"")
        .append(request.filename())
        .append("\"\r\n");
    sb.append("Content-Type: ")
        .append(request.contentType() != null ? request.contentType() : "application/octet-stream")
        .append("\r\n\r\n");
    body.writeBytes(sb.toString().getBytes(StandardCharsets.UTF_8));
    body.writeBytes(request.audio());
    body.writeBytes("\r\n".getBytes(StandardCharsets.UTF_8));

    appendField(body, boundary, "model", model);
    appendField(body, boundary, "response_format", "verbose_json");
    appendField(body, boundary, "temperature", String.valueOf(request.temperature()));
    appendField(body, boundary, "timestamp_granularities[]", "segment");
    appendField(body, boundary, "timestamp_granularities[]", "word");
    if (request.language() != null && !request.language().isBlank()) {
      appendField(body, boundary, "language", request.language());
    }
    if (request.prompt() != null && !request.prompt().isBlank()) {
      appendField(body, boundary, "prompt", request.prompt());
    }

    body.writeBytes(("--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
    return body.toByteArray();
  }

  private static void appendField(
      ByteArrayOutputStream body, String boundary, String name, String value) {
    String part =
        "--"
            + boundary
            + "\r\n"
            + "Content-Disposition: form-data; name=\""
            + name
            + "\"\r\n\r\n"
            + value
            + "\r\n";
    body.writeBytes(part.getBytes(StandardCharsets.UTF_8));
  }
}

package com.scholary.dialect.transcriber.speech;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dialect.transcriber.audio.WavEncoder;
import com.scholary.dialect.transcriber.confidence.TokenDistribution;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the speech inference service.
 *
 * <p>Each window is uploaded as a 16-bit PCM WAV in a multipart/form-data request to
 * {@code /api/v1/decode}. The service answers with JSON:
 *
 * <pre>
 * {"text": "...", "distributions": [[0.01, 0.97, ...], ...]}
 * </pre>
 *
 * <p>Transient failures (I/O errors, non-200 responses) are retried with exponential backoff and
 * jitter. Every request is bounded by the configured read timeout.
 */
public class SpeechModelClient implements SpeechModel {

  private static final Logger LOGGER = LoggerFactory.getLogger(SpeechModelClient.class);

  private final HttpClient httpClient;
  private final SpeechModelProperties properties;
  private final ObjectMapper objectMapper;

  public SpeechModelClient(SpeechModelProperties properties, ObjectMapper objectMapper) {
    this(
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build(),
        properties,
        objectMapper);
    LOGGER.info("Initialized speech model client: baseUrl={}", properties.baseUrl());
  }

  SpeechModelClient(
      HttpClient httpClient, SpeechModelProperties properties, ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public DecodeResult decode(float[] samples, int sampleRate, String targetLanguage) {
    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptDecode(samples, sampleRate, targetLanguage);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          LOGGER.warn(
              "Decode attempt {} failed, retrying in {}ms: {}", attempt, backoffMs, e.getMessage());
          sleep(backoffMs);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new DecodeException("Decode interrupted", e);
      }
    }

    throw new DecodeException(
        String.format("Decode failed after %d attempts", properties.maxRetries()), lastException);
  }

  private DecodeResult attemptDecode(float[] samples, int sampleRate, String targetLanguage)
      throws IOException, InterruptedException {

    String boundary = UUID.randomUUID().toString();
    byte[] body = buildMultipartBody(samples, sampleRate, targetLanguage, boundary);

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/api/v1/decode"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(BodyPublishers.ofByteArray(body))
            .build();

    LOGGER.debug("Sending decode request to {}: {} samples", request.uri(), samples.length);

    HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
    if (response.statusCode() != 200) {
      throw new IOException(
          String.format(
              "Speech model returned status %d: %s",
              response.statusCode(), new String(response.body(), StandardCharsets.UTF_8)));
    }

    DecodeResponse decoded;
    try {
      decoded = objectMapper.readValue(response.body(), DecodeResponse.class);
    } catch (IOException e) {
      // malformed payloads will not get better on retry
      throw new DecodeException("Unreadable speech model response", e);
    }

    LOGGER.debug(
        "Decode successful: textLength={}, steps={}",
        decoded.text() == null ? 0 : decoded.text().length(),
        decoded.distributions() == null ? 0 : decoded.distributions().size());

    return new DecodeResult(decoded.text(), new TokenDistribution(decoded.distributions()));
  }

  /**
   * Build the multipart body.
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="chunk.wav"
   * Content-Type: audio/wav
   *
   * [wav bytes]
   * --boundary
   * Content-Disposition: form-data; name="sampleRate"
   *
   * 16000
   * --boundary
   * Content-Disposition: form-data; name="targetLanguage"
   *
   * arb
   * --boundary--
   * </pre>
   */
  static byte[] buildMultipartBody(
      float[] samples, int sampleRate, String targetLanguage, String boundary) throws IOException {

    ByteArrayOutputStream out = new ByteArrayOutputStream();

    StringBuilder sb = new StringBuilder();
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"file\"; filename=\"chunk.wav\"\r\n");
    sb.append("Content-Type: audio/wav\r\n\r\n");
    out.write(sb.toString().getBytes(StandardCharsets.UTF_8));

    out.write(WavEncoder.encodeMono16(samples, sampleRate));

    sb = new StringBuilder();
    sb.append("\r\n");
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"sampleRate\"\r\n\r\n");
    sb.append(sampleRate).append("\r\n");
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"targetLanguage\"\r\n\r\n");
    sb.append(targetLanguage).append("\r\n");
    sb.append("--").append(boundary).append("--\r\n");
    out.write(sb.toString().getBytes(StandardCharsets.UTF_8));

    return out.toByteArray();
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new DecodeException("Decode interrupted", ie);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record DecodeResponse(String text, List<double[]> distributions) {}
}

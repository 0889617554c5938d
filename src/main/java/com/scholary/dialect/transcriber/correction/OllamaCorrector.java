package com.scholary.dialect.transcriber.correction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Corrector} backed by an Ollama-compatible chat endpoint.
 *
 * <p>Sends a single non-streaming user message to {@code /api/chat} with JSON output requested and
 * returns {@code message.content} from the reply. Parsing of the content is left to {@link
 * CorrectionResponseParser}.
 */
public class OllamaCorrector implements Corrector {

  private static final Logger LOGGER = LoggerFactory.getLogger(OllamaCorrector.class);

  private final HttpClient httpClient;
  private final CorrectorProperties properties;
  private final CorrectionPromptBuilder promptBuilder;
  private final ObjectMapper objectMapper;

  public OllamaCorrector(CorrectorProperties properties, ObjectMapper objectMapper) {
    this(
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build(),
        properties,
        objectMapper);
    LOGGER.info(
        "Initialized corrector: host={}, model={}", properties.host(), properties.model());
  }

  OllamaCorrector(HttpClient httpClient, CorrectorProperties properties, ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.promptBuilder =
        new CorrectionPromptBuilder(properties.dialect(), properties.colloquialExamples());
  }

  @Override
  public String correct(CorrectionRequest request) {
    String prompt = promptBuilder.build(request);

    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.host() + "/api/chat"))
            .timeout(Duration.ofSeconds(properties.requestTimeout()))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(buildBody(prompt)));
    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      builder.header("Authorization", "Bearer " + properties.apiKey());
    }

    LOGGER.debug(
        "Sending correction request: tier={}, textLength={}",
        request.policy().tier(),
        request.text().length());

    HttpResponse<String> response;
    try {
      response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new CorrectionServiceException("Corrector unreachable: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CorrectionServiceException("Correction interrupted", e);
    }

    if (response.statusCode() != 200) {
      throw new CorrectionServiceException(
          String.format(
              "Corrector returned status %d: %s", response.statusCode(), response.body()));
    }

    return extractContent(response.body());
  }

  private String buildBody(String prompt) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", properties.model());
    ObjectNode message = body.putArray("messages").addObject();
    message.put("role", "user");
    message.put("content", prompt);
    body.put("stream", false);
    body.put("format", "json");
    try {
      return objectMapper.writeValueAsString(body);
    } catch (IOException e) {
      throw new CorrectionServiceException("Failed to serialize correction request", e);
    }
  }

  private String extractContent(String responseBody) {
    JsonNode content;
    try {
      content = objectMapper.readTree(responseBody).path("message").path("content");
    } catch (IOException e) {
      throw new CorrectionServiceException("Unreadable corrector response", e);
    }
    if (!content.isTextual()) {
      throw new CorrectionServiceException("Corrector response has no message content");
    }
    return content.asText();
  }
}

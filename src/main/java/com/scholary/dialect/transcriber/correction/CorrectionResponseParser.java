package com.scholary.dialect.transcriber.correction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Parses the corrector's reply into a {@link CorrectionResult}.
 *
 * <p>The reply may wrap the JSON object in Markdown fences or surrounding prose; the outermost
 * {@code {...}} is extracted. Expected shape:
 *
 * <pre>
 * {"corrected_text": "...", "changes_made": true, "requires_confirmation": false}
 * </pre>
 *
 * <p>{@code corrected_text} is required and must be a non-blank string. A missing {@code
 * changes_made} is derived by comparing texts; a missing {@code requires_confirmation} is false.
 * The original text always comes from the request, never from the reply.
 */
public class CorrectionResponseParser {

  private final ObjectMapper objectMapper;

  public CorrectionResponseParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * @throws CorrectionParseException if the reply does not contain a valid correction object
   */
  public CorrectionResult parse(String reply, String originalText) {
    if (reply == null || reply.isBlank()) {
      throw new CorrectionParseException("Corrector reply is empty");
    }

    JsonNode root = readObject(extractJsonObject(reply));

    JsonNode corrected = root.get("corrected_text");
    if (corrected == null || !corrected.isTextual() || corrected.asText().isBlank()) {
      throw new CorrectionParseException("Reply has no usable corrected_text");
    }
    String correctedText = corrected.asText().trim();

    boolean changesMade =
        readBoolean(root, "changes_made", !correctedText.equals(originalText.trim()));
    boolean requiresConfirmation = readBoolean(root, "requires_confirmation", false);

    return new CorrectionResult(correctedText, changesMade, requiresConfirmation, originalText);
  }

  private static String extractJsonObject(String reply) {
    int start = reply.indexOf('{');
    int end = reply.lastIndexOf('}');
    if (start < 0 || end <= start) {
      throw new CorrectionParseException("Reply contains no JSON object");
    }
    return reply.substring(start, end + 1);
  }

  private JsonNode readObject(String json) {
    try {
      JsonNode node = objectMapper.readTree(json);
      if (node == null || !node.isObject()) {
        throw new CorrectionParseException("Reply JSON is not an object");
      }
      return node;
    } catch (JsonProcessingException e) {
      throw new CorrectionParseException("Reply is not valid JSON: " + e.getOriginalMessage(), e);
    }
  }

  private static boolean readBoolean(JsonNode root, String field, boolean defaultValue) {
    JsonNode node = root.get(field);
    if (node == null || node.isNull()) {
      return defaultValue;
    }
    if (!node.isBoolean()) {
      throw new CorrectionParseException(field + " must be a boolean, got " + node.getNodeType());
    }
    return node.booleanValue();
  }
}

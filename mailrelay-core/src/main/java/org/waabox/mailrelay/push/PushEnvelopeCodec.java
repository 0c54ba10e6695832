package org.waabox.mailrelay.push;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.waabox.mailrelay.PushMetadata;

/**
 * Static utility class that decodes a Pub/Sub push envelope into a
 * {@link PushMessage}.
 *
 * <p>The envelope has the shape:
 * <pre>{@code
 * {
 *   "message": {
 *     "data": "<base64 of {\"emailAddress\":\"...\",\"historyId\":123}>",
 *     "messageId": "...",
 *     "publishTime": "..."
 *   },
 *   "subscription": "projects/.../subscriptions/..."
 * }
 * }</pre>
 *
 * <p>Both the camel case ({@code messageId}, {@code publishTime}) and the
 * snake case ({@code message_id}, {@code publish_time}) spellings are
 * accepted. The {@code historyId} may be a JSON number or a numeric string.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PushEnvelopeCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private PushEnvelopeCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Decodes a push envelope.
   *
   * @param json    the envelope JSON, never null.
   * @param headers the delivery request headers, never null.
   * @return the decoded message, never null.
   * @throws IllegalArgumentException if the envelope is malformed, or the
   *     payload lacks a usable {@code historyId}.
   */
  public static PushMessage decode(final String json,
      final Map<String, String> headers) {
    Objects.requireNonNull(json, "json cannot be null");
    Objects.requireNonNull(headers, "headers cannot be null");

    final JsonNode envelope = readTree(json, "push envelope");
    final JsonNode message = envelope.get("message");
    if (message == null || !message.isObject()) {
      throw new IllegalArgumentException("Missing message in push envelope");
    }

    final String data = text(message, "data");
    if (data == null || data.isBlank()) {
      throw new IllegalArgumentException("Missing message data");
    }

    final String decoded;
    try {
      decoded = new String(Base64.getDecoder().decode(data.trim()),
          StandardCharsets.UTF_8);
    } catch (final IllegalArgumentException e) {
      throw new IllegalArgumentException("Message data is not base64", e);
    }

    final JsonNode payload = readTree(decoded, "message data");
    final long cursor = cursorOf(payload);

    final String messageId = firstText(message, "messageId", "message_id");
    final String publishTime = firstText(message, "publishTime",
        "publish_time");

    final PushMetadata metadata = new PushMetadata(
        text(payload, "emailAddress"),
        messageId,
        publishTime,
        text(envelope, "subscription"),
        data,
        headers);

    return new PushMessage(cursor, metadata);
  }

  /** Parses the given text, rejecting anything that is not a JSON object.
   *
   * @param json the text to parse.
   * @param what a description used in error messages.
   * @return the parsed object node, never null.
   */
  private static JsonNode readTree(final String json, final String what) {
    final JsonNode node;
    try {
      node = MAPPER.readTree(json);
    } catch (final Exception e) {
      throw new IllegalArgumentException("Malformed " + what, e);
    }
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException("Malformed " + what
          + ": not a JSON object");
    }
    return node;
  }

  /** Extracts the historyId as a long.
   *
   * @param payload the decoded message data.
   * @return the cursor.
   * @throws IllegalArgumentException if the field is missing or not numeric.
   */
  private static long cursorOf(final JsonNode payload) {
    final JsonNode node = payload.get("historyId");
    if (node == null || node.isNull()) {
      throw new IllegalArgumentException("Missing field: historyId");
    }
    if (node.isIntegralNumber()) {
      if (!node.canConvertToLong()) {
        throw new IllegalArgumentException(
            "historyId is out of range: " + node);
      }
      return node.asLong();
    }
    if (node.isTextual()) {
      try {
        return Long.parseLong(node.asText().trim());
      } catch (final NumberFormatException e) {
        throw new IllegalArgumentException(
            "historyId is not numeric: " + node.asText(), e);
      }
    }
    throw new IllegalArgumentException("historyId is not numeric: " + node);
  }

  private static String firstText(final JsonNode node, final String first,
      final String second) {
    final String value = text(node, first);
    return value != null ? value : text(node, second);
  }

  private static String text(final JsonNode node, final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    return value.asText();
  }
}

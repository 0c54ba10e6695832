package org.waabox.mailrelay.forward;

import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Static utility class that renders a {@link ForwardPayload} as the JSON
 * document posted downstream.
 *
 * <p>Field names follow the webhook contract consumers already depend on:
 * {@code emailAddress}, {@code historyId}, {@code messageId},
 * {@code publishTime}, {@code subscription} and {@code raw}, plus
 * {@code itemId}, {@code previousHistoryId}, {@code labelIds} and
 * {@code receivedAt}. Labels are written in sorted order.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ForwardPayloadCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private ForwardPayloadCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes a payload into a JSON string.
   *
   * @param payload the payload to serialize, never null.
   * @return the JSON representation, never null.
   */
  public static String serialize(final ForwardPayload payload) {
    Objects.requireNonNull(payload, "payload cannot be null");

    final ObjectNode node = MAPPER.createObjectNode();
    node.put("itemId", payload.itemId());
    node.put("emailAddress", payload.mailbox());
    node.put("historyId", payload.cursor());
    node.put("previousHistoryId", payload.previousCursor());
    node.put("messageId", payload.push().messageId());
    node.put("publishTime", payload.push().publishTime());
    node.put("subscription", payload.push().subscription());
    node.put("receivedAt", payload.receivedAt().toString());

    final ArrayNode labels = node.putArray("labelIds");
    new TreeSet<>(payload.tags()).forEach(labels::add);

    final ObjectNode raw = node.putObject("raw");
    raw.put("base64Data", payload.push().rawData());
    final ObjectNode headers = raw.putObject("headers");
    for (final Map.Entry<String, String> header
        : payload.push().headers().entrySet()) {
      headers.put(header.getKey(), header.getValue());
    }

    return node.toString();
  }
}

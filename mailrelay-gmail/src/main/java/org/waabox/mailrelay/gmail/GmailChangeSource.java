package org.waabox.mailrelay.gmail;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.mailrelay.source.ChangeRecord;
import org.waabox.mailrelay.source.ChangeSource;
import org.waabox.mailrelay.source.ChangeSourceException;
import org.waabox.mailrelay.source.CursorExpiredException;

/**
 * {@link ChangeSource} backed by the Gmail REST API.
 *
 * <p>The cursor is Gmail's {@code historyId}:
 * <ul>
 *   <li>{@code GET users/{userId}/profile} gives the current one.</li>
 *   <li>{@code GET users/{userId}/history} lists {@code messageAdded}
 *       records after a start id, following {@code nextPageToken}.</li>
 *   <li>{@code GET users/{userId}/messages/{id}?format=metadata} gives the
 *       message's labels.</li>
 * </ul>
 *
 * <p>A 404 from history listing means the start id is older than Gmail
 * keeps, and is reported as {@link CursorExpiredException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class GmailChangeSource implements ChangeSource {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(GmailChangeSource.class);

  /** HTTP 404 Not Found status code. */
  private static final int HTTP_NOT_FOUND = 404;

  /** Shared mapper for response parsing. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** The configuration. */
  private final GmailConfig config;

  /** The HTTP client. */
  private final HttpClient client;

  /**
   * Creates a new change source with its own HTTP client.
   *
   * @param theConfig the configuration, never null
   */
  public GmailChangeSource(final GmailConfig theConfig) {
    this(theConfig, HttpClient.newBuilder()
        .connectTimeout(Objects.requireNonNull(theConfig,
            "config must not be null").callTimeout())
        .build());
  }

  /**
   * Creates a new change source with the given HTTP client.
   *
   * @param theConfig the configuration, never null
   * @param theClient the HTTP client, never null
   */
  public GmailChangeSource(final GmailConfig theConfig,
      final HttpClient theClient) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    client = Objects.requireNonNull(theClient, "client must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public long currentCursor(final String token) {
    final HttpResponse<String> response = get(token, "/profile");
    requireOk(response, "profile");
    return cursorOf(parse(response.body(), "profile"), "historyId",
        "profile");
  }

  /** {@inheritDoc} */
  @Override
  public List<ChangeRecord> listAddedItems(final String token,
      final long sinceCursor) {

    final List<ChangeRecord> records = new ArrayList<>();
    String pageToken = null;
    int pages = 0;

    do {
      final StringBuilder path = new StringBuilder("/history?startHistoryId=")
          .append(sinceCursor)
          .append("&historyTypes=messageAdded");
      if (config.labelFilter() != null) {
        path.append("&labelId=").append(encode(config.labelFilter()));
      }
      if (pageToken != null) {
        path.append("&pageToken=").append(encode(pageToken));
      }

      final HttpResponse<String> response = get(token, path.toString());
      if (response.statusCode() == HTTP_NOT_FOUND) {
        throw new CursorExpiredException(sinceCursor);
      }
      requireOk(response, "history");

      final JsonNode page = parse(response.body(), "history");
      for (final JsonNode history : page.path("history")) {
        final long cursor = cursorOf(history, "id", "history record");
        for (final JsonNode added : history.path("messagesAdded")) {
          final String itemId = added.path("message").path("id")
              .asText(null);
          if (itemId != null) {
            records.add(new ChangeRecord(itemId, cursor));
          }
        }
      }

      pageToken = page.path("nextPageToken").asText(null);
      pages++;
    } while (pageToken != null && !pageToken.isEmpty());

    log.debug("Listed {} added message(s) since {} in {} page(s)",
        records.size(), sinceCursor, pages);
    return records;
  }

  /** {@inheritDoc} */
  @Override
  public Set<String> tags(final String token, final String itemId) {
    Objects.requireNonNull(itemId, "itemId must not be null");

    final HttpResponse<String> response = get(token,
        "/messages/" + encode(itemId) + "?format=metadata");
    requireOk(response, "message " + itemId);

    final Set<String> labels = new LinkedHashSet<>();
    for (final JsonNode label : parse(response.body(), "message")
        .path("labelIds")) {
      labels.add(label.asText());
    }
    return labels;
  }

  /**
   * Performs an authorized GET below the user's resource path.
   *
   * @param token the bearer token, never null
   * @param path  the path and query below {@code users/{userId}}
   * @return the response, never null
   */
  private HttpResponse<String> get(final String token, final String path) {
    Objects.requireNonNull(token, "token must not be null");

    final URI uri = URI.create(config.baseUrl() + "/users/"
        + encode(config.userId()) + path);
    final HttpRequest request = HttpRequest.newBuilder()
        .uri(uri)
        .timeout(config.callTimeout())
        .header("Authorization", "Bearer " + token)
        .header("Accept", "application/json")
        .GET()
        .build();

    try {
      return client.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (final IOException e) {
      throw new ChangeSourceException("Gmail call failed: " + uri.getPath(),
          e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ChangeSourceException("Interrupted calling Gmail: "
          + uri.getPath(), e);
    }
  }

  /**
   * Fails unless the response is a 2xx.
   *
   * @param response the response, never null
   * @param what     what was requested, for the message
   */
  private static void requireOk(final HttpResponse<String> response,
      final String what) {
    final int status = response.statusCode();
    if (status < 200 || status >= 300) {
      throw new ChangeSourceException("Gmail " + what + " responded "
          + status);
    }
  }

  /**
   * Parses a JSON response body.
   *
   * @param body the body, never null
   * @param what what was requested, for the message
   * @return the root node, never null
   */
  private static JsonNode parse(final String body, final String what) {
    try {
      return MAPPER.readTree(body);
    } catch (final IOException e) {
      throw new ChangeSourceException("Malformed Gmail " + what
          + " response", e);
    }
  }

  /**
   * Reads a history id field, which Gmail sends as a string.
   *
   * @param node  the node holding the field, never null
   * @param field the field name, never null
   * @param what  what the node is, for the message
   * @return the history id
   */
  private static long cursorOf(final JsonNode node, final String field,
      final String what) {
    final String value = node.path(field).asText(null);
    if (value == null) {
      throw new ChangeSourceException("Gmail " + what + " has no " + field);
    }
    try {
      return Long.parseLong(value);
    } catch (final NumberFormatException e) {
      throw new ChangeSourceException("Gmail " + what
          + " has a non numeric " + field + ": " + value, e);
    }
  }

  /**
   * URL-encodes a path or query component.
   *
   * @param value the value, never null
   * @return the encoded value, never null
   */
  private static String encode(final String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+",
        "%20");
  }
}

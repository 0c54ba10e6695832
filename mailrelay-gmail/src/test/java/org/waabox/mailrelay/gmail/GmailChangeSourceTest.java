package org.waabox.mailrelay.gmail;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.mailrelay.source.ChangeRecord;
import org.waabox.mailrelay.source.ChangeSourceException;
import org.waabox.mailrelay.source.CursorExpiredException;

/**
 * Tests for {@link GmailChangeSource} against a local fake of the Gmail API.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class GmailChangeSourceTest {

  private HttpServer server;

  private final List<String> requests = new CopyOnWriteArrayList<>();

  private final List<String> authorizations = new CopyOnWriteArrayList<>();

  private volatile int historyStatus = 200;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    server.createContext("/gmail/v1/users/me/profile", exchange ->
        respond(exchange, 200, "{\"emailAddress\":\"someone@example.com\","
            + "\"historyId\":\"12345\"}"));
    server.createContext("/gmail/v1/users/me/history", exchange -> {
      final String query = exchange.getRequestURI().getRawQuery();
      if (historyStatus != 200) {
        respond(exchange, historyStatus, "{\"error\":{}}");
      } else if (query.contains("pageToken=page-2")) {
        respond(exchange, 200, "{\"history\":[{\"id\":\"103\","
            + "\"messagesAdded\":[{\"message\":"
            + "{\"id\":\"m3\",\"threadId\":\"t3\"}}]}],"
            + "\"historyId\":\"103\"}");
      } else {
        respond(exchange, 200, "{\"history\":["
            + "{\"id\":\"101\",\"messagesAdded\":"
            + "[{\"message\":{\"id\":\"m1\"}},{\"message\":{\"id\":\"m2\"}}]},"
            + "{\"id\":\"102\",\"labelsAdded\":[]}],"
            + "\"nextPageToken\":\"page-2\",\"historyId\":\"103\"}");
      }
    });
    server.createContext("/gmail/v1/users/me/messages/", exchange -> {
      if (exchange.getRequestURI().getPath().endsWith("/missing")) {
        respond(exchange, 404, "{}");
      } else {
        respond(exchange, 200, "{\"id\":\"m1\",\"labelIds\":"
            + "[\"INBOX\",\"UNREAD\",\"CATEGORY_PERSONAL\"]}");
      }
    });
    server.start();
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  private void respond(final HttpExchange exchange, final int status,
      final String body) throws IOException {
    requests.add(exchange.getRequestURI().toString());
    authorizations.add(exchange.getRequestHeaders()
        .getFirst("Authorization"));
    final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }

  private GmailChangeSource source(final String labelFilter) {
    return new GmailChangeSource(GmailConfig.builder()
        .baseUrl("http://localhost:" + server.getAddress().getPort()
            + "/gmail/v1/")
        .labelFilter(labelFilter)
        .callTimeout(Duration.ofSeconds(5))
        .build());
  }

  @Test
  void whenReadingCurrentCursor_givenProfile_shouldReturnHistoryId() {
    assertEquals(12345L, source(null).currentCursor("tok-1"));
    assertEquals("Bearer tok-1", authorizations.get(0));
  }

  @Test
  void whenListing_givenPagedHistory_shouldFollowPagesInOrder() {
    final List<ChangeRecord> records = source(null)
        .listAddedItems("tok", 100);

    assertEquals(List.of(
        new ChangeRecord("m1", 101),
        new ChangeRecord("m2", 101),
        new ChangeRecord("m3", 103)), records);
    assertEquals(2, requests.size());
    assertTrue(requests.get(0).contains("startHistoryId=100"));
    assertTrue(requests.get(0).contains("historyTypes=messageAdded"));
    assertTrue(requests.get(1).contains("pageToken=page-2"));
  }

  @Test
  void whenListing_givenLabelFilter_shouldPassLabelId() {
    source("INBOX").listAddedItems("tok", 100);

    assertTrue(requests.get(0).contains("labelId=INBOX"));
  }

  @Test
  void whenListing_givenExpiredStartId_shouldThrowCursorExpired() {
    historyStatus = 404;

    final CursorExpiredException e = assertThrows(
        CursorExpiredException.class,
        () -> source(null).listAddedItems("tok", 7));

    assertTrue(e.getMessage().contains("7"));
  }

  @Test
  void whenListing_givenServerError_shouldThrowChangeSourceException() {
    historyStatus = 503;

    assertThrows(ChangeSourceException.class,
        () -> source(null).listAddedItems("tok", 7));
  }

  @Test
  void whenReadingTags_givenMessage_shouldReturnLabels() {
    final Set<String> tags = source(null).tags("tok", "m1");

    assertEquals(Set.of("INBOX", "UNREAD", "CATEGORY_PERSONAL"), tags);
    assertTrue(requests.get(0).endsWith("/messages/m1?format=metadata"));
  }

  @Test
  void whenReadingTags_givenDeletedMessage_shouldFail() {
    assertThrows(ChangeSourceException.class,
        () -> source(null).tags("tok", "missing"));
  }

  @Test
  void whenCalling_givenUnreachableServer_shouldFail() {
    final int port = server.getAddress().getPort();
    server.stop(0);

    final GmailChangeSource source = new GmailChangeSource(
        GmailConfig.builder()
            .baseUrl("http://localhost:" + port + "/gmail/v1")
            .callTimeout(Duration.ofSeconds(2))
            .build());

    assertThrows(ChangeSourceException.class,
        () -> source.currentCursor("tok"));
  }
}

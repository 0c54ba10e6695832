package org.waabox.mailrelay.gmail;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.mailrelay.source.TokenAcquisitionException;

/**
 * Tests for {@link GoogleOAuthTokenProvider}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class GoogleOAuthTokenProviderTest {

  /** A clock tests can move forward. */
  static final class MutableClock extends Clock {

    private volatile Instant now = Instant.parse("2024-05-01T10:00:00Z");

    void advance(final Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(final ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }

  private HttpServer server;

  private final AtomicInteger exchanges = new AtomicInteger();

  private final AtomicReference<String> lastForm = new AtomicReference<>();

  private volatile int status = 200;

  private final MutableClock clock = new MutableClock();

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    server.createContext("/token", exchange -> {
      try (InputStream is = exchange.getRequestBody()) {
        lastForm.set(new String(is.readAllBytes(), StandardCharsets.UTF_8));
      }
      final int n = exchanges.incrementAndGet();
      final byte[] body = ("{\"access_token\":\"access-" + n + "\","
          + "\"expires_in\":3599,\"token_type\":\"Bearer\"}")
          .getBytes(StandardCharsets.UTF_8);
      exchange.sendResponseHeaders(status, body.length);
      try (OutputStream os = exchange.getResponseBody()) {
        os.write(body);
      }
    });
    server.start();
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  private GoogleOAuthTokenProvider provider() {
    return new GoogleOAuthTokenProvider(
        "http://localhost:" + server.getAddress().getPort() + "/token",
        "client id", "secret", "refresh/token", Duration.ofSeconds(5),
        HttpClient.newHttpClient(), clock);
  }

  @Test
  void whenRequestingToken_givenRefreshToken_shouldPostGrantForm() {
    final String token = provider().token();

    assertEquals("access-1", token);
    final String form = lastForm.get();
    assertTrue(form.contains("grant_type=refresh_token"));
    assertTrue(form.contains("client_id=client+id"));
    assertTrue(form.contains("client_secret=secret"));
    assertTrue(form.contains("refresh_token=refresh%2Ftoken"));
  }

  @Test
  void whenRequestingToken_givenValidCachedToken_shouldNotExchangeAgain() {
    final GoogleOAuthTokenProvider provider = provider();

    provider.token();
    clock.advance(Duration.ofMinutes(30));
    final String second = provider.token();

    assertEquals("access-1", second);
    assertEquals(1, exchanges.get());
  }

  @Test
  void whenRequestingToken_givenTokenNearExpiry_shouldRefresh() {
    final GoogleOAuthTokenProvider provider = provider();

    provider.token();
    clock.advance(Duration.ofSeconds(3599 - 30));
    final String second = provider.token();

    assertEquals("access-2", second);
    assertEquals(2, exchanges.get());
  }

  @Test
  void whenRequestingToken_givenRejectedGrant_shouldFail() {
    status = 400;

    assertThrows(TokenAcquisitionException.class,
        () -> provider().token());
  }

  @Test
  void whenCreatingStaticProvider_givenBlankToken_shouldFail() {
    assertThrows(IllegalArgumentException.class,
        () -> new StaticTokenProvider(" "));
    assertEquals("abc", new StaticTokenProvider("abc").token());
  }
}

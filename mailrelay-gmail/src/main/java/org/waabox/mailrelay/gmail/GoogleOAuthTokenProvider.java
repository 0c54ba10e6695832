package org.waabox.mailrelay.gmail;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.mailrelay.source.TokenAcquisitionException;
import org.waabox.mailrelay.source.TokenProvider;

/**
 * A {@link TokenProvider} that exchanges an OAuth refresh token for access
 * tokens at Google's token endpoint.
 *
 * <p>The access token is cached until shortly before it expires. Calls are
 * serialized, so concurrent callers never trigger more than one exchange.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class GoogleOAuthTokenProvider implements TokenProvider {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(GoogleOAuthTokenProvider.class);

  /** Google's token endpoint. */
  public static final String DEFAULT_TOKEN_URL =
      "https://oauth2.googleapis.com/token";

  /** How long before expiry a cached token is considered stale. */
  private static final Duration EXPIRY_SKEW = Duration.ofSeconds(60);

  /** Used when the endpoint omits expires_in. */
  private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

  /** Shared mapper for response parsing. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** The token endpoint. */
  private final URI tokenUrl;

  /** The OAuth client id. */
  private final String clientId;

  /** The OAuth client secret. */
  private final String clientSecret;

  /** The long-lived refresh token. */
  private final String refreshToken;

  /** The per-call timeout. */
  private final Duration callTimeout;

  /** The HTTP client. */
  private final HttpClient client;

  /** The clock used for expiry. */
  private final Clock clock;

  /** The cached access token, null until the first exchange. */
  private String accessToken;

  /** When the cached token stops being used. */
  private Instant refreshAt = Instant.MIN;

  /**
   * Creates a new provider.
   *
   * @param theTokenUrl     the token endpoint, never null
   * @param theClientId     the OAuth client id, never null
   * @param theClientSecret the OAuth client secret, never null
   * @param theRefreshToken the refresh token, never null
   * @param theCallTimeout  the per-call timeout, never null
   */
  public GoogleOAuthTokenProvider(final String theTokenUrl,
      final String theClientId, final String theClientSecret,
      final String theRefreshToken, final Duration theCallTimeout) {
    this(theTokenUrl, theClientId, theClientSecret, theRefreshToken,
        theCallTimeout, HttpClient.newBuilder()
            .connectTimeout(Objects.requireNonNull(theCallTimeout,
                "callTimeout must not be null"))
            .build(),
        Clock.systemUTC());
  }

  /**
   * Creates a new provider with the given client and clock.
   *
   * @param theTokenUrl     the token endpoint, never null
   * @param theClientId     the OAuth client id, never null
   * @param theClientSecret the OAuth client secret, never null
   * @param theRefreshToken the refresh token, never null
   * @param theCallTimeout  the per-call timeout, never null
   * @param theClient       the HTTP client, never null
   * @param theClock        the clock, never null
   */
  GoogleOAuthTokenProvider(final String theTokenUrl,
      final String theClientId, final String theClientSecret,
      final String theRefreshToken, final Duration theCallTimeout,
      final HttpClient theClient, final Clock theClock) {
    tokenUrl = URI.create(Objects.requireNonNull(theTokenUrl,
        "tokenUrl must not be null"));
    clientId = Objects.requireNonNull(theClientId,
        "clientId must not be null");
    clientSecret = Objects.requireNonNull(theClientSecret,
        "clientSecret must not be null");
    refreshToken = Objects.requireNonNull(theRefreshToken,
        "refreshToken must not be null");
    callTimeout = Objects.requireNonNull(theCallTimeout,
        "callTimeout must not be null");
    client = Objects.requireNonNull(theClient, "client must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public synchronized String token() {
    if (accessToken != null && clock.instant().isBefore(refreshAt)) {
      return accessToken;
    }

    final JsonNode response = exchange();

    final String token = response.path("access_token").asText(null);
    if (token == null || token.isEmpty()) {
      throw new TokenAcquisitionException(
          "Token endpoint returned no access_token");
    }
    final long expiresIn = response.path("expires_in")
        .asLong(DEFAULT_EXPIRES_IN_SECONDS);

    accessToken = token;
    refreshAt = clock.instant().plusSeconds(expiresIn).minus(EXPIRY_SKEW);

    log.debug("Obtained access token valid for {}s", expiresIn);
    return accessToken;
  }

  /**
   * Posts the refresh-token grant to the token endpoint.
   *
   * @return the parsed response, never null
   */
  private JsonNode exchange() {
    final String form = "grant_type=refresh_token"
        + "&client_id=" + encode(clientId)
        + "&client_secret=" + encode(clientSecret)
        + "&refresh_token=" + encode(refreshToken);

    final HttpRequest request = HttpRequest.newBuilder()
        .uri(tokenUrl)
        .timeout(callTimeout)
        .header("Content-Type", "application/x-www-form-urlencoded")
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(form))
        .build();

    final HttpResponse<String> response;
    try {
      response = client.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (final IOException e) {
      throw new TokenAcquisitionException("Token exchange failed", e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TokenAcquisitionException("Interrupted during token exchange",
          e);
    }

    if (response.statusCode() != 200) {
      throw new TokenAcquisitionException("Token endpoint responded "
          + response.statusCode());
    }

    try {
      return MAPPER.readTree(response.body());
    } catch (final IOException e) {
      throw new TokenAcquisitionException("Malformed token response", e);
    }
  }

  /**
   * Form-encodes a value.
   *
   * @param value the value, never null
   * @return the encoded value, never null
   */
  private static String encode(final String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}

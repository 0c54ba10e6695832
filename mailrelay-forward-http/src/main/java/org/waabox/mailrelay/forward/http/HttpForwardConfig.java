package org.waabox.mailrelay.forward.http;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration holder for {@link HttpForwardSink}.
 *
 * <p>Holds the webhook URL, the per-call timeout and any fixed headers sent
 * with every request, such as an authorization header the webhook expects.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HttpForwardConfig {

  /** The default per-call timeout. */
  private static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(10);

  /** The webhook URL. */
  private final URI url;

  /** The per-call timeout. */
  private final Duration callTimeout;

  /** Headers added to every request. */
  private final Map<String, String> headers;

  /** Private constructor; use the static factory methods instead. */
  private HttpForwardConfig(final URI url, final Duration callTimeout,
      final Map<String, String> headers) {
    this.url = url;
    this.callTimeout = callTimeout;
    this.headers = Map.copyOf(headers);
  }

  /**
   * Creates a new configuration with the default timeout and no extra
   * headers.
   *
   * @param url the webhook URL, never null
   * @return a new {@link HttpForwardConfig} instance, never null
   */
  public static HttpForwardConfig create(final String url) {
    return create(url, DEFAULT_CALL_TIMEOUT, Map.of());
  }

  /**
   * Creates a new configuration.
   *
   * @param url         the webhook URL, never null
   * @param callTimeout the per-call timeout, never null
   * @param headers     headers added to every request, never null
   * @return a new {@link HttpForwardConfig} instance, never null
   */
  public static HttpForwardConfig create(final String url,
      final Duration callTimeout, final Map<String, String> headers) {
    Objects.requireNonNull(url, "url must not be null");
    Objects.requireNonNull(callTimeout, "callTimeout must not be null");
    Objects.requireNonNull(headers, "headers must not be null");
    if (url.isBlank()) {
      throw new IllegalArgumentException("url must not be blank");
    }
    return new HttpForwardConfig(URI.create(url), callTimeout, headers);
  }

  /**
   * Returns the webhook URL.
   *
   * @return the URL, never null
   */
  public URI url() {
    return url;
  }

  /**
   * Returns the per-call timeout.
   *
   * @return the timeout, never null
   */
  public Duration callTimeout() {
    return callTimeout;
  }

  /**
   * Returns the headers added to every request.
   *
   * @return an unmodifiable map, never null
   */
  public Map<String, String> headers() {
    return headers;
  }
}

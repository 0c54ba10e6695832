package org.waabox.mailrelay.forward.http;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.mailrelay.forward.ForwardException;
import org.waabox.mailrelay.forward.ForwardPayload;
import org.waabox.mailrelay.forward.ForwardPayloadCodec;
import org.waabox.mailrelay.forward.ForwardSink;

/**
 * {@link ForwardSink} that POSTs each payload as JSON to a webhook.
 *
 * <p>Each forward is a single synchronous request bounded by the configured
 * timeout. Any non-2xx response or transport error is a failure; there is
 * no retry.
 *
 * <p>Typical usage:
 * <pre>{@code
 * ForwardSink sink = new HttpForwardSink(
 *     HttpForwardConfig.create("https://hooks.example.com/mail"));
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class HttpForwardSink implements ForwardSink {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(HttpForwardSink.class);

  /** The configuration for this sink. */
  private final HttpForwardConfig config;

  /** The HTTP client used to reach the webhook. */
  private final HttpClient client;

  /**
   * Creates a new sink with its own HTTP client.
   *
   * @param config the configuration, never null
   */
  public HttpForwardSink(final HttpForwardConfig config) {
    this(config, HttpClient.newBuilder()
        .connectTimeout(Objects.requireNonNull(config,
            "config must not be null").callTimeout())
        .build());
  }

  /**
   * Creates a new sink with the given HTTP client.
   *
   * @param config the configuration, never null
   * @param client the HTTP client, never null
   */
  public HttpForwardSink(final HttpForwardConfig config,
      final HttpClient client) {
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.client = Objects.requireNonNull(client, "client must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public void forward(final ForwardPayload payload) {
    Objects.requireNonNull(payload, "payload must not be null");

    final String json = ForwardPayloadCodec.serialize(payload);

    final HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(config.url())
        .timeout(config.callTimeout())
        .header("Content-Type", "application/json");
    for (final Map.Entry<String, String> header
        : config.headers().entrySet()) {
      builder.header(header.getKey(), header.getValue());
    }

    final HttpResponse<String> response;
    try {
      response = client.send(builder.POST(
          HttpRequest.BodyPublishers.ofString(json)).build(),
          HttpResponse.BodyHandlers.ofString());
    } catch (final IOException e) {
      throw new ForwardException("Failed to forward item '"
          + payload.itemId() + "' to " + config.url(), e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ForwardException("Interrupted forwarding item '"
          + payload.itemId() + "'", e);
    }

    final int status = response.statusCode();
    if (status < 200 || status >= 300) {
      throw new ForwardException("Webhook " + config.url()
          + " responded with status " + status + " for item '"
          + payload.itemId() + "'");
    }

    log.debug("Forwarded item '{}' to {} ({})", payload.itemId(),
        config.url(), status);
  }
}

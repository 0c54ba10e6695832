package org.waabox.mailrelay.app;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import org.waabox.mailrelay.MailRelay;
import org.waabox.mailrelay.Outcome;
import org.waabox.mailrelay.ResponseHandle;
import org.waabox.mailrelay.SyncStatus;
import org.waabox.mailrelay.push.PushEnvelopeCodec;
import org.waabox.mailrelay.push.PushMessage;
import org.waabox.mailrelay.queue.QueueCapacityExceededException;
import org.waabox.mailrelay.spring.MailRelayProperties;

/** REST controller that receives Gmail change notifications pushed by
 * Google Cloud Pub/Sub and hands them to the {@link MailRelay} engine.
 *
 * <p>This controller provides two endpoints:
 * <ul>
 *   <li>{@code POST ${mailrelay.intake.path}} - decodes the push envelope,
 *       queues the notification and waits for its outcome</li>
 *   <li>{@code GET /status} - returns the engine's current
 *       {@link SyncStatus}</li>
 * </ul>
 *
 * <p>The HTTP status tells Pub/Sub whether to redeliver: any 2xx
 * acknowledges the message, anything else makes it retry later.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@RestController
public class PushController {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      PushController.class);

  /** The header carrying the push source's bearer token. */
  private static final String AUTHORIZATION = "authorization";

  /** The engine, never null. */
  private final MailRelay relay;

  /** How long a push request waits for its outcome, never null. */
  private final Duration responseTimeout;

  /** Creates a new PushController.
   *
   * @param theRelay the engine to hand notifications to, never null
   * @param theProperties the MailRelay properties, never null
   */
  public PushController(final MailRelay theRelay,
      final MailRelayProperties theProperties) {
    relay = Objects.requireNonNull(theRelay, "relay must not be null");
    Objects.requireNonNull(theProperties, "properties must not be null");
    responseTimeout = theProperties.getIntake().getResponseTimeout();
  }

  /** Receives one push delivery.
   *
   * <p>A malformed envelope, or one announcing a different mailbox, is
   * rejected with 400 and never queued. Otherwise the notification is
   * queued and the request waits up to the configured response timeout
   * for the outcome; if none arrives the notification stays queued and
   * the request answers 202.
   *
   * @param body the raw push envelope, never null
   * @param headers the request headers, never null
   *
   * @return the outcome as {@code {status, cursor, forwarded, skipped,
   *         failed, message}}, never null
   */
  @PostMapping("${mailrelay.intake.path:/}")
  public ResponseEntity<Map<String, Object>> push(
      @RequestBody final String body,
      @RequestHeader final Map<String, String> headers) {

    final PushMessage message;
    try {
      message = PushEnvelopeCodec.decode(body, forwardableHeaders(headers));
    } catch (final IllegalArgumentException e) {
      log.warn("Rejecting push delivery: {}", e.getMessage());
      return reply(HttpStatus.BAD_REQUEST, "INVALID", null, e.getMessage());
    }

    final String mailbox = message.metadata().mailbox();
    if (mailbox != null && !mailbox.equalsIgnoreCase(relay.mailbox())) {
      log.warn("Rejecting push delivery for mailbox '{}', serving '{}'",
          mailbox, relay.mailbox());
      return reply(HttpStatus.BAD_REQUEST, "INVALID", message.cursor(),
          "Notification for unexpected mailbox: " + mailbox);
    }

    final ResponseHandle handle;
    try {
      handle = relay.accept(message.cursor(), message.metadata());
    } catch (final QueueCapacityExceededException
        | IllegalStateException e) {
      log.warn("Cannot accept cursor {}: {}", message.cursor(),
          e.getMessage());
      return reply(HttpStatus.SERVICE_UNAVAILABLE, "UNAVAILABLE",
          message.cursor(), e.getMessage());
    }

    final Optional<Outcome> outcome;
    try {
      outcome = handle.await(responseTimeout);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return reply(HttpStatus.SERVICE_UNAVAILABLE, "UNAVAILABLE",
          message.cursor(), "Interrupted while waiting for the outcome");
    }

    if (outcome.isEmpty()) {
      log.info("Cursor {} still pending after {}", message.cursor(),
          responseTimeout);
      return reply(HttpStatus.ACCEPTED, "PENDING", message.cursor(),
          "still processing");
    }
    return reply(outcome.get());
  }

  /** Returns the engine's current synchronization status.
   *
   * @return the status, never null
   */
  @GetMapping("/status")
  public SyncStatus status() {
    return relay.status();
  }

  /** Maps an outcome status to the HTTP status Pub/Sub acts on.
   *
   * @param status the outcome status, never null
   *
   * @return the HTTP status, never null
   */
  static HttpStatus httpStatusOf(final Outcome.Status status) {
    switch (status) {
      case BASELINE_ESTABLISHED:
      case RESOLVED:
      case STALE:
        return HttpStatus.OK;
      case DEFERRED:
        return HttpStatus.ACCEPTED;
      case TRANSIENT_FAILURE:
        return HttpStatus.SERVICE_UNAVAILABLE;
      case SERVER_ERROR:
      default:
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
  }

  /** Copies the request headers without the authorization header, so the
   * push source's token never reaches the webhook.
   *
   * @param headers the request headers, never null
   *
   * @return the headers to carry with the notification, never null
   */
  private static Map<String, String> forwardableHeaders(
      final Map<String, String> headers) {
    final Map<String, String> result = new LinkedHashMap<>();
    headers.forEach((name, value) -> {
      if (!AUTHORIZATION.equalsIgnoreCase(name)) {
        result.put(name.toLowerCase(), value);
      }
    });
    return result;
  }

  private static ResponseEntity<Map<String, Object>> reply(
      final Outcome outcome) {
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", outcome.status().name());
    body.put("cursor", outcome.cursor());
    body.put("forwarded", outcome.forwarded());
    body.put("skipped", outcome.skipped());
    body.put("failed", outcome.failed());
    body.put("message", outcome.message());
    return ResponseEntity.status(httpStatusOf(outcome.status())).body(body);
  }

  private static ResponseEntity<Map<String, Object>> reply(
      final HttpStatus httpStatus, final String status, final Long cursor,
      final String message) {
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", status);
    body.put("cursor", cursor);
    body.put("forwarded", 0);
    body.put("skipped", 0);
    body.put("failed", 0);
    body.put("message", message);
    return ResponseEntity.status(httpStatus).body(body);
  }
}

package org.waabox.mailrelay;

import java.time.Instant;
import java.util.Objects;

/**
 * One inbound push event.
 *
 * <p>The cursor is the only signal of change carried by the push source.
 * Instances are immutable; the engine consumes and discards them once their
 * {@link ResponseHandle} has been completed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Notification {

  /** The mailbox cursor reported by the push source. */
  private final long cursor;

  /** When the notification was accepted, never null. */
  private final Instant receivedAt;

  /** The delivery provenance, never null. */
  private final PushMetadata metadata;

  /** The channel to answer the delivering request, never null. */
  private final ResponseHandle responseHandle;

  /**
   * Creates a new notification.
   *
   * @param theCursor         the mailbox cursor
   * @param theReceivedAt     when the notification was received, never null
   * @param theMetadata       the delivery provenance, never null
   * @param theResponseHandle the response channel, never null
   */
  public Notification(final long theCursor, final Instant theReceivedAt,
      final PushMetadata theMetadata, final ResponseHandle theResponseHandle) {
    cursor = theCursor;
    receivedAt = Objects.requireNonNull(theReceivedAt,
        "receivedAt must not be null");
    metadata = Objects.requireNonNull(theMetadata,
        "metadata must not be null");
    responseHandle = Objects.requireNonNull(theResponseHandle,
        "responseHandle must not be null");
  }

  public long cursor() {
    return cursor;
  }

  public Instant receivedAt() {
    return receivedAt;
  }

  public PushMetadata metadata() {
    return metadata;
  }

  public ResponseHandle responseHandle() {
    return responseHandle;
  }

  @Override
  public String toString() {
    return "Notification{cursor=" + cursor + ", messageId="
        + metadata.messageId() + ", receivedAt=" + receivedAt + "}";
  }
}

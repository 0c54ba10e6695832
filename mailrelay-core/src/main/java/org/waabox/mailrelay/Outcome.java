package org.waabox.mailrelay;

import java.util.Objects;

/**
 * The result of resolving one notification, delivered to the original caller
 * through its {@link ResponseHandle}.
 *
 * @param status    the resolution status, never null
 * @param cursor    the cursor of the notification this outcome belongs to
 * @param forwarded the number of items forwarded downstream
 * @param skipped   the number of items that did not qualify
 * @param failed    the number of items whose tag lookup or forward failed
 * @param message   a short human readable description, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Outcome(
    Status status,
    long cursor,
    int forwarded,
    int skipped,
    int failed,
    String message
) {

  /** The possible resolution statuses. */
  public enum Status {

    /** The first notification established the cursor baseline. */
    BASELINE_ESTABLISHED(true),

    /** The change window was walked and the cursor advanced. */
    RESOLVED(true),

    /** The cursor was already processed; nothing was done. */
    STALE(true),

    /**
     * Cold start was in progress; the notification was kept for replay.
     *
     * <p>The request is answered at once with this status. The replayed
     * notification is resolved later, but its outcome only reaches the
     * logs and {@code MailRelayMetrics#notificationResolved}, never the
     * original request.
     */
    DEFERRED(false),

    /** An upstream call failed; the caller should redeliver. */
    TRANSIENT_FAILURE(false),

    /** Cold start failed; the caller should redeliver. */
    SERVER_ERROR(false);

    /** Whether the status means the notification was handled. */
    private final boolean success;

    Status(final boolean isSuccess) {
      success = isSuccess;
    }

    /**
     * Returns whether this status means the notification needs no
     * redelivery.
     *
     * @return true for the success statuses
     */
    public boolean isSuccess() {
      return success;
    }
  }

  /** Validates the record components. */
  public Outcome {
    Objects.requireNonNull(status, "status must not be null");
    Objects.requireNonNull(message, "message must not be null");
  }

  static Outcome baseline(final long cursor, final long baseline) {
    return new Outcome(Status.BASELINE_ESTABLISHED, cursor, 0, 0, 0,
        "baseline established at " + baseline);
  }

  static Outcome resolved(final long cursor, final int forwarded,
      final int skipped, final int failed) {
    return new Outcome(Status.RESOLVED, cursor, forwarded, skipped, failed,
        "forwarded " + forwarded + ", skipped " + skipped + ", failed "
            + failed);
  }

  static Outcome stale(final long cursor, final long lastProcessed) {
    return new Outcome(Status.STALE, cursor, 0, 0, 0,
        "stale or duplicate, already at " + lastProcessed);
  }

  static Outcome deferred(final long cursor) {
    return new Outcome(Status.DEFERRED, cursor, 0, 0, 0,
        "cold start in progress, notification deferred");
  }

  static Outcome transientFailure(final long cursor, final String message) {
    return new Outcome(Status.TRANSIENT_FAILURE, cursor, 0, 0, 0, message);
  }

  static Outcome serverError(final long cursor, final String message) {
    return new Outcome(Status.SERVER_ERROR, cursor, 0, 0, 0, message);
  }
}

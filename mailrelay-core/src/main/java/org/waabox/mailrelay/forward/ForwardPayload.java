package org.waabox.mailrelay.forward;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

import org.waabox.mailrelay.PushMetadata;

/**
 * Describes one qualifying item sent to the {@link ForwardSink}.
 *
 * <p>Built fresh for every qualifying item. Besides the item itself it
 * carries the cursor window that surfaced it and the provenance of the push
 * notification that triggered the resolution.
 *
 * @param itemId         the forwarded item, never null
 * @param mailbox        the mailbox the item belongs to, never null
 * @param cursor         the cursor of the triggering notification
 * @param previousCursor the cursor the window started from
 * @param tags           the item's tags at qualification time, never null
 * @param receivedAt     when the triggering notification arrived, never null
 * @param push           the triggering notification's provenance, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ForwardPayload(
    String itemId,
    String mailbox,
    long cursor,
    long previousCursor,
    Set<String> tags,
    Instant receivedAt,
    PushMetadata push
) {

  /** Validates the record components. */
  public ForwardPayload {
    Objects.requireNonNull(itemId, "itemId must not be null");
    Objects.requireNonNull(mailbox, "mailbox must not be null");
    Objects.requireNonNull(receivedAt, "receivedAt must not be null");
    Objects.requireNonNull(push, "push must not be null");
    tags = tags == null ? Set.of() : Set.copyOf(tags);
  }
}

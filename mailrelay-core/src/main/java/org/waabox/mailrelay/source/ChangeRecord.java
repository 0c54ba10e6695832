package org.waabox.mailrelay.source;

import java.util.Objects;

/**
 * One item-added record reported by a {@link ChangeSource}.
 *
 * @param itemId the identifier of the added item, never null
 * @param cursor the cursor at which the record was written
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ChangeRecord(String itemId, long cursor) {

  /** Validates the record components. */
  public ChangeRecord {
    Objects.requireNonNull(itemId, "itemId must not be null");
  }
}

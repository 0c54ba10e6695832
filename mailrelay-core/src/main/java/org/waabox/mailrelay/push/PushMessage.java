package org.waabox.mailrelay.push;

import java.util.Objects;

import org.waabox.mailrelay.PushMetadata;

/**
 * A decoded push delivery: the cursor it announces plus its provenance.
 *
 * @param cursor   the mailbox cursor announced by the push source
 * @param metadata the delivery provenance, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record PushMessage(long cursor, PushMetadata metadata) {

  /** Validates the record components. */
  public PushMessage {
    Objects.requireNonNull(metadata, "metadata must not be null");
  }
}

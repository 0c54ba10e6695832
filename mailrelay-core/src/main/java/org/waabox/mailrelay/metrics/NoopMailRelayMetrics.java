package org.waabox.mailrelay.metrics;

import org.waabox.mailrelay.Outcome;

/**
 * A no-operation implementation of {@link MailRelayMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopMailRelayMetrics implements MailRelayMetrics {

  /** {@inheritDoc} */
  @Override
  public void notificationResolved(final String mailbox,
      final Outcome.Status status, final long durationMs) {
  }

  /** {@inheritDoc} */
  @Override
  public void itemForwarded(final String mailbox) {
  }

  /** {@inheritDoc} */
  @Override
  public void itemFailed(final String mailbox, final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void cursorPersistFailed(final String mailbox,
      final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void queueDepthReported(final String mailbox, final int depth) {
  }
}

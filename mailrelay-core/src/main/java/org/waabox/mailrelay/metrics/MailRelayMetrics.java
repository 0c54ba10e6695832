package org.waabox.mailrelay.metrics;

import org.waabox.mailrelay.Outcome;

/**
 * An abstraction for recording operational metrics of a MailRelay engine.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopMailRelayMetrics}
 * when metrics collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface MailRelayMetrics {

  /**
   * Records the outcome of one resolved notification.
   *
   * @param mailbox    the mailbox served by the engine, never null
   * @param status     the resolution status, never null
   * @param durationMs how long the cycle took, in milliseconds
   */
  void notificationResolved(String mailbox, Outcome.Status status,
      long durationMs);

  /**
   * Records an item forwarded downstream.
   *
   * @param mailbox the mailbox served by the engine, never null
   */
  void itemForwarded(String mailbox);

  /**
   * Records an item whose tag lookup or forward failed.
   *
   * @param mailbox the mailbox served by the engine, never null
   * @param cause   the failure, never null
   */
  void itemFailed(String mailbox, Throwable cause);

  /**
   * Records a failure to persist the advanced cursor.
   *
   * @param mailbox the mailbox served by the engine, never null
   * @param cause   the failure, never null
   */
  void cursorPersistFailed(String mailbox, Throwable cause);

  /**
   * Records the queue depth after a notification was accepted or drained.
   *
   * @param mailbox the mailbox served by the engine, never null
   * @param depth   the number of queued notifications
   */
  void queueDepthReported(String mailbox, int depth);
}

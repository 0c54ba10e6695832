package org.waabox.mailrelay.queue;

import org.waabox.mailrelay.MailRelayException;

/**
 * Thrown when a notification cannot be enqueued because the queue reached
 * its configured maximum length.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class QueueCapacityExceededException extends MailRelayException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception for the given capacity.
   *
   * @param capacity the maximum queue length that was reached
   */
  public QueueCapacityExceededException(final int capacity) {
    super("Notification queue is full (capacity " + capacity + ")");
  }
}

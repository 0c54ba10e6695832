package org.waabox.mailrelay.cursor;

import org.waabox.mailrelay.MailRelayException;

/**
 * Thrown when a {@link CursorStore} read or write fails.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class CursorStoreException extends MailRelayException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public CursorStoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}

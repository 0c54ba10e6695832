package org.waabox.mailrelay.forward;

import org.waabox.mailrelay.MailRelayException;

/**
 * Thrown when a {@link ForwardSink} fails to deliver a payload.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ForwardException extends MailRelayException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public ForwardException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public ForwardException(final String message, final Throwable cause) {
    super(message, cause);
  }
}

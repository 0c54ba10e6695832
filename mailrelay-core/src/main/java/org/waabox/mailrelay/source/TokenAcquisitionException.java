package org.waabox.mailrelay.source;

import org.waabox.mailrelay.MailRelayException;

/**
 * Thrown when a {@link TokenProvider} cannot obtain a bearer token.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class TokenAcquisitionException extends MailRelayException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public TokenAcquisitionException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public TokenAcquisitionException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}

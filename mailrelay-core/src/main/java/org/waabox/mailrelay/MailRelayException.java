package org.waabox.mailrelay;

/**
 * Base exception for all MailRelay-related errors.
 *
 * <p>This is an unchecked exception. Subclasses describe which collaborator
 * failed (token provider, change source, forward sink, cursor store) so the
 * engine can decide whether the failure is scoped to a single item or to the
 * whole resolution cycle.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class MailRelayException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public MailRelayException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public MailRelayException(final String message, final Throwable cause) {
    super(message, cause);
  }
}

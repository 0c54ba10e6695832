package org.waabox.mailrelay.source;

/**
 * Thrown when the change source no longer holds history for the requested
 * cursor, so the window since that cursor cannot be listed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class CursorExpiredException extends ChangeSourceException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception for the given cursor.
   *
   * @param cursor the cursor that is no longer valid
   */
  public CursorExpiredException(final long cursor) {
    super("Cursor no longer available at the change source: " + cursor);
  }
}

package org.waabox.mailrelay.source;

import java.util.List;
import java.util.Set;

/**
 * The system of record whose changes are relayed.
 *
 * <p>Implementations talk to a remote mailbox API. Every call must be bounded
 * by a timeout; a timeout is reported as a {@link ChangeSourceException}
 * like any other failure.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ChangeSource {

  /**
   * Returns the mailbox's current cursor, used as the cold start baseline.
   *
   * @param token the bearer token, never null
   * @return the current cursor
   * @throws ChangeSourceException if the cursor cannot be fetched
   */
  long currentCursor(String token);

  /**
   * Lists the item-added records that happened after the given cursor, in
   * the order the source reports them.
   *
   * <p>The same item may appear in more than one record.
   *
   * @param token       the bearer token, never null
   * @param sinceCursor the exclusive lower bound
   * @return the records, never null
   * @throws CursorExpiredException if the source no longer keeps history
   *                                that far back
   * @throws ChangeSourceException  if the records cannot be listed
   */
  List<ChangeRecord> listAddedItems(String token, long sinceCursor);

  /**
   * Returns the tags an item carries right now.
   *
   * @param token  the bearer token, never null
   * @param itemId the item identifier, never null
   * @return the item's tags, never null
   * @throws ChangeSourceException if the tags cannot be fetched
   */
  Set<String> tags(String token, String itemId);
}

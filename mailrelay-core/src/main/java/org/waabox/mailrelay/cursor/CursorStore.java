package org.waabox.mailrelay.cursor;

import java.util.Optional;

/**
 * A durable key-value store for the last processed cursor, so a restarted
 * engine resumes where it stopped instead of re-establishing a baseline.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface CursorStore {

  /**
   * Reads the value stored under the given key.
   *
   * @param key the key, never null
   * @return the stored value, or empty if nothing was stored
   * @throws CursorStoreException if the store cannot be read
   */
  Optional<String> read(String key);

  /**
   * Stores a value, replacing any previous one.
   *
   * @param key   the key, never null
   * @param value the value, never null
   * @throws CursorStoreException if the value cannot be written
   */
  void write(String key, String value);
}

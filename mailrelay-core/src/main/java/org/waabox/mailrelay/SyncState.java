package org.waabox.mailrelay;

import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The mutable state of one {@link MailRelay} engine.
 *
 * <p>The cursor fields are only written from inside a drain cycle, which is
 * guarded by {@link #tryBeginProcessing()}. They are volatile so that
 * {@link #snapshot(String, int)} can be read from any thread.
 *
 * <p>The last processed cursor never moves backwards: {@link #advanceTo(long)}
 * ignores values lower than the current one.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SyncState {

  /** The last processed cursor, meaningful only when hasCursor is true. */
  private volatile long lastProcessedCursor;

  /** Whether lastProcessedCursor holds a value. */
  private volatile boolean hasCursor;

  /** Whether a baseline has been established. */
  private volatile boolean initialized;

  /** Guards cold start against concurrent entry. */
  private final AtomicBoolean initializationInFlight = new AtomicBoolean();

  /** The single-flight drain lock. */
  private final AtomicBoolean processingInFlight = new AtomicBoolean();

  /**
   * Returns the last processed cursor.
   *
   * @return the cursor, or empty before the baseline is established
   */
  public OptionalLong lastProcessedCursor() {
    return hasCursor ? OptionalLong.of(lastProcessedCursor)
        : OptionalLong.empty();
  }

  /**
   * Returns whether a baseline cursor has been established.
   *
   * @return true once initialized
   */
  public boolean isInitialized() {
    return initialized;
  }

  /**
   * Sets the baseline cursor and marks the state as initialized.
   *
   * @param cursor the baseline cursor
   */
  void establishBaseline(final long cursor) {
    advanceTo(cursor);
    initialized = true;
  }

  /**
   * Moves the last processed cursor forward.
   *
   * @param cursor the new cursor; ignored when lower than the current one
   * @return true if the cursor changed
   */
  boolean advanceTo(final long cursor) {
    if (hasCursor && cursor <= lastProcessedCursor) {
      return false;
    }
    lastProcessedCursor = cursor;
    hasCursor = true;
    return true;
  }

  /**
   * Returns whether the given cursor was already processed.
   *
   * @param cursor the cursor to check
   * @return true if the cursor is lower than or equal to the last processed
   *         one
   */
  boolean isStale(final long cursor) {
    return hasCursor && cursor <= lastProcessedCursor;
  }

  boolean tryBeginInitialization() {
    return initializationInFlight.compareAndSet(false, true);
  }

  void endInitialization() {
    initializationInFlight.set(false);
  }

  boolean tryBeginProcessing() {
    return processingInFlight.compareAndSet(false, true);
  }

  void endProcessing() {
    processingInFlight.set(false);
  }

  /**
   * Returns whether a drain cycle currently holds the lock.
   *
   * @return true while a notification is being resolved
   */
  public boolean isProcessing() {
    return processingInFlight.get();
  }

  /**
   * Returns an immutable view of this state.
   *
   * @param mailbox    the mailbox the engine serves, never null
   * @param queueDepth the number of notifications waiting
   * @return the status view, never null
   */
  public SyncStatus snapshot(final String mailbox, final int queueDepth) {
    final OptionalLong cursor = lastProcessedCursor();
    return new SyncStatus(mailbox,
        cursor.isPresent() ? cursor.getAsLong() : null,
        initialized, processingInFlight.get(), queueDepth);
  }
}

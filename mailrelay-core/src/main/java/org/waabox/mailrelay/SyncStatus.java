package org.waabox.mailrelay;

/**
 * A point-in-time view of an engine, used for monitoring.
 *
 * @param mailbox             the mailbox served by the engine, never null
 * @param lastProcessedCursor the last processed cursor, null before the
 *                            baseline exists
 * @param initialized         whether the baseline has been established
 * @param processing          whether a drain cycle is running
 * @param queueDepth          the number of notifications waiting
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SyncStatus(
    String mailbox,
    Long lastProcessedCursor,
    boolean initialized,
    boolean processing,
    int queueDepth
) {
}

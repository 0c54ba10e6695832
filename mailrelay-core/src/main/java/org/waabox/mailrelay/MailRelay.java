package org.waabox.mailrelay;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.mailrelay.cursor.CursorStore;
import org.waabox.mailrelay.cursor.CursorStoreException;
import org.waabox.mailrelay.forward.ForwardPayload;
import org.waabox.mailrelay.forward.ForwardSink;
import org.waabox.mailrelay.metrics.MailRelayMetrics;
import org.waabox.mailrelay.metrics.NoopMailRelayMetrics;
import org.waabox.mailrelay.queue.NotificationQueue;
import org.waabox.mailrelay.queue.QueueCapacityExceededException;
import org.waabox.mailrelay.source.ChangeRecord;
import org.waabox.mailrelay.source.ChangeSource;
import org.waabox.mailrelay.source.CursorExpiredException;
import org.waabox.mailrelay.source.TokenProvider;

/**
 * The incremental synchronization engine for one mailbox.
 *
 * <p>MailRelay turns a stream of possibly duplicated, possibly reordered
 * cursor notifications into an ordered walk over the mailbox's change
 * history, forwarding every qualifying new item downstream once.
 *
 * <p>Notifications are accepted into a FIFO {@link NotificationQueue} and
 * resolved one at a time by {@link #tryDrain()}. Resolution is single-flight:
 * at most one cycle holds the processing lock at any instant. The first
 * notification establishes the cursor baseline (cold start); every later one
 * resolves the window between the last processed cursor and its own.
 *
 * <p>After {@link #start()}, a dedicated worker thread drains the queue.
 * Without it, callers may drive {@link #tryDrain()} themselves.
 *
 * <p>Usage example:
 * <pre>{@code
 * MailRelay relay = MailRelay.builder()
 *     .mailbox("someone@example.com")
 *     .tokenProvider(oauthTokenProvider)
 *     .changeSource(gmailChangeSource)
 *     .forwardSink(webhookSink)
 *     .cursorStore(fileSystemCursorStore)
 *     .tagPredicate(TagPredicate.requireAll(List.of("INBOX", "UNREAD")))
 *     .build();
 *
 * relay.start();
 *
 * ResponseHandle handle = relay.accept(4242L, metadata);
 * Optional<Outcome> outcome = handle.await(Duration.ofSeconds(25));
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MailRelay {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(MailRelay.class);

  /** The default maximum queue length. */
  private static final int DEFAULT_MAX_QUEUE_LENGTH = 1000;

  /** The default time the worker waits for work before re-checking. */
  private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

  /** How long stop waits for an in-progress cycle to finish. */
  private static final Duration STOP_TIMEOUT = Duration.ofSeconds(30);

  /** The mailbox this engine serves. */
  private final String mailbox;

  /** Supplies bearer tokens for the change source. */
  private final TokenProvider tokenProvider;

  /** The mailbox change history. */
  private final ChangeSource changeSource;

  /** Receives qualifying items. */
  private final ForwardSink forwardSink;

  /** The optional durable cursor store, may be null. */
  private final CursorStore cursorStore;

  /** The key under which the cursor is stored. */
  private final String cursorKey;

  /** Decides which items are forwarded. */
  private final TagPredicate tagPredicate;

  /** The metrics reporter. */
  private final MailRelayMetrics metrics;

  /** The notifications waiting to be resolved. */
  private final NotificationQueue queue;

  /** The engine state. */
  private final SyncState state;

  /** How long the worker waits for work before re-checking for stop. */
  private final Duration pollInterval;

  /** Whether the worker has been started. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** Whether this engine has been stopped. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  /** The worker draining the queue, null until started. */
  private ExecutorService worker;

  /**
   * Creates a new engine from the given builder.
   *
   * @param builder the builder, never null
   */
  private MailRelay(final Builder builder) {
    mailbox = builder.mailbox;
    tokenProvider = builder.tokenProvider;
    changeSource = builder.changeSource;
    forwardSink = builder.forwardSink;
    cursorStore = builder.cursorStore;
    cursorKey = builder.cursorKeyPrefix + builder.mailbox;
    tagPredicate = builder.tagPredicate;
    metrics = builder.metrics;
    queue = new NotificationQueue(builder.maxQueueLength);
    state = builder.state;
    pollInterval = builder.pollInterval;
  }

  /**
   * Creates a new builder for constructing a MailRelay instance.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the mailbox this engine serves.
   *
   * @return the mailbox, never null
   */
  public String mailbox() {
    return mailbox;
  }

  /**
   * Accepts a notification for resolution.
   *
   * <p>The notification is queued and the worker is woken. The returned
   * handle completes once the notification has been resolved.
   *
   * @param cursor   the cursor announced by the push source
   * @param metadata the delivery provenance, never null
   *
   * @return the handle that will carry the outcome, never null
   *
   * @throws QueueCapacityExceededException if the queue is full
   * @throws IllegalStateException          if this engine has been stopped
   */
  public ResponseHandle accept(final long cursor,
      final PushMetadata metadata) {
    Objects.requireNonNull(metadata, "metadata must not be null");

    if (stopped.get()) {
      throw new IllegalStateException(
          "MailRelay for mailbox '" + mailbox + "' has been stopped");
    }

    final ResponseHandle handle = new ResponseHandle();
    final Notification notification = new Notification(cursor,
        Instant.now(), metadata, handle);

    queue.enqueue(notification);

    final int depth = queue.size();
    metrics.queueDepthReported(mailbox, depth);
    log.debug("Mailbox '{}': accepted {} (queue depth {})", mailbox,
        notification, depth);

    // stop() may have released the queue between the check and the enqueue.
    if (stopped.get()) {
      releasePending();
    }

    return handle;
  }

  /**
   * Resolves the oldest queued notification, if the processing lock is
   * free.
   *
   * <p>At most one notification is processed per call. The call returns
   * immediately when another cycle holds the lock or the queue is empty.
   *
   * @return true if a notification was taken and resolved, false if the
   *         lock was busy or there was nothing to do
   */
  public boolean tryDrain() {
    if (!state.tryBeginProcessing()) {
      return false;
    }
    try {
      final Optional<Notification> next = queue.dequeueOldest();
      if (next.isEmpty()) {
        return false;
      }
      resolve(next.get());
      return true;
    } finally {
      state.endProcessing();
    }
  }

  /**
   * Starts the worker thread that drains the queue.
   *
   * <p>Calling this method more than once has no further effect.
   *
   * @throws IllegalStateException if this engine has been stopped
   */
  public void start() {
    if (stopped.get()) {
      throw new IllegalStateException(
          "MailRelay for mailbox '" + mailbox + "' has been stopped");
    }
    if (!started.compareAndSet(false, true)) {
      return;
    }

    worker = Executors.newSingleThreadExecutor(r -> {
      final Thread thread = new Thread(r, "mailrelay-drain-" + mailbox);
      thread.setDaemon(true);
      return thread;
    });
    worker.submit(this::drainLoop);

    log.info("MailRelay started for mailbox '{}'", mailbox);
  }

  /**
   * Stops the worker and answers every notification still queued.
   *
   * <p>A cycle in progress is allowed to finish. Queued notifications are
   * completed with {@link Outcome.Status#TRANSIENT_FAILURE} so that the push
   * source delivers them again. Calling this method more than once has no
   * further effect.
   */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }

    if (worker != null) {
      worker.shutdown();
      try {
        if (!worker.awaitTermination(STOP_TIMEOUT.toMillis(),
            TimeUnit.MILLISECONDS)) {
          log.warn("Mailbox '{}': drain worker did not finish within {}",
              mailbox, STOP_TIMEOUT);
          worker.shutdownNow();
        }
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        worker.shutdownNow();
      }
    }

    final int released = releasePending();

    log.info("MailRelay stopped for mailbox '{}' ({} pending notification(s)"
        + " released)", mailbox, released);
  }

  /**
   * Empties the queue, answering every notification with a transient
   * failure so that the push source delivers it again.
   *
   * @return the number of notifications released
   */
  private int releasePending() {
    final List<Notification> pending = queue.drainAll();
    for (final Notification notification : pending) {
      notification.responseHandle().complete(Outcome.transientFailure(
          notification.cursor(), "shutting down"));
    }
    return pending.size();
  }

  /**
   * Returns a point-in-time view of this engine.
   *
   * @return the status, never null
   */
  public SyncStatus status() {
    return state.snapshot(mailbox, queue.size());
  }

  /** Waits for work and drains the queue until stopped. */
  private void drainLoop() {
    while (!stopped.get()) {
      try {
        if (queue.awaitNotEmpty(pollInterval)) {
          while (!stopped.get() && tryDrain()) {
            metrics.queueDepthReported(mailbox, queue.size());
          }
        }
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      } catch (final RuntimeException e) {
        log.error("Mailbox '{}': drain loop error", mailbox, e);
      }
    }
  }

  /**
   * Resolves one notification and completes its response handle.
   *
   * @param notification the notification, never null
   */
  private void resolve(final Notification notification) {
    final long startNanos = System.nanoTime();

    Outcome outcome;
    try {
      outcome = resolveWithToken(notification);
    } catch (final RuntimeException e) {
      log.error("Mailbox '{}': unexpected failure resolving {}", mailbox,
          notification, e);
      outcome = Outcome.transientFailure(notification.cursor(),
          "unexpected failure: " + e.getMessage());
    }

    if (!notification.responseHandle().complete(outcome)) {
      log.info("Mailbox '{}': cursor {} was already answered {}; its replay"
          + " resolved as {}", mailbox, notification.cursor(),
          notification.responseHandle().future().join().status(),
          outcome.status());
    }

    final long durationMs = TimeUnit.NANOSECONDS.toMillis(
        System.nanoTime() - startNanos);
    metrics.notificationResolved(mailbox, outcome.status(), durationMs);
    log.info("Mailbox '{}': cursor {} -> {} ({}) in {} ms", mailbox,
        notification.cursor(), outcome.status(), outcome.message(),
        durationMs);
  }

  /**
   * Acquires a token and runs either the cold start or the normal path.
   *
   * @param notification the notification, never null
   * @return the outcome, never null
   */
  private Outcome resolveWithToken(final Notification notification) {
    final String token;
    try {
      token = tokenProvider.token();
    } catch (final RuntimeException e) {
      log.warn("Mailbox '{}': token acquisition failed: {}", mailbox,
          e.getMessage());
      return Outcome.transientFailure(notification.cursor(),
          "token acquisition failed: " + e.getMessage());
    }

    if (!state.isInitialized()) {
      return coldStart(notification, token);
    }

    try {
      return resolveWindow(notification, token);
    } catch (final RuntimeException e) {
      log.warn("Mailbox '{}': listing changes failed for cursor {}: {}",
          mailbox, notification.cursor(), e.getMessage());
      return Outcome.transientFailure(notification.cursor(),
          "change listing failed: " + e.getMessage());
    }
  }

  /**
   * Establishes the cursor baseline.
   *
   * <p>The stored cursor wins when a store is configured and holds one;
   * otherwise the mailbox's current cursor is fetched and stored. No changes
   * are resolved on this cycle.
   *
   * @param notification the notification that triggered the cold start,
   *                     never null
   * @param token        the bearer token, never null
   * @return the outcome, never null
   */
  private Outcome coldStart(final Notification notification,
      final String token) {

    if (!state.tryBeginInitialization()) {
      queue.requeueFront(notification);
      log.info("Mailbox '{}': cold start in progress, deferring {}", mailbox,
          notification);
      return Outcome.deferred(notification.cursor());
    }

    try {
      final long baseline = loadBaseline(token);
      state.establishBaseline(baseline);
      log.info("Mailbox '{}': baseline established at cursor {}", mailbox,
          baseline);
      return Outcome.baseline(notification.cursor(), baseline);
    } catch (final RuntimeException e) {
      log.error("Mailbox '{}': cold start failed: {}", mailbox,
          e.getMessage(), e);
      return Outcome.serverError(notification.cursor(),
          "cold start failed: " + e.getMessage());
    } finally {
      state.endInitialization();
    }
  }

  /**
   * Reads the baseline from the cursor store, falling back to the change
   * source.
   *
   * @param token the bearer token, never null
   * @return the baseline cursor
   */
  private long loadBaseline(final String token) {
    if (cursorStore != null) {
      final Optional<String> stored = cursorStore.read(cursorKey);
      if (stored.isPresent()) {
        final long cursor = parseStoredCursor(stored.get());
        log.info("Mailbox '{}': restored cursor {} from {}", mailbox, cursor,
            cursorStore.getClass().getSimpleName());
        return cursor;
      }
    }

    final long current = changeSource.currentCursor(token);

    if (cursorStore != null) {
      cursorStore.write(cursorKey, Long.toString(current));
    }
    return current;
  }

  /**
   * Resolves the window between the last processed cursor and the
   * notification's cursor.
   *
   * @param notification the notification, never null
   * @param token        the bearer token, never null
   * @return the outcome, never null
   */
  private Outcome resolveWindow(final Notification notification,
      final String token) {

    final long last = state.lastProcessedCursor().getAsLong();
    final long cursor = notification.cursor();

    if (state.isStale(cursor)) {
      log.debug("Mailbox '{}': cursor {} is not after {}, skipping", mailbox,
          cursor, last);
      return Outcome.stale(cursor, last);
    }

    final List<ChangeRecord> records;
    try {
      records = changeSource.listAddedItems(token, last);
    } catch (final CursorExpiredException e) {
      log.warn("Mailbox '{}': history since {} is gone, re-baselining at {}",
          mailbox, last, cursor);
      advanceAndPersist(cursor);
      return new Outcome(Outcome.Status.RESOLVED, cursor, 0, 0, 0,
          "cursor expired; re-baselined at " + cursor);
    }

    final Set<String> itemIds = new LinkedHashSet<>();
    for (final ChangeRecord record : records) {
      if (record.cursor() > last && record.cursor() <= cursor) {
        itemIds.add(record.itemId());
      }
    }

    int forwarded = 0;
    int skipped = 0;
    int failed = 0;

    for (final String itemId : itemIds) {
      try {
        final Set<String> tags = changeSource.tags(token, itemId);

        if (!tagPredicate.qualifies(tags)) {
          log.debug("Mailbox '{}': skipped item '{}' with tags {}", mailbox,
              itemId, tags);
          skipped++;
          continue;
        }

        forwardSink.forward(new ForwardPayload(itemId, mailbox, cursor, last,
            tags, notification.receivedAt(), notification.metadata()));

        forwarded++;
        metrics.itemForwarded(mailbox);
        log.info("Mailbox '{}': forwarded item '{}'", mailbox, itemId);

      } catch (final RuntimeException e) {
        failed++;
        metrics.itemFailed(mailbox, e);
        log.warn("Mailbox '{}': item '{}' failed: {}", mailbox, itemId,
            e.getMessage());
      }
    }

    advanceAndPersist(cursor);

    return Outcome.resolved(cursor, forwarded, skipped, failed);
  }

  /**
   * Advances the in-memory cursor and writes it to the store.
   *
   * <p>A store failure does not undo the advance: the window has already
   * been forwarded, and replaying it would forward its items again.
   *
   * @param cursor the cursor to advance to
   */
  private void advanceAndPersist(final long cursor) {
    state.advanceTo(cursor);

    if (cursorStore == null) {
      return;
    }

    final OptionalLong current = state.lastProcessedCursor();
    try {
      cursorStore.write(cursorKey, Long.toString(current.getAsLong()));
    } catch (final RuntimeException e) {
      log.error("Mailbox '{}': failed to persist cursor {}: {}", mailbox,
          current.getAsLong(), e.getMessage(), e);
      metrics.cursorPersistFailed(mailbox, e);
    }
  }

  /**
   * Parses a cursor read from the store.
   *
   * @param value the stored value, never null
   * @return the cursor
   * @throws CursorStoreException if the value is not a number
   */
  private long parseStoredCursor(final String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (final NumberFormatException e) {
      throw new CursorStoreException("Stored cursor for key '" + cursorKey
          + "' is not numeric: " + value, e);
    }
  }

  /**
   * A builder for constructing {@link MailRelay} instances.
   *
   * <p>Required: {@code mailbox}, {@code tokenProvider},
   * {@code changeSource} and {@code forwardSink}. Everything else has a
   * default.
   *
   * @author waabox(waabox[at]gmail[dot]com)
   */
  public static final class Builder {

    /** The mailbox served by the engine. */
    private String mailbox;

    /** The token provider. */
    private TokenProvider tokenProvider;

    /** The change source. */
    private ChangeSource changeSource;

    /** The forward sink. */
    private ForwardSink forwardSink;

    /** The optional cursor store. */
    private CursorStore cursorStore;

    /** The prefix of the cursor store key. */
    private String cursorKeyPrefix = "";

    /** The qualification predicate. */
    private TagPredicate tagPredicate = TagPredicate.acceptAll();

    /** The metrics reporter. */
    private MailRelayMetrics metrics = new NoopMailRelayMetrics();

    /** The maximum queue length. */
    private int maxQueueLength = DEFAULT_MAX_QUEUE_LENGTH;

    /** How long the worker waits for work before re-checking. */
    private Duration pollInterval = DEFAULT_POLL_INTERVAL;

    /** The engine state. */
    private SyncState state = new SyncState();

    /** Private constructor; use {@link MailRelay#builder()}. */
    private Builder() {
    }

    /**
     * Sets the mailbox served by the engine. It is also the cursor store
     * key.
     *
     * @param theMailbox the mailbox, never null or blank
     * @return this builder for chaining, never null
     */
    public Builder mailbox(final String theMailbox) {
      mailbox = theMailbox;
      return this;
    }

    /**
     * Sets the token provider.
     *
     * @param theTokenProvider the token provider, never null
     * @return this builder for chaining, never null
     */
    public Builder tokenProvider(final TokenProvider theTokenProvider) {
      tokenProvider = theTokenProvider;
      return this;
    }

    /**
     * Sets the change source.
     *
     * @param theChangeSource the change source, never null
     * @return this builder for chaining, never null
     */
    public Builder changeSource(final ChangeSource theChangeSource) {
      changeSource = theChangeSource;
      return this;
    }

    /**
     * Sets the forward sink.
     *
     * @param theForwardSink the forward sink, never null
     * @return this builder for chaining, never null
     */
    public Builder forwardSink(final ForwardSink theForwardSink) {
      forwardSink = theForwardSink;
      return this;
    }

    /**
     * Sets the optional cursor store.
     *
     * @param theCursorStore the cursor store, may be null for none
     * @return this builder for chaining, never null
     */
    public Builder cursorStore(final CursorStore theCursorStore) {
      cursorStore = theCursorStore;
      return this;
    }

    /**
     * Sets a prefix prepended to the mailbox to form the cursor store key.
     *
     * @param thePrefix the prefix, never null
     * @return this builder for chaining, never null
     */
    public Builder cursorKeyPrefix(final String thePrefix) {
      cursorKeyPrefix = Objects.requireNonNull(thePrefix,
          "cursorKeyPrefix must not be null");
      return this;
    }

    /**
     * Sets the qualification predicate.
     *
     * @param theTagPredicate the predicate, never null
     * @return this builder for chaining, never null
     */
    public Builder tagPredicate(final TagPredicate theTagPredicate) {
      tagPredicate = Objects.requireNonNull(theTagPredicate,
          "tagPredicate must not be null");
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * @param theMetrics the metrics reporter, never null
     * @return this builder for chaining, never null
     */
    public Builder metrics(final MailRelayMetrics theMetrics) {
      metrics = Objects.requireNonNull(theMetrics,
          "metrics must not be null");
      return this;
    }

    /**
     * Sets the maximum queue length.
     *
     * @param theMaxQueueLength the maximum length, must be greater than zero
     * @return this builder for chaining, never null
     */
    public Builder maxQueueLength(final int theMaxQueueLength) {
      if (theMaxQueueLength <= 0) {
        throw new IllegalArgumentException(
            "maxQueueLength must be greater than 0, got: "
                + theMaxQueueLength);
      }
      maxQueueLength = theMaxQueueLength;
      return this;
    }

    /**
     * Sets how long the worker waits for work before re-checking whether
     * it was stopped.
     *
     * @param thePollInterval the interval, never null and positive
     * @return this builder for chaining, never null
     */
    public Builder pollInterval(final Duration thePollInterval) {
      Objects.requireNonNull(thePollInterval,
          "pollInterval must not be null");
      if (thePollInterval.isNegative() || thePollInterval.isZero()) {
        throw new IllegalArgumentException(
            "pollInterval must be positive, got: " + thePollInterval);
      }
      pollInterval = thePollInterval;
      return this;
    }

    /**
     * Sets the engine state. Used to observe or pre-arrange state.
     *
     * @param theState the state, never null
     * @return this builder for chaining, never null
     */
    Builder state(final SyncState theState) {
      state = Objects.requireNonNull(theState, "state must not be null");
      return this;
    }

    /**
     * Builds the engine.
     *
     * @return a new engine, never null
     *
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if the mailbox is blank
     */
    public MailRelay build() {
      Objects.requireNonNull(mailbox, "mailbox must not be null");
      if (mailbox.isBlank()) {
        throw new IllegalArgumentException("mailbox must not be blank");
      }
      Objects.requireNonNull(tokenProvider, "tokenProvider must not be null");
      Objects.requireNonNull(changeSource, "changeSource must not be null");
      Objects.requireNonNull(forwardSink, "forwardSink must not be null");
      return new MailRelay(this);
    }
  }
}

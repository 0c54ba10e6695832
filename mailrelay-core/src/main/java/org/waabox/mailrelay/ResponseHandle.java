package org.waabox.mailrelay;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A one-shot channel through which the engine answers the request that
 * delivered a notification.
 *
 * <p>Only the first {@link #complete(Outcome)} call has an effect. A
 * notification deferred during cold start is answered with
 * {@link Outcome.Status#DEFERRED} and later resolved again when replayed;
 * that second answer is dropped here.
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ResponseHandle {

  /** The future holding the outcome, completed at most once. */
  private final CompletableFuture<Outcome> future = new CompletableFuture<>();

  /**
   * Completes this handle with the given outcome.
   *
   * @param outcome the outcome, never null
   * @return true if this call completed the handle, false if it was already
   *         completed
   */
  public boolean complete(final Outcome outcome) {
    return future.complete(outcome);
  }

  /**
   * Returns whether an outcome has been delivered.
   *
   * @return true once completed
   */
  public boolean isDone() {
    return future.isDone();
  }

  /**
   * Waits up to the given timeout for the outcome.
   *
   * @param timeout the maximum time to wait, never null
   * @return the outcome, or empty if none arrived in time
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public Optional<Outcome> await(final Duration timeout)
      throws InterruptedException {
    try {
      return Optional.of(future.get(timeout.toMillis(),
          TimeUnit.MILLISECONDS));
    } catch (final TimeoutException e) {
      return Optional.empty();
    } catch (final ExecutionException e) {
      throw new MailRelayException("Response handle failed", e.getCause());
    }
  }

  /**
   * Returns the underlying future, for callers that compose asynchronously.
   *
   * @return the future, never null
   */
  public CompletableFuture<Outcome> future() {
    return future;
  }
}

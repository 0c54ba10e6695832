package org.waabox.mailrelay.queue;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.waabox.mailrelay.Notification;

/**
 * FIFO buffer of notifications waiting to be resolved.
 *
 * <p>{@link #enqueue(Notification)} never blocks: once the configured maximum
 * length is reached it rejects the notification instead. A notification put
 * back with {@link #requeueFront(Notification)} is always accepted, because
 * it was already admitted once and must not be lost.
 *
 * <p>This class is thread-safe. Producers may enqueue while the engine is
 * draining.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NotificationQueue {

  /** The queued notifications, oldest first. */
  private final Deque<Notification> notifications = new ArrayDeque<>();

  /** Guards the deque. */
  private final ReentrantLock lock = new ReentrantLock();

  /** Signalled whenever a notification is added. */
  private final Condition notEmpty = lock.newCondition();

  /** The maximum number of notifications accepted by enqueue. */
  private final int maxLength;

  /**
   * Creates a new queue.
   *
   * @param theMaxLength the maximum queue length, must be greater than zero
   *
   * @throws IllegalArgumentException if the length is not positive
   */
  public NotificationQueue(final int theMaxLength) {
    if (theMaxLength <= 0) {
      throw new IllegalArgumentException(
          "maxLength must be greater than 0, got: " + theMaxLength);
    }
    maxLength = theMaxLength;
  }

  /**
   * Appends a notification at the tail.
   *
   * @param notification the notification, never null
   *
   * @throws QueueCapacityExceededException if the queue is full
   */
  public void enqueue(final Notification notification) {
    Objects.requireNonNull(notification, "notification must not be null");
    lock.lock();
    try {
      if (notifications.size() >= maxLength) {
        throw new QueueCapacityExceededException(maxLength);
      }
      notifications.addLast(notification);
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Puts a notification back at the head, ahead of everything queued, so it
   * keeps its place relative to later arrivals. Capacity is not enforced.
   *
   * @param notification the notification, never null
   */
  public void requeueFront(final Notification notification) {
    Objects.requireNonNull(notification, "notification must not be null");
    lock.lock();
    try {
      notifications.addFirst(notification);
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes and returns the oldest notification.
   *
   * @return the oldest notification, or empty if the queue is empty
   */
  public Optional<Notification> dequeueOldest() {
    lock.lock();
    try {
      return Optional.ofNullable(notifications.pollFirst());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Blocks until the queue holds at least one notification or the timeout
   * elapses.
   *
   * @param timeout the maximum time to wait, never null
   * @return true if the queue is not empty
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public boolean awaitNotEmpty(final Duration timeout)
      throws InterruptedException {
    long nanos = timeout.toNanos();
    lock.lockInterruptibly();
    try {
      while (notifications.isEmpty()) {
        if (nanos <= 0L) {
          return false;
        }
        nanos = notEmpty.awaitNanos(nanos);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes every queued notification.
   *
   * @return the removed notifications, oldest first, never null
   */
  public List<Notification> drainAll() {
    lock.lock();
    try {
      final List<Notification> drained = new ArrayList<>(notifications);
      notifications.clear();
      return drained;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of queued notifications.
   *
   * @return the queue depth
   */
  public int size() {
    lock.lock();
    try {
      return notifications.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the maximum length accepted by {@link #enqueue(Notification)}.
   *
   * @return the maximum length
   */
  public int maxLength() {
    return maxLength;
  }
}

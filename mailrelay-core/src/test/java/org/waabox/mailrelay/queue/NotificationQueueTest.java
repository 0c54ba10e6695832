package org.waabox.mailrelay.queue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;
import org.waabox.mailrelay.Notification;
import org.waabox.mailrelay.PushMetadata;
import org.waabox.mailrelay.ResponseHandle;

/**
 * Tests for {@link NotificationQueue}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class NotificationQueueTest {

  private static Notification notification(final long cursor) {
    return new Notification(cursor, Instant.now(), PushMetadata.empty(),
        new ResponseHandle());
  }

  @Test
  void whenDequeuing_givenSeveralNotifications_shouldKeepArrivalOrder() {
    final NotificationQueue queue = new NotificationQueue(10);
    queue.enqueue(notification(3));
    queue.enqueue(notification(1));
    queue.enqueue(notification(2));

    assertEquals(3L, queue.dequeueOldest().orElseThrow().cursor());
    assertEquals(1L, queue.dequeueOldest().orElseThrow().cursor());
    assertEquals(2L, queue.dequeueOldest().orElseThrow().cursor());
    assertTrue(queue.dequeueOldest().isEmpty());
  }

  @Test
  void whenEnqueuing_givenFullQueue_shouldThrowAndKeepContents() {
    final NotificationQueue queue = new NotificationQueue(2);
    queue.enqueue(notification(1));
    queue.enqueue(notification(2));

    final QueueCapacityExceededException e = assertThrows(
        QueueCapacityExceededException.class,
        () -> queue.enqueue(notification(3)));

    assertTrue(e.getMessage().contains("2"));
    assertEquals(2, queue.size());
  }

  @Test
  void whenRequeuing_givenFullQueue_shouldPutItFirstAnyway() {
    final NotificationQueue queue = new NotificationQueue(1);
    queue.enqueue(notification(2));

    queue.requeueFront(notification(1));

    assertEquals(2, queue.size());
    assertEquals(1L, queue.dequeueOldest().orElseThrow().cursor());
  }

  @Test
  void whenDraining_givenContents_shouldEmptyTheQueue() {
    final NotificationQueue queue = new NotificationQueue(5);
    queue.enqueue(notification(1));
    queue.enqueue(notification(2));

    final List<Notification> drained = queue.drainAll();

    assertEquals(2, drained.size());
    assertEquals(1L, drained.get(0).cursor());
    assertEquals(0, queue.size());
  }

  @Test
  void whenAwaiting_givenEmptyQueue_shouldTimeOut() throws Exception {
    final NotificationQueue queue = new NotificationQueue(5);

    assertFalse(queue.awaitNotEmpty(Duration.ofMillis(20)));
  }

  @Test
  void whenAwaiting_givenConcurrentEnqueue_shouldWakeUp() throws Exception {
    final NotificationQueue queue = new NotificationQueue(5);
    final AtomicBoolean woke = new AtomicBoolean();
    final CountDownLatch done = new CountDownLatch(1);

    final Thread waiter = new Thread(() -> {
      try {
        woke.set(queue.awaitNotEmpty(Duration.ofSeconds(5)));
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
      } finally {
        done.countDown();
      }
    });
    waiter.start();

    queue.enqueue(notification(1));

    assertTrue(done.await(5, TimeUnit.SECONDS));
    assertTrue(woke.get());
  }

  @Test
  void whenCreating_givenNonPositiveLength_shouldFail() {
    assertThrows(IllegalArgumentException.class,
        () -> new NotificationQueue(0));
  }
}

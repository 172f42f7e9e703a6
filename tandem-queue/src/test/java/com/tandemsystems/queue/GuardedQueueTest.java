package com.tandemsystems.queue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GuardedQueue including:
 * - Blocking take and timed dequeue
 * - Thread interruption
 * - Concurrent producer and consumer ordering
 */
class GuardedQueueTest {

    @Test
    void testBasicEnqueueAndDequeue() {
        GuardedQueue<String> queue = new GuardedQueue<>();

        queue.enqueue("message1");
        queue.enqueue("message2");

        assertEquals(Optional.of("message1"), queue.peek());
        assertEquals(Optional.of("message1"), queue.dequeue());
        assertEquals(Optional.of("message2"), queue.dequeue());
        assertTrue(queue.dequeue().isEmpty());
    }

    @Test
    void testEnqueueRejectsNull() {
        GuardedQueue<String> queue = new GuardedQueue<>();
        assertThrows(NullPointerException.class, () -> queue.enqueue(null));
    }

    @Test
    void testDequeueWithTimeoutExpires() throws InterruptedException {
        GuardedQueue<String> queue = new GuardedQueue<>();

        long start = System.nanoTime();
        Optional<String> result = queue.dequeue(100, TimeUnit.MILLISECONDS);
        long elapsed = System.nanoTime() - start;

        assertTrue(result.isEmpty());
        assertTrue(elapsed >= TimeUnit.MILLISECONDS.toNanos(100));
    }

    @Test
    @Timeout(1)
    void testZeroTimeoutMakesOneAttempt() throws InterruptedException {
        GuardedQueue<String> queue = new GuardedQueue<>();
        assertTrue(queue.dequeue(0, TimeUnit.SECONDS).isEmpty());

        queue.enqueue("ready");
        assertEquals(Optional.of("ready"), queue.dequeue(0, TimeUnit.SECONDS));
    }

    @Test
    @Timeout(5)
    void testTakeWaitsForEnqueue() throws Exception {
        GuardedQueue<String> queue = new GuardedQueue<>();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> taken = executor.submit(queue::take);
            Thread.sleep(50);
            assertFalse(taken.isDone());

            queue.enqueue("late");

            assertEquals("late", taken.get(1, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @Timeout(5)
    void testTimedDequeueWakesOnEnqueue() throws Exception {
        GuardedQueue<String> queue = new GuardedQueue<>();
        Thread producer = new Thread(() -> {
            try {
                Thread.sleep(50);
                queue.enqueue("wake");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();

        assertEquals(Optional.of("wake"), queue.dequeue(2, TimeUnit.SECONDS));
        producer.join();
    }

    @Test
    @Timeout(5)
    void testTakeWithInterruption() throws Exception {
        GuardedQueue<String> queue = new GuardedQueue<>();
        CountDownLatch threadStarted = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean(false);

        Thread waiter = new Thread(() -> {
            threadStarted.countDown();
            try {
                queue.take();
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
        });

        waiter.start();
        threadStarted.await();
        Thread.sleep(50); // Give thread time to enter take()
        waiter.interrupt();
        waiter.join(1000);

        assertTrue(interrupted.get(), "Thread should have been interrupted");
    }

    @Test
    @Timeout(10)
    void testConcurrentProducerAndConsumerKeepOrder() throws Exception {
        GuardedQueue<Integer> queue = new GuardedQueue<>();
        int count = 50_000;
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> producer = executor.submit(() -> {
                for (int i = 0; i < count; i++) {
                    queue.enqueue(i);
                }
            });
            Future<List<Integer>> consumer = executor.submit(() -> {
                List<Integer> received = new ArrayList<>(count);
                while (received.size() < count) {
                    received.add(queue.take());
                }
                return received;
            });

            producer.get();
            List<Integer> received = consumer.get();
            for (int i = 0; i < count; i++) {
                assertEquals(i, received.get(i));
            }
            assertTrue(queue.isEmpty());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testSizeSnapshotAndClear() {
        GuardedQueue<String> queue = new GuardedQueue<>();
        queue.enqueue("a");
        queue.enqueue("b");
        queue.dequeue();
        queue.enqueue("c");

        assertEquals(2, queue.size());
        assertEquals(List.of("b", "c"), queue.snapshot());
        assertEquals(1, queue.rotationCount());

        queue.clear();
        assertTrue(queue.isEmpty());
        assertEquals(0, queue.size());
    }
}

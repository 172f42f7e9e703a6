package com.tandemsystems.queue;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * A {@link MessageQueue} whose consumer can wait for items without polling.
 *
 * @param <T> The type of items stored in the queue
 */
public interface BlockingMessageQueue<T> extends MessageQueue<T> {

    /**
     * Retrieves and removes the head of this queue, waiting up to the
     * specified wait time if necessary for an item to become available.
     * A non-positive timeout makes exactly one non-blocking attempt.
     *
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return the head of this queue, or empty if the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    Optional<T> dequeue(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Retrieves and removes the head of this queue, waiting if necessary
     * until an item becomes available.
     *
     * @return the head of this queue
     * @throws InterruptedException if interrupted while waiting
     */
    T take() throws InterruptedException;
}

package com.tandemsystems.queue;

import java.util.List;
import java.util.Optional;

/**
 * Abstraction for the FIFO queues that back a channel.
 * An empty queue is a normal state: {@link #dequeue()} and {@link #peek()} report it
 * with an empty result, never an exception.
 *
 * @param <T> The type of items stored in the queue
 */
public interface MessageQueue<T> {

    /**
     * Appends an item to the tail of this queue. Always succeeds.
     *
     * @param item the item to add, not null
     */
    void enqueue(T item);

    /**
     * Retrieves and removes the head of this queue.
     *
     * @return the head of this queue, or empty if the queue is empty
     */
    Optional<T> dequeue();

    /**
     * Retrieves the head of this queue without removing it.
     * Consecutive peeks with no intervening mutation return the same item.
     *
     * @return the head of this queue, or empty if the queue is empty
     */
    Optional<T> peek();

    /**
     * Returns the number of items in this queue.
     *
     * @return the number of items
     */
    int size();

    /**
     * Returns true if this queue contains no items.
     *
     * @return true if empty
     */
    boolean isEmpty();

    /**
     * Removes all items from this queue.
     */
    void clear();

    /**
     * Returns a copy of the queue contents in dequeue order.
     *
     * @return the items, head first
     */
    List<T> snapshot();
}

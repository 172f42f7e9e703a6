package com.tandemsystems.queue;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Amortized O(1) FIFO queue built from two stacks.
 *
 * Items are pushed onto {@code rear}. {@code front} holds items in dequeue order. When
 * {@code front} runs dry, {@code rear} is reversed into it in a single rotation, so each
 * item is moved at most once and the O(n) rotation is paid for by the n enqueues that
 * preceded it. The logical content is always {@code front ++ reverse(rear)}.
 *
 * This implementation is not thread-safe. Wrap it in a {@link GuardedQueue} when the
 * producer and consumer run on different threads.
 *
 * @param <T> The type of items
 */
public class TwoStackQueue<T> implements MessageQueue<T> {

    private final LinkedStack<T> front = new LinkedStack<>();
    private final LinkedStack<T> rear = new LinkedStack<>();
    private long rotations;

    @Override
    public void enqueue(T item) {
        Objects.requireNonNull(item, "Item cannot be null");
        rear.push(item);
    }

    @Override
    public Optional<T> dequeue() {
        if (front.isEmpty()) {
            if (rear.isEmpty()) {
                return Optional.empty();
            }
            rotate();
            return front.pop();
        }

        if (front.size() == 1) {
            Optional<T> head = front.pop();
            if (rear.size() == 1) {
                // A lone rear item moves across without a reversal
                front.push(rear.pop().orElseThrow());
            } else if (!rear.isEmpty()) {
                rotate();
            }
            return head;
        }

        return front.pop();
    }

    @Override
    public Optional<T> peek() {
        if (front.isEmpty()) {
            if (rear.isEmpty()) {
                return Optional.empty();
            }
            rotate();
            return front.peek();
        }

        if (front.size() == 1 && !rear.isEmpty()) {
            // Same rotation as dequeue, with the head put back on top
            T head = front.pop().orElseThrow();
            rotate();
            front.push(head);
            return Optional.of(head);
        }

        return front.peek();
    }

    @Override
    public int size() {
        return front.size() + rear.size();
    }

    @Override
    public boolean isEmpty() {
        return front.isEmpty() && rear.isEmpty();
    }

    @Override
    public void clear() {
        front.clear();
        rear.clear();
    }

    @Override
    public List<T> snapshot() {
        List<T> items = front.toList();
        List<T> pending = rear.toList();
        Collections.reverse(pending);
        items.addAll(pending);
        return items;
    }

    /**
     * Returns the number of rear-to-front rotations performed so far.
     *
     * @return the rotation count
     */
    public long rotationCount() {
        return rotations;
    }

    int frontSize() {
        return front.size();
    }

    int rearSize() {
        return rear.size();
    }

    /**
     * Moves every rear item onto front. Requires front to be empty.
     */
    private void rotate() {
        while (!rear.isEmpty()) {
            front.push(rear.pop().orElseThrow());
        }
        rear.clear();
        rotations++;
    }

    @Override
    public String toString() {
        return "TwoStackQueue{front=" + front.toList() + ", rear=" + rear.toList() + "}";
    }
}

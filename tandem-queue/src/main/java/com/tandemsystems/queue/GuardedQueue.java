package com.tandemsystems.queue;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe queue that guards a {@link TwoStackQueue} with a single lock.
 *
 * Every operation, including the rotation that mutates both stacks, runs while holding
 * the lock, so the two-stack representation is never observed half-rotated. Consumers
 * waiting in {@link #take()} or {@link #dequeue(long, TimeUnit)} sleep on a condition
 * that is signalled by each enqueue rather than spinning.
 *
 * Intended for one producer and one consumer per queue.
 *
 * @param <T> The type of items
 */
public class GuardedQueue<T> implements BlockingMessageQueue<T> {

    private final TwoStackQueue<T> delegate;
    private final ReentrantLock lock;
    private final Condition notEmpty;

    /**
     * Creates an empty guarded queue.
     */
    public GuardedQueue() {
        this(new TwoStackQueue<>());
    }

    /**
     * Creates a guarded queue around an existing two-stack queue.
     * The caller must not touch the delegate directly afterwards.
     *
     * @param delegate the queue to guard
     */
    public GuardedQueue(TwoStackQueue<T> delegate) {
        this.delegate = delegate;
        this.lock = new ReentrantLock();
        this.notEmpty = lock.newCondition();
    }

    @Override
    public void enqueue(T item) {
        lock.lock();
        try {
            delegate.enqueue(item);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> dequeue() {
        lock.lock();
        try {
            return delegate.dequeue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> dequeue(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            Optional<T> item = delegate.dequeue();
            while (item.isEmpty()) {
                if (nanos <= 0L) {
                    return Optional.empty(); // Timeout
                }
                nanos = notEmpty.awaitNanos(nanos);
                item = delegate.dequeue();
            }
            return item;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            Optional<T> item = delegate.dequeue();
            while (item.isEmpty()) {
                notEmpty.await();
                item = delegate.dequeue();
            }
            return item.get();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> peek() {
        lock.lock();
        try {
            return delegate.peek();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return delegate.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isEmpty() {
        lock.lock();
        try {
            return delegate.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            delegate.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<T> snapshot() {
        lock.lock();
        try {
            return delegate.snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of rotations the underlying queue has performed.
     *
     * @return the rotation count
     */
    public long rotationCount() {
        lock.lock();
        try {
            return delegate.rotationCount();
        } finally {
            lock.unlock();
        }
    }
}

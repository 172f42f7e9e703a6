package com.tandemsystems.config;

/**
 * How the queues behind a channel are protected against concurrent access.
 */
public enum ConcurrencyMode {
    /**
     * No locking. Waiting receivers poll the inbox and yield between checks.
     *
     * For single-thread or externally synchronized use only. The queues publish
     * nothing across threads, so a receiver polling in one thread is not guaranteed
     * to ever see a send made from another thread without a happens-before edge
     * supplied by the caller. Use {@link #GUARDED} for channels shared between
     * processes.
     */
    UNSYNCHRONIZED,

    /**
     * Each queue is guarded by its own lock and signals waiting receivers on enqueue.
     */
    GUARDED
}

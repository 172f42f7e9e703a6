package com.tandemsystems.queue.config;

import com.tandemsystems.config.ChannelConfig;
import com.tandemsystems.queue.MessageQueue;

/**
 * Strategy interface for creating the queues behind a channel.
 * Lets each concurrency mode supply its own queue without changing the provider.
 *
 * @param <T> The item type
 */
@FunctionalInterface
public interface QueueCreationStrategy<T> {

    /**
     * Creates a queue according to this strategy.
     *
     * @param config The channel configuration
     * @return A new, empty queue
     */
    MessageQueue<T> createQueue(ChannelConfig config);
}

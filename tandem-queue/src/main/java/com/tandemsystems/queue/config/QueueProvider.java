package com.tandemsystems.queue.config;

import com.tandemsystems.config.ChannelConfig;
import com.tandemsystems.queue.MessageQueue;

/**
 * Creates queues for channels.
 *
 * @param <T> The item type
 */
public interface QueueProvider<T> {

    /**
     * Creates an empty queue suited to the given configuration.
     *
     * @param config The channel configuration, or null for defaults
     * @return A new queue
     */
    MessageQueue<T> createQueue(ChannelConfig config);
}

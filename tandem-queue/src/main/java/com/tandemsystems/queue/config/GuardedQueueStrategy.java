package com.tandemsystems.queue.config;

import com.tandemsystems.config.ChannelConfig;
import com.tandemsystems.queue.GuardedQueue;
import com.tandemsystems.queue.MessageQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates lock-guarded queues whose consumers can block without polling.
 *
 * @param <T> The item type
 */
public class GuardedQueueStrategy<T> implements QueueCreationStrategy<T> {
    private static final Logger logger = LoggerFactory.getLogger(GuardedQueueStrategy.class);

    @Override
    public MessageQueue<T> createQueue(ChannelConfig config) {
        logger.debug("Creating GuardedQueue");
        return new GuardedQueue<>();
    }
}

package com.tandemsystems.queue.config;

import com.tandemsystems.config.ChannelConfig;
import com.tandemsystems.queue.MessageQueue;
import com.tandemsystems.queue.TwoStackQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates bare {@link TwoStackQueue}s with no locking.
 *
 * @param <T> The item type
 */
public class UnsynchronizedQueueStrategy<T> implements QueueCreationStrategy<T> {
    private static final Logger logger = LoggerFactory.getLogger(UnsynchronizedQueueStrategy.class);

    @Override
    public MessageQueue<T> createQueue(ChannelConfig config) {
        logger.debug("Creating unsynchronized TwoStackQueue, poll interval: {}", config.getPollInterval());
        return new TwoStackQueue<>();
    }
}

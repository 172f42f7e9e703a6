package com.tandemsystems.queue.config;

import com.tandemsystems.config.ChannelConfig;
import com.tandemsystems.config.ConcurrencyMode;
import com.tandemsystems.queue.MessageQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Default queue provider that picks a creation strategy from the configured
 * {@link ConcurrencyMode}.
 *
 * - UNSYNCHRONIZED: TwoStackQueue (no locking, polling receivers)
 * - GUARDED/Default: GuardedQueue (locked, signalling receivers)
 */
public class DefaultQueueProvider<T> implements QueueProvider<T> {
    private static final Logger logger = LoggerFactory.getLogger(DefaultQueueProvider.class);

    private final Map<ConcurrencyMode, QueueCreationStrategy<T>> strategies;
    private final QueueCreationStrategy<T> defaultStrategy;

    public DefaultQueueProvider() {
        this.strategies = new EnumMap<>(ConcurrencyMode.class);
        this.strategies.put(ConcurrencyMode.UNSYNCHRONIZED, new UnsynchronizedQueueStrategy<>());
        this.strategies.put(ConcurrencyMode.GUARDED, new GuardedQueueStrategy<>());
        this.defaultStrategy = new GuardedQueueStrategy<>();
    }

    /**
     * Replaces the strategy used for a concurrency mode.
     *
     * @param mode the concurrency mode
     * @param strategy the strategy to use for it
     * @return this provider
     */
    public DefaultQueueProvider<T> withStrategy(ConcurrencyMode mode, QueueCreationStrategy<T> strategy) {
        strategies.put(mode, strategy);
        return this;
    }

    @Override
    public MessageQueue<T> createQueue(ChannelConfig config) {
        ChannelConfig effectiveConfig = (config != null) ? config : new ChannelConfig();

        logger.debug("DefaultQueueProvider creating queue - config: {}", effectiveConfig);

        QueueCreationStrategy<T> strategy =
                strategies.getOrDefault(effectiveConfig.getConcurrencyMode(), defaultStrategy);
        return strategy.createQueue(effectiveConfig);
    }
}

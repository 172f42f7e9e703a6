package com.tandemsystems.config;

import com.google.common.base.MoreObjects;

import java.time.Duration;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Configuration for channels and the queues backing them.
 */
public class ChannelConfig {
    // Default values for channel configuration
    public static final ConcurrencyMode DEFAULT_CONCURRENCY_MODE = ConcurrencyMode.GUARDED;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

    private ConcurrencyMode concurrencyMode;
    private Duration pollInterval;

    /**
     * Creates a new ChannelConfig with default values.
     */
    public ChannelConfig() {
        this.concurrencyMode = DEFAULT_CONCURRENCY_MODE;
        this.pollInterval = DEFAULT_POLL_INTERVAL;
    }

    /**
     * Sets the concurrency mode used when creating queues.
     *
     * @param concurrencyMode The concurrency mode
     * @return This ChannelConfig instance
     */
    public ChannelConfig setConcurrencyMode(ConcurrencyMode concurrencyMode) {
        this.concurrencyMode = Objects.requireNonNull(concurrencyMode, "concurrencyMode cannot be null");
        return this;
    }

    /**
     * Gets the concurrency mode used when creating queues.
     *
     * @return The concurrency mode
     */
    public ConcurrencyMode getConcurrencyMode() {
        return concurrencyMode;
    }

    /**
     * Sets the time a polling receiver sleeps between unsuccessful checks
     * of an unsynchronized inbox during a bounded wait.
     *
     * @param pollInterval The poll interval, must be positive
     * @return This ChannelConfig instance
     */
    public ChannelConfig setPollInterval(Duration pollInterval) {
        Objects.requireNonNull(pollInterval, "pollInterval cannot be null");
        checkArgument(!pollInterval.isNegative() && !pollInterval.isZero(),
                "pollInterval must be positive: %s", pollInterval);
        this.pollInterval = pollInterval;
        return this;
    }

    /**
     * Gets the poll interval.
     *
     * @return The poll interval
     */
    public Duration getPollInterval() {
        return pollInterval;
    }

    /**
     * Determines if queues created with this configuration support blocking waits.
     *
     * @return true if the concurrency mode is GUARDED
     */
    public boolean isGuarded() {
        return concurrencyMode == ConcurrencyMode.GUARDED;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("concurrencyMode", concurrencyMode)
                .add("pollInterval", pollInterval)
                .toString();
    }
}

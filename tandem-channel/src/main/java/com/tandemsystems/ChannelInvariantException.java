package com.tandemsystems;

/**
 * Thrown when a channel observes a state its single-consumer contract rules out,
 * such as an inbox that reported a pending message and then yielded nothing.
 * Not recoverable: it means two consumers are draining the same inbox.
 */
public class ChannelInvariantException extends RuntimeException {

    /** The ID of the channel where the violation was observed. */
    private final String channelId;

    /**
     * Creates a new ChannelInvariantException with the specified detail message and channel ID.
     *
     * @param message the detail message
     * @param channelId the ID of the channel where the violation was observed
     */
    public ChannelInvariantException(String message, String channelId) {
        super(message);
        this.channelId = channelId;
    }

    /**
     * Returns the ID of the channel where the violation was observed.
     *
     * @return the channel ID
     */
    public String getChannelId() {
        return channelId;
    }
}

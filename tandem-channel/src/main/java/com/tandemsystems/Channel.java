package com.tandemsystems;

import com.google.common.base.MoreObjects;
import com.tandemsystems.box.Box;
import com.tandemsystems.config.ChannelConfig;
import com.tandemsystems.queue.MessageQueue;

import java.util.Objects;

/**
 * Shared handle for a bidirectional channel: one queue per direction.
 *
 * The handle itself is never used to send or receive. Endpoints obtain a
 * {@link ChannelView} through {@link Channels#makeSender(Channel)} or
 * {@link Channels#makeReceiver(Channel)}; both views reference these same two queues.
 */
public final class Channel {

    private final String id;
    private final MessageQueue<Box> inbox;
    private final MessageQueue<Box> outbox;
    private final ChannelConfig config;

    /**
     * Creates a channel over the given queues.
     * Most callers should use {@link Channels#newChannel()} instead.
     *
     * @param id the channel ID
     * @param inbox the queue the sender view reads from
     * @param outbox the queue the sender view writes to
     * @param config the channel configuration
     */
    public Channel(String id, MessageQueue<Box> inbox, MessageQueue<Box> outbox, ChannelConfig config) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.inbox = Objects.requireNonNull(inbox, "inbox cannot be null");
        this.outbox = Objects.requireNonNull(outbox, "outbox cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        if (inbox == outbox) {
            throw new IllegalArgumentException("inbox and outbox must be distinct queues");
        }
    }

    public String id() {
        return id;
    }

    public MessageQueue<Box> inbox() {
        return inbox;
    }

    public MessageQueue<Box> outbox() {
        return outbox;
    }

    public ChannelConfig config() {
        return config;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("inbox", inbox.size())
                .add("outbox", outbox.size())
                .toString();
    }
}

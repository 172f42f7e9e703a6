package com.tandemsystems;

import com.tandemsystems.box.Box;
import com.tandemsystems.config.ChannelConfig;
import com.tandemsystems.queue.config.DefaultQueueProvider;
import com.tandemsystems.queue.config.QueueProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Factory methods for channels and their endpoint views.
 *
 * <pre>{@code
 * Channel channel = Channels.newChannel();
 * ChannelView sender = Channels.makeSender(channel);
 * ChannelView receiver = Channels.makeReceiver(channel);
 *
 * sender.send("hi");
 * String greeting = receiver.await(String.class);
 * receiver.send("reply");
 * }</pre>
 */
public final class Channels {
    private static final Logger logger = LoggerFactory.getLogger(Channels.class);

    private static final AtomicLong channelCounter = new AtomicLong();
    private static final QueueProvider<Box> defaultQueueProvider = new DefaultQueueProvider<>();

    private Channels() {
    }

    /**
     * Creates a channel with two empty queues and default configuration.
     *
     * @return a new channel
     */
    public static Channel newChannel() {
        return newChannel(new ChannelConfig());
    }

    /**
     * Creates a channel with two empty queues.
     *
     * @param config the channel configuration
     * @return a new channel
     */
    public static Channel newChannel(ChannelConfig config) {
        return newChannel(config, defaultQueueProvider);
    }

    /**
     * Creates a channel whose queues come from the given provider.
     *
     * @param config the channel configuration
     * @param queueProvider the provider that creates both queues
     * @return a new channel
     */
    public static Channel newChannel(ChannelConfig config, QueueProvider<Box> queueProvider) {
        Objects.requireNonNull(config, "config cannot be null");
        Objects.requireNonNull(queueProvider, "queueProvider cannot be null");
        String id = "channel-" + channelCounter.incrementAndGet();
        Channel channel = new Channel(id, queueProvider.createQueue(config), queueProvider.createQueue(config), config);
        logger.debug("Created channel {} with config {}", id, config);
        return channel;
    }

    /**
     * Returns the owner's view: reads the channel's inbox, writes its outbox.
     *
     * @param channel the shared channel handle
     * @return a sender view aliasing the channel's queues
     */
    public static ChannelView makeSender(Channel channel) {
        Objects.requireNonNull(channel, "channel cannot be null");
        return new ChannelView(channel, ChannelView.Role.SENDER, channel.inbox(), channel.outbox());
    }

    /**
     * Returns the mirrored view: reads the channel's outbox, writes its inbox.
     * Whatever the sender view sends, this view receives, and vice versa.
     *
     * @param channel the shared channel handle
     * @return a receiver view aliasing the channel's queues
     */
    public static ChannelView makeReceiver(Channel channel) {
        Objects.requireNonNull(channel, "channel cannot be null");
        return new ChannelView(channel, ChannelView.Role.RECEIVER, channel.outbox(), channel.inbox());
    }
}

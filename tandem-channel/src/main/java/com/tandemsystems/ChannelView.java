package com.tandemsystems;

import com.google.common.math.LongMath;
import com.tandemsystems.box.Box;
import com.tandemsystems.queue.BlockingMessageQueue;
import com.tandemsystems.queue.MessageQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.RoundingMode;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * One endpoint of a {@link Channel}.
 *
 * A view is a lightweight pair of queue references. It never copies queue contents and
 * holds no ownership of them. The sender view and the receiver view of the same channel
 * reference the same two queues with the roles swapped, so the sender's outbox is the
 * receiver's inbox and the receiver's outbox is the sender's inbox.
 *
 * Each direction supports one producer and one consumer.
 */
public final class ChannelView {
    private static final Logger logger = LoggerFactory.getLogger(ChannelView.class);

    /**
     * Which orientation of the channel this view has.
     */
    public enum Role {
        /** Reads the channel's inbox and writes its outbox. */
        SENDER,
        /** Reads the channel's outbox and writes its inbox. */
        RECEIVER
    }

    private final Channel channel;
    private final Role role;
    private final MessageQueue<Box> inbox;
    private final MessageQueue<Box> outbox;

    ChannelView(Channel channel, Role role, MessageQueue<Box> inbox, MessageQueue<Box> outbox) {
        this.channel = channel;
        this.role = role;
        this.inbox = inbox;
        this.outbox = outbox;
    }

    /**
     * Sends an item to the other endpoint. Never blocks and never fails.
     *
     * @param item the item to send, may be null
     */
    public void send(Object item) {
        outbox.enqueue(Box.pack(item));
        logger.trace("{} {} sent {}", channel.id(), role, item);
    }

    /**
     * Takes the next item from the inbox without waiting.
     *
     * @return the next item, or empty if nothing is queued
     */
    public Optional<Box> receive() {
        return inbox.dequeue();
    }

    /**
     * Takes the next item from the inbox without waiting and unpacks it.
     *
     * @param type the payload type both endpoints agreed on
     * @param <T> the payload type
     * @return the next payload, or empty if nothing is queued
     * @throws ClassCastException if the payload is not of the given type
     */
    public <T> Optional<T> receive(Class<T> type) {
        return receive().map(box -> box.unsafeUnpack(type));
    }

    /**
     * Checks whether an item is waiting in the inbox.
     *
     * @return true if the next receive would return an item
     */
    public boolean hasNext() {
        return inbox.peek().isPresent();
    }

    /**
     * Waits until an item arrives and takes it.
     *
     * A guarded inbox is waited on without spinning. An unsynchronized inbox is polled,
     * yielding the thread between checks; a send from another thread is only seen if the
     * caller synchronizes access to the channel (see {@link com.tandemsystems.config.ConcurrencyMode#UNSYNCHRONIZED}).
     *
     * @return the next item
     * @throws InterruptedException if interrupted while waiting
     * @throws ChannelInvariantException if another consumer drained the inbox between check and take
     */
    public Box await() throws InterruptedException {
        if (inbox instanceof BlockingMessageQueue) {
            return ((BlockingMessageQueue<Box>) inbox).take();
        }

        while (true) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Interrupted while awaiting on " + channel.id());
            }
            if (hasNext()) {
                return takeChecked();
            }
            Thread.yield();
        }
    }

    /**
     * Waits until an item arrives and unpacks it.
     *
     * @param type the payload type both endpoints agreed on
     * @param <T> the payload type
     * @return the next payload
     * @throws InterruptedException if interrupted while waiting
     */
    public <T> T await(Class<T> type) throws InterruptedException {
        return await().unsafeUnpack(type);
    }

    /**
     * Waits up to the given number of seconds for an item.
     *
     * @param timeoutSeconds the maximum wait in seconds
     * @return the next item, or empty if none arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<Box> awaitTimeout(long timeoutSeconds) throws InterruptedException {
        return awaitTimeout(timeoutSeconds, TimeUnit.SECONDS);
    }

    /**
     * Waits up to the given duration for an item.
     *
     * @param timeout the maximum wait
     * @return the next item, or empty if none arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<Box> awaitTimeout(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        return awaitTimeout(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Waits up to the given duration for an item and unpacks it.
     *
     * @param timeout the maximum wait
     * @param type the payload type both endpoints agreed on
     * @param <T> the payload type
     * @return the next payload, or empty if none arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    public <T> Optional<T> awaitTimeout(Duration timeout, Class<T> type) throws InterruptedException {
        return awaitTimeout(timeout).map(box -> box.unsafeUnpack(type));
    }

    /**
     * Waits up to the given time for an item.
     *
     * An unsynchronized inbox is checked, then re-checked after each sleep of one poll
     * interval until the timeout is used up. Once no time remains one final non-blocking
     * receive is attempted, so a zero timeout returns at once.
     *
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return the next item, or empty if none arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<Box> awaitTimeout(long timeout, TimeUnit unit) throws InterruptedException {
        Objects.requireNonNull(unit, "unit cannot be null");
        checkArgument(timeout >= 0, "timeout cannot be negative: %s", timeout);

        if (inbox instanceof BlockingMessageQueue) {
            return ((BlockingMessageQueue<Box>) inbox).dequeue(timeout, unit);
        }

        long pollNanos = channel.config().getPollInterval().toNanos();
        long remainingPolls = LongMath.divide(unit.toNanos(timeout), pollNanos, RoundingMode.CEILING);
        while (true) {
            if (hasNext()) {
                return Optional.of(takeChecked());
            }
            if (remainingPolls <= 0) {
                return receive();
            }
            TimeUnit.NANOSECONDS.sleep(pollNanos);
            remainingPolls--;
        }
    }

    /**
     * Returns the number of items waiting in this view's inbox.
     *
     * @return the inbox size
     */
    public int pending() {
        return inbox.size();
    }

    public Role role() {
        return role;
    }

    public String channelId() {
        return channel.id();
    }

    public MessageQueue<Box> inbox() {
        return inbox;
    }

    public MessageQueue<Box> outbox() {
        return outbox;
    }

    private Box takeChecked() {
        Optional<Box> item = receive();
        if (item.isEmpty()) {
            logger.error("Inbox of {} ({}) reported a pending message but dequeue returned nothing; "
                    + "a second consumer is draining it", channel.id(), role);
            throw new ChannelInvariantException(
                    "Pending message vanished between check and take on " + channel.id(), channel.id());
        }
        return item.get();
    }

    @Override
    public String toString() {
        return "ChannelView{" + channel.id() + ", " + role + ", pending=" + inbox.size() + "}";
    }
}

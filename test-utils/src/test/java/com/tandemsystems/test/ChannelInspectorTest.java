package com.tandemsystems.test;

import com.tandemsystems.Channel;
import com.tandemsystems.ChannelView;
import com.tandemsystems.Channels;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChannelInspectorTest {

    @Test
    void shouldShowBothDirectionsWithoutConsuming() {
        Channel channel = Channels.newChannel();
        ChannelView sender = Channels.makeSender(channel);
        ChannelView receiver = Channels.makeReceiver(channel);
        ChannelInspector senderSide = ChannelInspector.of(sender);
        ChannelInspector receiverSide = ChannelInspector.of(receiver);

        sender.send("a");
        sender.send("b");
        receiver.send("reply");

        assertEquals(2, senderSide.outboxSize());
        assertEquals(1, senderSide.inboxSize());
        assertEquals(List.of("a", "b"), senderSide.outboxContents(String.class));
        assertEquals(List.of("a", "b"), receiverSide.inboxContents(String.class));
        assertEquals(List.of("reply"), senderSide.inboxContents(String.class));

        assertEquals(2, receiver.pending());
    }

    @Test
    void shouldReportMetrics() {
        Channel channel = Channels.newChannel();
        ChannelView sender = Channels.makeSender(channel);
        sender.send(1);

        ChannelInspector.ChannelMetrics metrics = ChannelInspector.of(sender).metrics();

        assertEquals(channel.id(), metrics.channelId());
        assertEquals(0, metrics.inbox());
        assertEquals(1, metrics.outbox());
    }

    @Test
    void shouldWaitForOutboxToDrain() throws InterruptedException {
        Channel channel = Channels.newChannel();
        ChannelView sender = Channels.makeSender(channel);
        ChannelView receiver = Channels.makeReceiver(channel);
        sender.send("x");

        ChannelInspector inspector = ChannelInspector.of(sender);
        assertFalse(inspector.awaitOutboxDrained(Duration.ofMillis(30)));

        receiver.receive();
        assertTrue(inspector.awaitOutboxDrained(Duration.ofMillis(100)));
    }
}

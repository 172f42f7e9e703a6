package com.tandemsystems.benchmarks;

import com.tandemsystems.Channel;
import com.tandemsystems.ChannelView;
import com.tandemsystems.Channels;
import com.tandemsystems.LinkedProcess;
import com.tandemsystems.ProcessSystem;
import com.tandemsystems.config.ChannelConfig;
import com.tandemsystems.config.ConcurrencyMode;
import com.tandemsystems.config.ThreadPoolFactory;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.TimeUnit;

/**
 * Request/reply latency between two threads over a guarded channel,
 * and single-threaded send/receive cost on an unsynchronized one.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class ChannelRoundTripBenchmark {

    @State(Scope.Benchmark)
    public static class EchoState {
        private ProcessSystem system;
        private ChannelView client;

        @Setup(Level.Trial)
        public void setup() {
            system = new ProcessSystem("echo", new ThreadPoolFactory());
            LinkedProcess echo = system.spawnLinked(channel -> {
                while (true) {
                    channel.send(channel.await().unsafeUnpack(Integer.class));
                }
            });
            client = echo.channel();
        }

        @TearDown(Level.Trial)
        public void teardown() {
            system.shutdown();
        }
    }

    @State(Scope.Thread)
    public static class LocalState {
        private ChannelView sender;
        private ChannelView receiver;

        @Setup
        public void setup() {
            Channel channel = Channels.newChannel(new ChannelConfig()
                    .setConcurrencyMode(ConcurrencyMode.UNSYNCHRONIZED));
            sender = Channels.makeSender(channel);
            receiver = Channels.makeReceiver(channel);
        }
    }

    @Benchmark
    public int roundTrip(EchoState state) throws InterruptedException {
        state.client.send(1);
        return state.client.await(Integer.class);
    }

    @Benchmark
    public int sendReceive(LocalState state) {
        state.sender.send(1);
        return state.receiver.receive(Integer.class).orElse(0);
    }
}

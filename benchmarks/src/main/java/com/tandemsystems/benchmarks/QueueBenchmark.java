package com.tandemsystems.benchmarks;

import com.tandemsystems.queue.GuardedQueue;
import com.tandemsystems.queue.MessageQueue;
import com.tandemsystems.queue.TwoStackQueue;
import org.openjdk.jmh.annotations.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Microbenchmarks comparing the two-stack queues with ArrayDeque.
 *
 * The fill-then-drain pattern pays one rotation per batch; the pairs pattern
 * rotates on every dequeue and shows the cost floor of the lazy reversal.
 */
@BenchmarkMode({Mode.Throughput, Mode.AverageTime})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(2)
public class QueueBenchmark {

    @State(Scope.Thread)
    public static class QueueState {
        @Param({"twoStack", "guarded", "arrayDeque"})
        public String queueType;

        @Param({"1000"})
        public int batchSize;

        private MessageQueue<Integer> queue;

        @Setup
        public void setup() {
            switch (queueType) {
                case "twoStack" -> queue = new TwoStackQueue<>();
                case "guarded" -> queue = new GuardedQueue<>();
                case "arrayDeque" -> queue = new ArrayDequeQueue<>();
                default -> throw new IllegalArgumentException("Unknown queue type: " + queueType);
            }
        }
    }

    /**
     * Fill the queue, then drain it.
     */
    @Benchmark
    public int enqueueThenDequeue(QueueState state) {
        for (int i = 0; i < state.batchSize; i++) {
            state.queue.enqueue(i);
        }
        int sum = 0;
        for (int i = 0; i < state.batchSize; i++) {
            Optional<Integer> val = state.queue.dequeue();
            if (val.isEmpty()) throw new AssertionError("Queue underflow at " + i);
            sum += val.get();
        }
        return sum; // Prevent dead code elimination
    }

    /**
     * Enqueue and dequeue in pairs, keeping the queue depth at one.
     */
    @Benchmark
    public int enqueueDequeuePairs(QueueState state) {
        int sum = 0;
        for (int i = 0; i < state.batchSize; i++) {
            state.queue.enqueue(i);
            sum += state.queue.dequeue().orElse(0);
        }
        return sum;
    }

    /**
     * Peek repeatedly between dequeues, as a polling receiver does.
     */
    @Benchmark
    public int peekThenDequeue(QueueState state) {
        for (int i = 0; i < state.batchSize; i++) {
            state.queue.enqueue(i);
        }
        int sum = 0;
        while (state.queue.peek().isPresent()) {
            sum += state.queue.dequeue().orElse(0);
        }
        return sum;
    }

    /**
     * Baseline adapter over ArrayDeque.
     */
    static final class ArrayDequeQueue<T> implements MessageQueue<T> {
        private final ArrayDeque<T> deque = new ArrayDeque<>();

        @Override
        public void enqueue(T item) {
            deque.addLast(item);
        }

        @Override
        public Optional<T> dequeue() {
            return Optional.ofNullable(deque.pollFirst());
        }

        @Override
        public Optional<T> peek() {
            return Optional.ofNullable(deque.peekFirst());
        }

        @Override
        public int size() {
            return deque.size();
        }

        @Override
        public boolean isEmpty() {
            return deque.isEmpty();
        }

        @Override
        public void clear() {
            deque.clear();
        }

        @Override
        public List<T> snapshot() {
            return new ArrayList<>(deque);
        }
    }
}

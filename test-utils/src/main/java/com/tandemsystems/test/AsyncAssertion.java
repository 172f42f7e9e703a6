package com.tandemsystems.test;

import com.tandemsystems.ChannelView;
import com.tandemsystems.box.Box;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Assertions for code that communicates asynchronously over channels.
 * Replaces ad-hoc Thread.sleep() calls in tests with bounded waits.
 *
 * <p>Usage:
 * <pre>{@code
 * sender.send("ping");
 * String reply = AsyncAssertion.expectMessage(sender, String.class, Duration.ofSeconds(1));
 *
 * AsyncAssertion.eventually(() -> !system.isAlive(pid), Duration.ofSeconds(2));
 * }</pre>
 */
public class AsyncAssertion {

    private static final long DEFAULT_POLL_INTERVAL_MS = 10;

    private AsyncAssertion() {
    }

    /**
     * Waits until the condition becomes true or timeout is reached.
     *
     * @param condition the condition to check
     * @param timeout the maximum time to wait
     * @throws AssertionError if condition doesn't become true within timeout
     */
    public static void eventually(BooleanSupplier condition, Duration timeout) {
        eventually(condition, timeout, DEFAULT_POLL_INTERVAL_MS);
    }

    /**
     * Waits until the condition becomes true or timeout is reached.
     *
     * @param condition the condition to check
     * @param timeout the maximum time to wait
     * @param pollIntervalMs the interval between checks in milliseconds
     * @throws AssertionError if condition doesn't become true within timeout
     */
    public static void eventually(BooleanSupplier condition, Duration timeout, long pollIntervalMs) {
        Objects.requireNonNull(condition, "condition cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");
        long deadline = System.nanoTime() + timeout.toNanos();

        while (true) {
            if (condition.getAsBoolean()) {
                return;
            }
            if (System.nanoTime() - deadline >= 0) {
                throw new AssertionError("Condition did not become true within " + timeout);
            }
            try {
                Thread.sleep(pollIntervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted while waiting for condition", e);
            }
        }
    }

    /**
     * Waits for the next message on a view and checks its type.
     *
     * @param view the view to receive on
     * @param type the expected payload type
     * @param timeout the maximum time to wait
     * @param <T> the payload type
     * @return the payload
     * @throws AssertionError if no message arrives in time or it has another type
     */
    public static <T> T expectMessage(ChannelView view, Class<T> type, Duration timeout) {
        Objects.requireNonNull(view, "view cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        Box box = awaitBox(view, timeout)
                .orElseThrow(() -> new AssertionError(
                        "No message on " + view.channelId() + " (" + view.role() + ") within " + timeout));
        return box.unpack(type)
                .orElseThrow(() -> new AssertionError(
                        "Expected " + type.getSimpleName() + " on " + view.channelId() + " but received " + box));
    }

    /**
     * Asserts that a view receives nothing during the given period.
     *
     * @param view the view to watch
     * @param duration how long to watch
     * @throws AssertionError if a message arrives
     */
    public static void expectNoMessage(ChannelView view, Duration duration) {
        Objects.requireNonNull(view, "view cannot be null");
        awaitBox(view, duration).ifPresent(box -> {
            throw new AssertionError("Expected no message on " + view.channelId() + " but received " + box);
        });
    }

    private static Optional<Box> awaitBox(ChannelView view, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        try {
            return view.awaitTimeout(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting on " + view.channelId(), e);
        }
    }
}

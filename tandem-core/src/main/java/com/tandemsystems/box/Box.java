package com.tandemsystems.box;

import java.util.Objects;
import java.util.Optional;

/**
 * Type-erased carrier for a single message payload.
 *
 * A box accepts any value, including {@code null}. Extracting the value requires the
 * caller to name the type it expects. Both ends of a channel agree on payload types by
 * convention, so {@link #unsafeUnpack(Class)} treats a mismatch as a programmer error
 * rather than a recoverable condition. Use {@link #unpack(Class)} when the payload type
 * is not known in advance.
 */
public final class Box {

    private final Object payload;

    private Box(Object payload) {
        this.payload = payload;
    }

    /**
     * Wraps a value in a box. Never fails.
     *
     * @param value the payload, may be null
     * @return a new box holding the value
     */
    public static Box pack(Object value) {
        return new Box(value);
    }

    /**
     * Extracts the payload as the expected type.
     *
     * @param expectedType the type the payload is known to have
     * @param <T> the payload type
     * @return the payload, or null if the box holds null
     * @throws ClassCastException if the payload is not an instance of expectedType
     */
    public <T> T unsafeUnpack(Class<T> expectedType) {
        Objects.requireNonNull(expectedType, "expectedType cannot be null");
        return expectedType.cast(payload);
    }

    /**
     * Extracts the payload if it is an instance of the given type.
     *
     * @param type the requested type
     * @param <T> the payload type
     * @return the payload, or empty if it is null or of another type
     */
    public <T> Optional<T> unpack(Class<T> type) {
        Objects.requireNonNull(type, "type cannot be null");
        if (type.isInstance(payload)) {
            return Optional.of(type.cast(payload));
        }
        return Optional.empty();
    }

    /**
     * Returns the runtime class of the payload, or empty for a null payload.
     *
     * @return the payload class
     */
    public Optional<Class<?>> payloadType() {
        return payload == null ? Optional.empty() : Optional.of(payload.getClass());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Box)) return false;
        return Objects.equals(payload, ((Box) o).payload);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Box[" + payload + "]";
    }
}

package com.tandemsystems;

import java.util.Objects;

/**
 * Identifier of a process started by a {@link ProcessSystem}, or of a thread that asked
 * for its own id through {@link ProcessSystem#myPid()}.
 */
public record ProcessId(String id) {

    public ProcessId {
        Objects.requireNonNull(id, "id cannot be null");
    }

    @Override
    public String toString() {
        return id;
    }
}

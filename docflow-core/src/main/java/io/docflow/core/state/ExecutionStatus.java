package io.docflow.core.state;

import java.util.Arrays;
import java.util.Optional;

/// Lifecycle of an execution: `pending -> running <-> paused -> completed | failed`.
public enum ExecutionStatus {
    PENDING,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED;

    public String wireValue() {
        return name().toLowerCase();
    }

    /// Returns whether no further transitions are possible.
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static Optional<ExecutionStatus> fromWire(String value) {
        return Arrays.stream(values()).filter(s -> s.wireValue().equals(value)).findFirst();
    }
}

package io.docflow.core.plan.edge;

import java.util.Arrays;
import java.util.Optional;

/// Closed set of state-derived values an edge condition may test.
public enum ConditionType {
    /// Retry counter of the generating node, or of the current node when none is set.
    RETRY_COUNT("retry_count"),
    /// Execution status wire value.
    STATUS("status"),
    /// Whether an escalation is currently active.
    ESCALATION_ACTIVE("escalation_active");

    private final String wireValue;

    ConditionType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Optional<ConditionType> fromWire(String value) {
        return Arrays.stream(values()).filter(t -> t.wireValue.equals(value)).findFirst();
    }
}

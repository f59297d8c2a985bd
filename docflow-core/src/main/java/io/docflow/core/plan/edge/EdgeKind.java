package io.docflow.core.plan.edge;

import java.util.Arrays;
import java.util.Optional;

/// How an edge is taken: automatically on outcome, or as an explicit user choice.
public enum EdgeKind {
    AUTO("auto"),
    USER_CHOICE("user_choice");

    private final String wireValue;

    EdgeKind(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Optional<EdgeKind> fromWire(String value) {
        return Arrays.stream(values()).filter(k -> k.wireValue.equals(value)).findFirst();
    }
}

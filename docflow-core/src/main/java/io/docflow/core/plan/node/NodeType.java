package io.docflow.core.plan.node;

import java.util.Arrays;
import java.util.Optional;

/// Closed vocabulary of plan node types.
///
/// Each constant carries the wire value used in plan definitions. Generation-type
/// nodes ({@link #TASK} and {@link #PGC}) are the ones that produce documents and
/// own retry counters.
public enum NodeType {
    /// Document generation task backed by an LLM completion.
    TASK("task", true),
    /// Pre-generation clarification: generates a question set and pauses for answers.
    PGC("pgc", true),
    /// Quality check over the most recently generated document.
    QA("qa", false),
    /// Decision gate: consent or outcome selection.
    GATE("gate", false),
    /// Intake-classification gate.
    INTAKE_GATE("intake_gate", false),
    /// Terminal node.
    END("end", false);

    private final String wireValue;
    private final boolean generating;

    NodeType(String wireValue, boolean generating) {
        this.wireValue = wireValue;
        this.generating = generating;
    }

    public String wireValue() {
        return wireValue;
    }

    /// Returns whether nodes of this type produce documents and own retry counters.
    public boolean isGenerating() {
        return generating;
    }

    /// Returns whether this type reports a governance gate outcome.
    public boolean isGate() {
        return this == GATE || this == INTAKE_GATE;
    }

    /// Resolves a wire value to a node type.
    ///
    /// @param value the wire value, may be null
    /// @return the matching type, or empty if the value is unknown
    public static Optional<NodeType> fromWire(String value) {
        return Arrays.stream(values()).filter(t -> t.wireValue.equals(value)).findFirst();
    }
}

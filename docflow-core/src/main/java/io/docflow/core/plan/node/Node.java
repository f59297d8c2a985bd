package io.docflow.core.plan.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Immutable node of a workflow plan.
///
/// A single class covers every {@link NodeType}; type-specific fields are null
/// (or empty) where they do not apply:
/// - `taskRef`, `produces`: generation nodes
/// - `requiresConsent`, `gateOutcomes`: gates
/// - `terminalOutcome`, `gateOutcome`: end nodes
/// - `requiresQa`: QA nodes, defaults to `true`
///
/// @implNote Immutable after construction. Collections are defensively copied.
///
/// @see NodeType for the closed type vocabulary
public final class Node {

    private final String nodeId;
    private final NodeType type;
    private final String description;
    private final String taskRef;
    private final String produces;
    private final boolean requiresConsent;
    private final boolean requiresQa;
    private final List<String> gateOutcomes;
    private final String terminalOutcome;
    private final String gateOutcome;
    private final Map<String, Object> config;

    private Node(Builder builder) {
        this.nodeId = Objects.requireNonNull(builder.nodeId, "nodeId");
        this.type = Objects.requireNonNull(builder.type, "type");
        this.description = builder.description;
        this.taskRef = builder.taskRef;
        this.produces = builder.produces;
        this.requiresConsent = builder.requiresConsent;
        this.requiresQa = builder.requiresQa;
        this.gateOutcomes = List.copyOf(builder.gateOutcomes);
        this.terminalOutcome = builder.terminalOutcome;
        this.gateOutcome = builder.gateOutcome;
        this.config = Collections.unmodifiableMap(new HashMap<>(builder.config));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getNodeId() {
        return nodeId;
    }

    public NodeType getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    /// Returns the prompt reference for generation nodes.
    ///
    /// @return task reference, may be null
    public String getTaskRef() {
        return taskRef;
    }

    /// Returns the key under which the produced document is stored.
    ///
    /// @return produced document type, may be null
    public String getProduces() {
        return produces;
    }

    public boolean isRequiresConsent() {
        return requiresConsent;
    }

    public boolean isRequiresQa() {
        return requiresQa;
    }

    /// Returns the governance outcomes a gate may report.
    ///
    /// @return unmodifiable list, empty for non-gate nodes, never null
    public List<String> getGateOutcomes() {
        return gateOutcomes;
    }

    public String getTerminalOutcome() {
        return terminalOutcome;
    }

    public String getGateOutcome() {
        return gateOutcome;
    }

    /// Returns node fields not covered by the typed accessors.
    ///
    /// @return unmodifiable map, never null
    public Map<String, Object> getConfig() {
        return config;
    }

    public boolean isEnd() {
        return type == NodeType.END;
    }

    @Override
    public String toString() {
        return "Node{" + nodeId + ", " + type.wireValue() + "}";
    }

    public static final class Builder {
        private String nodeId;
        private NodeType type;
        private String description;
        private String taskRef;
        private String produces;
        private boolean requiresConsent;
        private boolean requiresQa = true;
        private final List<String> gateOutcomes = new ArrayList<>();
        private String terminalOutcome;
        private String gateOutcome;
        private final Map<String, Object> config = new HashMap<>();

        private Builder() {}

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder type(NodeType type) {
            this.type = type;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder taskRef(String taskRef) {
            this.taskRef = taskRef;
            return this;
        }

        public Builder produces(String produces) {
            this.produces = produces;
            return this;
        }

        public Builder requiresConsent(boolean requiresConsent) {
            this.requiresConsent = requiresConsent;
            return this;
        }

        public Builder requiresQa(boolean requiresQa) {
            this.requiresQa = requiresQa;
            return this;
        }

        public Builder gateOutcomes(List<String> gateOutcomes) {
            this.gateOutcomes.clear();
            if (gateOutcomes != null) {
                this.gateOutcomes.addAll(gateOutcomes);
            }
            return this;
        }

        public Builder terminalOutcome(String terminalOutcome) {
            this.terminalOutcome = terminalOutcome;
            return this;
        }

        public Builder gateOutcome(String gateOutcome) {
            this.gateOutcome = gateOutcome;
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config.clear();
            if (config != null) {
                this.config.putAll(config);
            }
            return this;
        }

        public Node build() {
            return new Node(this);
        }
    }
}

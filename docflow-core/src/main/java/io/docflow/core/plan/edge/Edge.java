package io.docflow.core.plan.edge;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Directed, conditioned transition between two plan nodes.
///
/// An edge matches when its `outcome` equals the outcome reported by the source
/// node and all of its `conditions` hold. A null `toNodeId` marks a non-advancing
/// edge: it keeps the execution where it is and offers `escalationOptions`
/// to a human.
///
/// @param edgeId unique edge identifier, not null
/// @param fromNodeId source node, not null
/// @param toNodeId target node, null for non-advancing edges
/// @param outcome executor-reported outcome this edge matches, not null
/// @param label human-readable label, may be null
/// @param kind how the edge is taken, not null
/// @param conditions AND-combined predicates in declaration order, never null
/// @param escalationOptions choices offered when a non-advancing edge fires, never null
public record Edge(
        String edgeId,
        String fromNodeId,
        String toNodeId,
        String outcome,
        String label,
        EdgeKind kind,
        List<EdgeCondition> conditions,
        List<String> escalationOptions) {

    public Edge {
        Objects.requireNonNull(edgeId, "edgeId");
        Objects.requireNonNull(fromNodeId, "fromNodeId");
        Objects.requireNonNull(outcome, "outcome");
        kind = kind != null ? kind : EdgeKind.AUTO;
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
        escalationOptions = escalationOptions != null ? List.copyOf(escalationOptions) : List.of();
    }

    public boolean isNonAdvancing() {
        return toNodeId == null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String edgeId;
        private String fromNodeId;
        private String toNodeId;
        private String outcome;
        private String label;
        private EdgeKind kind = EdgeKind.AUTO;
        private final List<EdgeCondition> conditions = new ArrayList<>();
        private final List<String> escalationOptions = new ArrayList<>();

        private Builder() {}

        public Builder edgeId(String edgeId) {
            this.edgeId = edgeId;
            return this;
        }

        public Builder from(String fromNodeId) {
            this.fromNodeId = fromNodeId;
            return this;
        }

        public Builder to(String toNodeId) {
            this.toNodeId = toNodeId;
            return this;
        }

        public Builder outcome(String outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder kind(EdgeKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder condition(EdgeCondition condition) {
            this.conditions.add(condition);
            return this;
        }

        public Builder escalationOptions(List<String> options) {
            this.escalationOptions.clear();
            this.escalationOptions.addAll(options);
            return this;
        }

        public Edge build() {
            return new Edge(
                    edgeId, fromNodeId, toNodeId, outcome, label, kind, conditions, escalationOptions);
        }
    }
}

package io.docflow.core.routing;

import io.docflow.core.plan.edge.Edge;
import java.util.List;

/// Result of routing a node outcome.
///
/// | `nextNodeId` | `matchedEdge` | Meaning                                  |
/// |--------------|---------------|------------------------------------------|
/// | set          | set           | advance to `nextNodeId`                  |
/// | null         | set           | non-advancing edge fired (escalation)    |
/// | null         | null          | no edge matched: routing failure         |
///
/// @param nextNodeId target node, may be null
/// @param matchedEdge edge that matched, may be null
public record RoutingDecision(String nextNodeId, Edge matchedEdge) {

    public static final RoutingDecision NO_MATCH = new RoutingDecision(null, null);

    public static RoutingDecision of(Edge edge) {
        return new RoutingDecision(edge.toNodeId(), edge);
    }

    public boolean matched() {
        return matchedEdge != null;
    }

    public boolean isNonAdvancing() {
        return matchedEdge != null && nextNodeId == null;
    }

    /// Returns the escalation options of the matched edge.
    ///
    /// @return options, empty when nothing matched, never null
    public List<String> escalationOptions() {
        return matchedEdge != null ? matchedEdge.escalationOptions() : List.of();
    }
}

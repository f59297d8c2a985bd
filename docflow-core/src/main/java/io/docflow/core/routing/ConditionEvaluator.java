package io.docflow.core.routing;

import io.docflow.core.plan.edge.ConditionType;
import io.docflow.core.plan.edge.EdgeCondition;
import io.docflow.core.state.ExecutionSnapshot;
import java.util.List;

/// Evaluates edge conditions against an execution snapshot.
///
/// `retry_count` resolves against the generating node when one is set, so a QA node
/// routing a failure sees the counter of the task that produced the content it
/// reviewed. Without a generating node it falls back to the current node.
public class ConditionEvaluator {

    /// Returns whether every condition holds. An empty list always holds.
    public boolean allMatch(List<EdgeCondition> conditions, ExecutionSnapshot state) {
        for (EdgeCondition condition : conditions) {
            if (!matches(condition, state)) {
                return false;
            }
        }
        return true;
    }

    public boolean matches(EdgeCondition condition, ExecutionSnapshot state) {
        return condition.operator().test(resolve(condition.type(), state), condition.value());
    }

    /// Resolves a condition type to the value it tests.
    ///
    /// @return resolved value, may be null when the state does not carry it
    public Object resolve(ConditionType type, ExecutionSnapshot state) {
        return switch (type) {
            case RETRY_COUNT -> {
                String nodeId =
                        state.generatingNodeId() != null
                                ? state.generatingNodeId()
                                : state.currentNodeId();
                yield nodeId != null ? state.getRetryCount(nodeId) : null;
            }
            case STATUS -> state.status().wireValue();
            case ESCALATION_ACTIVE -> state.escalationActive();
        };
    }
}

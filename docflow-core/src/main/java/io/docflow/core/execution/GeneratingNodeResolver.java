package io.docflow.core.execution;

import io.docflow.core.plan.WorkflowPlan;
import io.docflow.core.plan.node.Node;
import io.docflow.core.plan.node.NodeType;
import io.docflow.core.state.NodeExecution;
import java.util.List;
import java.util.Optional;

/// Finds the node whose content a QA node just reviewed.
///
/// ### Contracts
/// - Returns the node id of the most recent `task` execution in history, scanning
///   backward from the end
/// - Entries for nodes no longer in the plan are skipped
/// - Returns empty when history holds no task execution
///
/// @implNote Linear scan; history is bounded by the step budget of the execution.
public final class GeneratingNodeResolver {

    private GeneratingNodeResolver() {}

    public static Optional<String> findGeneratingNode(
            List<NodeExecution> history, WorkflowPlan plan) {
        for (int i = history.size() - 1; i >= 0; i--) {
            String nodeId = history.get(i).nodeId();
            Optional<Node> node = plan.getNode(nodeId);
            if (node.isPresent() && node.get().getType() == NodeType.TASK) {
                return Optional.of(nodeId);
            }
        }
        return Optional.empty();
    }
}

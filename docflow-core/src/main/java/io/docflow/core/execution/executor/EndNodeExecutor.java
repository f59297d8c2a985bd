package io.docflow.core.execution.executor;

import io.docflow.core.plan.node.Node;
import io.docflow.core.plan.node.NodeType;
import io.docflow.core.state.ExecutionSnapshot;

/// Echoes an end node's configured outcomes. Makes no decisions.
///
/// Reports the node's `terminal_outcome` as its outcome, with `terminal_outcome` and
/// (when declared) `gate_outcome` in metadata.
public class EndNodeExecutor implements NodeExecutor {

    @Override
    public NodeType getNodeType() {
        return NodeType.END;
    }

    @Override
    public NodeResult execute(Node node, NodeContext context, ExecutionSnapshot state) {
        NodeResult.Builder builder =
                NodeResult.builder(node.getTerminalOutcome())
                        .metadata("terminal_outcome", node.getTerminalOutcome());
        if (node.getGateOutcome() != null) {
            builder.metadata("gate_outcome", node.getGateOutcome());
        }
        return builder.build();
    }
}

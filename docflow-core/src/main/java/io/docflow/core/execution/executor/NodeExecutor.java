package io.docflow.core.execution.executor;

import io.docflow.core.plan.node.Node;
import io.docflow.core.plan.node.NodeType;
import io.docflow.core.state.ExecutionSnapshot;

/// Strategy interface for executing plan nodes, one implementation per {@link NodeType}.
///
/// Executors report facts and nothing else. They must not read edges, decide what
/// runs next, or write execution state; they receive an immutable snapshot and a
/// step-scoped {@link NodeContext}. That separation is what lets tests drive the
/// state machine with scripted executors.
///
/// Implementations should be stateless and thread-safe.
///
/// @see NodeExecutorRegistry for dispatch by node type
public interface NodeExecutor {

    /// Returns the node type this executor handles.
    NodeType getNodeType();

    /// Executes a node.
    ///
    /// @param node node to execute, not null
    /// @param context step-scoped working context, not null
    /// @param state read-only execution snapshot, not null
    /// @return the result, never null
    /// @throws Exception on unexpected failure; the execution is then marked failed
    NodeResult execute(Node node, NodeContext context, ExecutionSnapshot state) throws Exception;
}

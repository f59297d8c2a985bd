package io.docflow.core.execution.executor;

import io.docflow.core.plan.node.NodeType;
import java.util.Optional;

/// Registry of node executors keyed by node type.
public interface NodeExecutorRegistry {

    Optional<NodeExecutor> getExecutor(NodeType nodeType);

    /// @throws NodeExecutorNotFoundException if no executor handles the type
    NodeExecutor getExecutorOrThrow(NodeType nodeType) throws NodeExecutorNotFoundException;

    /// Registers an executor, replacing any executor for the same type.
    void register(NodeExecutor executor);

    boolean hasExecutor(NodeType nodeType);
}

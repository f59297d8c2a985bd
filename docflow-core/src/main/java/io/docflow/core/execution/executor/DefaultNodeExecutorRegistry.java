package io.docflow.core.execution.executor;

import io.docflow.core.plan.node.NodeType;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Default {@link NodeExecutorRegistry}.
///
/// Starts with the executors that need no capabilities (gate, end) registered.
/// Generation, QA and intake executors depend on injected capabilities and are
/// registered by {@link io.docflow.core.DocflowFactory} or by the caller.
public class DefaultNodeExecutorRegistry implements NodeExecutorRegistry {

    private final Map<NodeType, NodeExecutor> registry = new ConcurrentHashMap<>();

    public DefaultNodeExecutorRegistry() {
        register(new GateNodeExecutor());
        register(new EndNodeExecutor());
    }

    @Override
    public Optional<NodeExecutor> getExecutor(NodeType nodeType) {
        return Optional.ofNullable(registry.get(nodeType));
    }

    @Override
    public NodeExecutor getExecutorOrThrow(NodeType nodeType)
            throws NodeExecutorNotFoundException {
        return getExecutor(nodeType)
                .orElseThrow(
                        () ->
                                new NodeExecutorNotFoundException(
                                        "No executor registered for node type: "
                                                + nodeType.wireValue()));
    }

    @Override
    public void register(NodeExecutor executor) {
        registry.put(executor.getNodeType(), executor);
    }

    @Override
    public boolean hasExecutor(NodeType nodeType) {
        return registry.containsKey(nodeType);
    }
}

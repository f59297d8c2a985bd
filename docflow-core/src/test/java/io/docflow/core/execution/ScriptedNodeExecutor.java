package io.docflow.core.execution;

import io.docflow.core.execution.executor.NodeContext;
import io.docflow.core.execution.executor.NodeExecutor;
import io.docflow.core.execution.executor.NodeResult;
import io.docflow.core.plan.node.Node;
import io.docflow.core.plan.node.NodeType;
import io.docflow.core.state.ExecutionSnapshot;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/// Node executor that replays a fixed script of outcomes, repeating the last one.
/// Generation-type scripts produce a small document on `success`.
public final class ScriptedNodeExecutor implements NodeExecutor {

    private final NodeType nodeType;
    private final Deque<String> script;
    private final RuntimeException failure;
    private final AtomicInteger calls = new AtomicInteger();

    private ScriptedNodeExecutor(NodeType nodeType, List<String> outcomes, RuntimeException failure) {
        this.nodeType = nodeType;
        this.script = new ArrayDeque<>(outcomes);
        this.failure = failure;
    }

    public static ScriptedNodeExecutor of(NodeType nodeType, String... outcomes) {
        return new ScriptedNodeExecutor(nodeType, List.of(outcomes), null);
    }

    public static ScriptedNodeExecutor throwing(NodeType nodeType, RuntimeException failure) {
        return new ScriptedNodeExecutor(nodeType, List.of(), failure);
    }

    @Override
    public NodeType getNodeType() {
        return nodeType;
    }

    @Override
    public synchronized NodeResult execute(Node node, NodeContext context, ExecutionSnapshot state) {
        int call = calls.incrementAndGet();
        if (failure != null) {
            throw failure;
        }
        String outcome = script.size() > 1 ? script.poll() : script.peek();
        if (nodeType.isGenerating() && NodeResult.SUCCESS.equals(outcome)) {
            return NodeResult.builder(NodeResult.SUCCESS)
                    .producedDocument(Map.of("title", node.getNodeId() + " draft " + call))
                    .metadata("produces", node.getProduces())
                    .build();
        }
        if (NodeResult.FAILED.equals(outcome) && nodeType == NodeType.QA) {
            return NodeResult.builder(NodeResult.FAILED)
                    .metadata(
                            "feedback",
                            Map.of("issues", List.of(Map.of("type", "semantic", "message", "too vague"))))
                    .build();
        }
        return NodeResult.of(outcome);
    }

    public int getCalls() {
        return calls.get();
    }
}

package io.docflow.core.execution;

import io.docflow.core.execution.executor.NodeResult;
import io.docflow.core.plan.node.Node;
import io.docflow.core.state.ExecutionSnapshot;
import java.util.List;

/// Listener for execution lifecycle events.
///
/// All methods have no-op defaults; override only what you need. Listeners receive
/// snapshots, never the live state. Exceptions thrown by a listener propagate to the
/// caller of the plan executor.
///
/// ### Callback order within one step
/// ```
/// onNodeStart(state, node)
/// onNodeComplete(state, node, result)
/// [history, pause, routing]
/// onCheckpoint(state)                                (after persisting)
/// onPaused | onEscalation | onCompleted | onFailed   (at most one)
/// ```
///
/// A listener that throws after the checkpoint leaves the reported state saved.
///
/// @implNote Listeners shared across executions may be called from several threads.
public interface ExecutionListener {

    ExecutionListener NOOP = new ExecutionListener() {};

    default void onExecutionStarted(ExecutionSnapshot state) {}

    default void onNodeStart(ExecutionSnapshot state, Node node) {}

    default void onNodeComplete(ExecutionSnapshot state, Node node, NodeResult result) {}

    default void onPaused(ExecutionSnapshot state) {}

    default void onEscalation(ExecutionSnapshot state, List<String> options) {}

    default void onCompleted(ExecutionSnapshot state) {}

    default void onFailed(ExecutionSnapshot state, String reason) {}

    /// Called after the state has been persisted.
    default void onCheckpoint(ExecutionSnapshot state) {}
}

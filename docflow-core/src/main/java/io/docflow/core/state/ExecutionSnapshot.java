package io.docflow.core.state;

import io.docflow.core.util.RawMaps;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Immutable copy of an {@link ExecutionState}.
///
/// Serves two purposes: the read-only view handed to node executors, and the
/// persisted form of an execution. `ExecutionSnapshot.from(state).toState()`
/// reproduces an execution-identical state, including history order and retry counts.
///
/// ### Contracts
/// - **Precondition**: `executionId`, `workflowId`, `subjectId` and `status` are not null
/// - **Postcondition**: all collections are unmodifiable copies, nested maps and lists
///   included
public record ExecutionSnapshot(
        String executionId,
        String workflowId,
        String subjectId,
        String documentType,
        String userId,
        String currentNodeId,
        ExecutionStatus status,
        List<NodeExecution> nodeHistory,
        Map<String, Integer> retryCounts,
        String generatingNodeId,
        String gateOutcome,
        String terminalOutcome,
        String threadId,
        Map<String, Object> contextState,
        boolean pendingUserInput,
        String pendingPrompt,
        List<String> pendingChoices,
        Map<String, Object> pendingPayload,
        String pendingSchemaRef,
        boolean escalationActive,
        List<String> escalationOptions,
        Instant createdAt,
        Instant updatedAt) {

    public ExecutionSnapshot {
        Objects.requireNonNull(executionId, "executionId must not be null");
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(subjectId, "subjectId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        nodeHistory = nodeHistory != null ? List.copyOf(nodeHistory) : List.of();
        retryCounts = retryCounts != null ? Map.copyOf(retryCounts) : Map.of();
        contextState = RawMaps.freezeMap(contextState);
        pendingChoices = pendingChoices != null ? List.copyOf(pendingChoices) : null;
        pendingPayload = pendingPayload != null ? RawMaps.freezeMap(pendingPayload) : null;
        escalationOptions = escalationOptions != null ? List.copyOf(escalationOptions) : List.of();
    }

    /// Captures the current state.
    ///
    /// @param state state to copy, not null
    /// @return new snapshot, never null
    public static ExecutionSnapshot from(ExecutionState state) {
        Objects.requireNonNull(state, "state must not be null");
        return new ExecutionSnapshot(
                state.getExecutionId(),
                state.getWorkflowId(),
                state.getSubjectId(),
                state.getDocumentType(),
                state.getUserId(),
                state.getCurrentNodeId(),
                state.getStatus(),
                state.getNodeHistory(),
                state.getRetryCounts(),
                state.getGeneratingNodeId(),
                state.getGateOutcome(),
                state.getTerminalOutcome(),
                state.getThreadId(),
                state.getContextState().asMap(),
                state.isPendingUserInput(),
                state.getPendingPrompt(),
                state.getPendingChoices(),
                state.getPendingPayload(),
                state.getPendingSchemaRef(),
                state.isEscalationActive(),
                state.getEscalationOptions(),
                state.getCreatedAt(),
                state.getUpdatedAt());
    }

    /// Restores a mutable state from this snapshot.
    ///
    /// @return new state, never null
    public ExecutionState toState() {
        return ExecutionState.builder()
                .executionId(executionId)
                .workflowId(workflowId)
                .subjectId(subjectId)
                .documentType(documentType)
                .userId(userId)
                .currentNodeId(currentNodeId)
                .status(status)
                .nodeHistory(nodeHistory)
                .retryCounts(retryCounts)
                .generatingNodeId(generatingNodeId)
                .gateOutcome(gateOutcome)
                .terminalOutcome(terminalOutcome)
                .threadId(threadId)
                .contextState(ContextState.of(contextState))
                .pendingUserInput(pendingUserInput)
                .pendingPrompt(pendingPrompt)
                .pendingChoices(pendingChoices)
                .pendingPayload(pendingPayload)
                .pendingSchemaRef(pendingSchemaRef)
                .escalationActive(escalationActive)
                .escalationOptions(escalationOptions)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }

    public int getRetryCount(String nodeId) {
        return retryCounts.getOrDefault(nodeId, 0);
    }

    public ContextState context() {
        return ContextState.of(contextState);
    }
}

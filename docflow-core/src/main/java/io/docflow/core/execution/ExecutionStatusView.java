package io.docflow.core.execution;

import io.docflow.core.state.ExecutionState;
import io.docflow.core.state.ExecutionStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/// Read model of an execution returned by status queries.
///
/// A failed execution stays visible here with its status and the reason recorded
/// by its last failure.
public record ExecutionStatusView(
        String executionId,
        String workflowId,
        String subjectId,
        String documentType,
        ExecutionStatus status,
        String currentNodeId,
        String terminalOutcome,
        String gateOutcome,
        boolean pendingUserInput,
        String pendingPrompt,
        List<String> pendingChoices,
        Map<String, Object> pendingPayload,
        String pendingSchemaRef,
        boolean escalationActive,
        List<String> escalationOptions,
        Map<String, Integer> retryCounts,
        int stepCount,
        String failureReason,
        Instant createdAt,
        Instant updatedAt) {

    public static ExecutionStatusView of(ExecutionState state) {
        return new ExecutionStatusView(
                state.getExecutionId(),
                state.getWorkflowId(),
                state.getSubjectId(),
                state.getDocumentType(),
                state.getStatus(),
                state.getCurrentNodeId(),
                state.getTerminalOutcome(),
                state.getGateOutcome(),
                state.isPendingUserInput(),
                state.getPendingPrompt(),
                state.getPendingChoices(),
                state.getPendingPayload(),
                state.getPendingSchemaRef(),
                state.isEscalationActive(),
                state.getEscalationOptions(),
                Map.copyOf(state.getRetryCounts()),
                state.getNodeHistory().size(),
                state.getStatus() == ExecutionStatus.FAILED
                        ? state.lastFailureReason().orElse(null)
                        : null,
                state.getCreatedAt(),
                state.getUpdatedAt());
    }
}

package io.docflow.core.llm;

/// Per-call tracking and tuning options for a completion.
///
/// Tracking fields let the completion capability attribute calls to an execution
/// for its own logging; none of them affect engine behavior.
///
/// @param executionId execution the call belongs to, may be null
/// @param nodeId node making the call, may be null
/// @param taskRef prompt reference, may be null
/// @param documentType document type being produced, may be null
/// @param role caller role label, e.g. `Document Generator`, may be null
/// @param temperature sampling temperature, null for provider default
/// @param maxTokens response token cap, null for provider default
public record CompletionOptions(
        String executionId,
        String nodeId,
        String taskRef,
        String documentType,
        String role,
        Double temperature,
        Integer maxTokens) {

    public static final CompletionOptions DEFAULT =
            new CompletionOptions(null, null, null, null, null, null, null);

    public static CompletionOptions tracking(
            String executionId, String nodeId, String taskRef, String documentType, String role) {
        return new CompletionOptions(executionId, nodeId, taskRef, documentType, role, null, null);
    }
}

package io.docflow.core.execution;

import java.time.Instant;
import java.util.Map;

/// Audit record of a completed execution, handed to an {@link OutcomeRecorder}.
///
/// Both outcome vocabularies are recorded side by side; `mappingConsistent` tells
/// whether the plan's outcome mapping agrees with the pair.
///
/// @param executionId execution id, not null
/// @param workflowId workflow id, not null
/// @param subjectId subject id, not null
/// @param documentType document type, may be null
/// @param gateOutcome governance vocabulary outcome, may be null
/// @param terminalOutcome execution vocabulary outcome, may be null
/// @param mappingConsistent whether the plan maps `gateOutcome` to `terminalOutcome`
/// @param retryCounts retry counters at completion, never null
/// @param recordedAt when the record was created, not null
public record GovernanceOutcome(
        String executionId,
        String workflowId,
        String subjectId,
        String documentType,
        String gateOutcome,
        String terminalOutcome,
        boolean mappingConsistent,
        Map<String, Integer> retryCounts,
        Instant recordedAt) {

    public GovernanceOutcome {
        retryCounts = retryCounts != null ? Map.copyOf(retryCounts) : Map.of();
    }
}

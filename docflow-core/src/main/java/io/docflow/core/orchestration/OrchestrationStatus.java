package io.docflow.core.orchestration;

/// Overall status of an orchestration run, derived from its tracks.
public enum OrchestrationStatus {
    /// Tracks remain blocked or unstarted; the run stopped without settling them.
    RUNNING,
    /// At least one track awaits an operator.
    PAUSED,
    /// Every track stabilized or halted, none awaiting.
    COMPLETED,
    /// At least one track halted and none awaits an operator.
    HALTED,
    /// The orchestration itself errored.
    FAILED
}

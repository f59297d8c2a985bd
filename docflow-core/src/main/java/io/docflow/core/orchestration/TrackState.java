package io.docflow.core.orchestration;

/// Production state of one document track within an orchestration.
public enum TrackState {
    /// Waiting for dependencies to stabilize.
    BLOCKED,
    /// Dependencies satisfied; not started yet.
    QUEUED,
    /// Execution started and still advancing.
    RUNNING,
    /// Execution paused for user input or an escalation decision.
    AWAITING_OPERATOR,
    /// Execution completed.
    STABILIZED,
    /// Execution failed or could not be started.
    HALTED;

    public boolean isSettled() {
        return this == STABILIZED || this == HALTED;
    }
}

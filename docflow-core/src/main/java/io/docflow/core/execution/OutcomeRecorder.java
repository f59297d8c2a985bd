package io.docflow.core.execution;

import io.docflow.core.plan.WorkflowPlan;
import io.docflow.core.state.ExecutionSnapshot;

/// Audit capability invoked once per completed execution.
///
/// Recording is best effort: the plan executor logs and swallows any exception, so
/// a failing recorder never makes a completed execution look failed.
@FunctionalInterface
public interface OutcomeRecorder {

    OutcomeRecorder NOOP = (state, plan, outcome) -> {};

    /// @param state completed execution, not null
    /// @param plan plan the execution ran, not null
    /// @param outcome audit record, not null
    /// @throws Exception if recording fails
    void record(ExecutionSnapshot state, WorkflowPlan plan, GovernanceOutcome outcome)
            throws Exception;
}

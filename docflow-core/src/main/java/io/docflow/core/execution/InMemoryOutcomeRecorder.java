package io.docflow.core.execution;

import io.docflow.core.plan.WorkflowPlan;
import io.docflow.core.state.ExecutionSnapshot;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/// Outcome recorder that keeps records in memory.
public class InMemoryOutcomeRecorder implements OutcomeRecorder {

    private final List<GovernanceOutcome> outcomes = new CopyOnWriteArrayList<>();

    @Override
    public void record(ExecutionSnapshot state, WorkflowPlan plan, GovernanceOutcome outcome) {
        outcomes.add(outcome);
    }

    /// @return recorded outcomes in recording order, never null
    public List<GovernanceOutcome> getOutcomes() {
        return List.copyOf(outcomes);
    }
}

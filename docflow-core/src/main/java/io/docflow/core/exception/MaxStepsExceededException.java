package io.docflow.core.exception;

import java.io.Serial;

/// Thrown when run-to-pause exceeds its step budget, usually an auto-advancing loop in the plan.
public final class MaxStepsExceededException extends DocflowException {

    @Serial private static final long serialVersionUID = 8L;

    private final String executionId;
    private final int maxSteps;

    public MaxStepsExceededException(String executionId, int maxSteps) {
        super("Execution " + executionId + " exceeded " + maxSteps + " steps without pausing or completing");
        this.executionId = executionId;
        this.maxSteps = maxSteps;
    }

    public String getExecutionId() {
        return executionId;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.MAX_STEPS_EXCEEDED;
    }
}

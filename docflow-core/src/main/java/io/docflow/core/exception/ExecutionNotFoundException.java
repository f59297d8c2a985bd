package io.docflow.core.exception;

import java.io.Serial;

/// Thrown when an execution id does not resolve to a persisted execution.
public final class ExecutionNotFoundException extends DocflowException {

    @Serial private static final long serialVersionUID = 2L;

    private final String executionId;

    public ExecutionNotFoundException(String executionId) {
        super("Execution not found: " + executionId);
        this.executionId = executionId;
    }

    public String getExecutionId() {
        return executionId;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.EXECUTION_NOT_FOUND;
    }
}

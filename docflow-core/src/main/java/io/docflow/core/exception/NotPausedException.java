package io.docflow.core.exception;

import java.io.Serial;

/// Thrown when input is submitted to an execution that is not awaiting input.
public final class NotPausedException extends DocflowException {

    @Serial private static final long serialVersionUID = 3L;

    private final String executionId;
    private final String status;

    public NotPausedException(String executionId, String status) {
        super("Execution " + executionId + " is not paused (status: " + status + ")");
        this.executionId = executionId;
        this.status = status;
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getStatus() {
        return status;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NOT_PAUSED;
    }
}

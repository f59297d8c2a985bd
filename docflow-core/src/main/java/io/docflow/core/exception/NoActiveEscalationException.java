package io.docflow.core.exception;

import java.io.Serial;

/// Thrown when an escalation choice is submitted while no escalation is active.
public final class NoActiveEscalationException extends DocflowException {

    @Serial private static final long serialVersionUID = 4L;

    private final String executionId;

    public NoActiveEscalationException(String executionId) {
        super("Execution " + executionId + " has no active escalation");
        this.executionId = executionId;
    }

    public String getExecutionId() {
        return executionId;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.NO_ACTIVE_ESCALATION;
    }
}

package io.docflow.core.exception;

import java.io.Serial;

/// Thrown when a paused execution is resumed with neither input nor a choice.
public final class MissingUserInputException extends DocflowException {

    @Serial private static final long serialVersionUID = 10L;

    private final String executionId;

    public MissingUserInputException(String executionId) {
        super("Execution " + executionId + " is paused for input; provide input or a choice");
        this.executionId = executionId;
    }

    public String getExecutionId() {
        return executionId;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.MISSING_USER_INPUT;
    }
}

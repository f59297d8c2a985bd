package io.docflow.core.exception;

import java.io.Serial;

/// Thrown when no plan is registered under a workflow id or document type.
public final class PlanNotFoundException extends DocflowException {

    @Serial private static final long serialVersionUID = 1L;

    private final String key;

    public PlanNotFoundException(String key) {
        super("No plan registered for: " + key);
        this.key = key;
    }

    /// Returns the workflow id or document type that was looked up.
    public String getKey() {
        return key;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.PLAN_NOT_FOUND;
    }
}

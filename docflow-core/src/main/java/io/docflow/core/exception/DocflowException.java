package io.docflow.core.exception;

import java.io.Serial;

/// Base of the closed set of domain errors raised by the workflow engine.
///
/// Each variant reports an {@link ErrorKind} so callers can dispatch without
/// inspecting messages.
public abstract sealed class DocflowException extends Exception
        permits PlanLoadException,
                PlanNotFoundException,
                ExecutionNotFoundException,
                NotPausedException,
                MissingUserInputException,
                NoActiveEscalationException,
                InvalidEscalationChoiceException,
                NoMatchingEdgeException,
                NodeExecutionException,
                MaxStepsExceededException,
                OutcomeMappingException {

    @Serial private static final long serialVersionUID = 4127731195584106823L;

    protected DocflowException(String message) {
        super(message);
    }

    protected DocflowException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getKind();
}

package io.docflow.core.exception;

/// Discriminator for {@link DocflowException} variants, for callers that dispatch on kind.
public enum ErrorKind {
    PLAN_LOAD,
    PLAN_NOT_FOUND,
    EXECUTION_NOT_FOUND,
    NOT_PAUSED,
    MISSING_USER_INPUT,
    NO_ACTIVE_ESCALATION,
    INVALID_ESCALATION_CHOICE,
    NO_MATCHING_EDGE,
    NODE_EXECUTION,
    MAX_STEPS_EXCEEDED,
    OUTCOME_MAPPING
}

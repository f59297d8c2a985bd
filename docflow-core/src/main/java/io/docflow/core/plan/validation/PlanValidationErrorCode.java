package io.docflow.core.plan.validation;

/// Closed set of validation findings, grouped by the phase that reports them.
public enum PlanValidationErrorCode {
    // schema
    MISSING_REQUIRED_FIELD,
    INVALID_FIELD_TYPE,
    INVALID_ENUM_VALUE,
    DUPLICATE_NODE_ID,
    DUPLICATE_EDGE_ID,

    // graph
    EDGE_SOURCE_NOT_FOUND,
    EDGE_TARGET_NOT_FOUND,
    ENTRY_NODE_NOT_FOUND,
    NO_OUTBOUND_EDGES,
    ORPHAN_NODE,

    // outcome mapping
    MISSING_OUTCOME_MAPPING,
    INCOMPLETE_OUTCOME_MAPPING,

    // governance
    INVALID_CIRCUIT_BREAKER,
    INVALID_GOVERNANCE
}

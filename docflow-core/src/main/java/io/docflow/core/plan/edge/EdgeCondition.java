package io.docflow.core.plan.edge;

import java.util.Objects;

/// Predicate over execution state attached to an edge.
///
/// @param type state-derived value to test, not null
/// @param operator comparison operator, not null
/// @param value expected value, may be null
public record EdgeCondition(ConditionType type, ConditionOperator operator, Object value) {

    public EdgeCondition {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(operator, "operator");
    }

    public static EdgeCondition retryCount(ConditionOperator operator, int value) {
        return new EdgeCondition(ConditionType.RETRY_COUNT, operator, value);
    }
}

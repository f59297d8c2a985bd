package io.docflow.core.plan.edge;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntPredicate;

/// Comparison operators for edge conditions.
///
/// ### Contracts
/// - A null actual value never matches, for every operator
/// - Numbers compare by value regardless of boxed type (`2` equals `2L`)
/// - Ordered comparison of incompatible types yields `false` instead of throwing
public enum ConditionOperator {
    EQ("eq"),
    NE("ne"),
    LT("lt"),
    LTE("lte"),
    GT("gt"),
    GTE("gte");

    private final String wireValue;

    ConditionOperator(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Optional<ConditionOperator> fromWire(String value) {
        return Arrays.stream(values()).filter(o -> o.wireValue.equals(value)).findFirst();
    }

    /// Applies this operator to `actual OP expected`.
    ///
    /// @param actual value resolved from state, may be null
    /// @param expected value declared on the condition, may be null
    /// @return comparison result, `false` when `actual` is null or types are incomparable
    public boolean test(Object actual, Object expected) {
        if (actual == null) {
            return false;
        }
        return switch (this) {
            case EQ -> equalsNormalized(actual, expected);
            case NE -> !equalsNormalized(actual, expected);
            case LT -> ordered(actual, expected, cmp -> cmp < 0);
            case LTE -> ordered(actual, expected, cmp -> cmp <= 0);
            case GT -> ordered(actual, expected, cmp -> cmp > 0);
            case GTE -> ordered(actual, expected, cmp -> cmp >= 0);
        };
    }

    private static boolean ordered(Object actual, Object expected, IntPredicate accept) {
        Integer cmp = compare(actual, expected);
        return cmp != null && accept.test(cmp);
    }

    private static boolean equalsNormalized(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        return Objects.equals(actual, expected);
    }

    /// Orders numbers numerically, strings lexicographically and booleans false first.
    ///
    /// @return comparison sign, or null when the values are not of a comparable kind
    private static Integer compare(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        if (actual instanceof String a && expected instanceof String b) {
            return a.compareTo(b);
        }
        if (actual instanceof Boolean a && expected instanceof Boolean b) {
            return Boolean.compare(a, b);
        }
        return null;
    }
}

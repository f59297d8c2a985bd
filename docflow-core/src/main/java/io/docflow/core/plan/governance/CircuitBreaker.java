package io.docflow.core.plan.governance;

import java.util.List;

/// Retry cap for generation nodes.
///
/// The cap itself is enforced by plan edges (a `retry_count` condition on the retry
/// edge and a non-advancing edge behind it); this record carries the declared policy
/// for reporting and auditing.
///
/// @param maxRetries maximum number of retries, positive
/// @param appliesTo node type wire values the breaker covers, never null
/// @param escalationPerAdr reference to the escalation policy, may be null
public record CircuitBreaker(int maxRetries, List<String> appliesTo, String escalationPerAdr) {

    public CircuitBreaker {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be positive: " + maxRetries);
        }
        appliesTo = appliesTo != null ? List.copyOf(appliesTo) : List.of();
    }
}

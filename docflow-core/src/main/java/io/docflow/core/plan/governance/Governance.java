package io.docflow.core.plan.governance;

import java.util.List;
import java.util.Optional;

/// Governance block of a plan.
///
/// @param adrReferences decision records this plan implements, never null
/// @param circuitBreaker retry cap, may be null
/// @param stalenessHandling staleness policy, may be null
/// @param downstreamRequirements downstream conditions, may be null
public record Governance(
        List<String> adrReferences,
        CircuitBreaker circuitBreaker,
        StalenessHandling stalenessHandling,
        DownstreamRequirements downstreamRequirements) {

    public static final Governance NONE = new Governance(List.of(), null, null, null);

    public Governance {
        adrReferences = adrReferences != null ? List.copyOf(adrReferences) : List.of();
    }

    public Optional<CircuitBreaker> findCircuitBreaker() {
        return Optional.ofNullable(circuitBreaker);
    }
}

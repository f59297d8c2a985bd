package io.docflow.core.routing;

import io.docflow.core.exception.NoMatchingEdgeException;
import io.docflow.core.plan.WorkflowPlan;
import io.docflow.core.plan.edge.Edge;
import io.docflow.core.plan.node.Node;
import io.docflow.core.state.ExecutionSnapshot;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Selects the next node of a plan from a node's reported outcome.
///
/// ### Algorithm
/// 1. Take the outbound edges of the current node in declaration order
/// 2. Keep those whose `outcome` equals the reported outcome exactly
/// 3. Keep those whose conditions all hold against the state
/// 4. The first remaining edge wins
///
/// Declaration order is the tie-break; plan authors rely on it to put a conditioned
/// retry edge ahead of its circuit-breaker fallback.
///
/// ### Contracts
/// - **Postcondition**: identical inputs always yield an identical decision
/// - No I/O and no mutation
///
/// @implNote Stateless apart from the immutable plan; thread-safe.
///
/// @see RoutingDecision for how to read the result
public class EdgeRouter {

    private static final Logger logger = Logger.getLogger(EdgeRouter.class.getName());

    private final WorkflowPlan plan;
    private final ConditionEvaluator conditionEvaluator;

    public EdgeRouter(WorkflowPlan plan) {
        this(plan, new ConditionEvaluator());
    }

    public EdgeRouter(WorkflowPlan plan, ConditionEvaluator conditionEvaluator) {
        this.plan = Objects.requireNonNull(plan, "plan must not be null");
        this.conditionEvaluator =
                Objects.requireNonNull(conditionEvaluator, "conditionEvaluator must not be null");
    }

    /// Routes an outcome reported by a node.
    ///
    /// @param currentNodeId node that reported the outcome, not null
    /// @param outcome reported outcome, not null
    /// @param state state the conditions are evaluated against, not null
    /// @return the decision, {@link RoutingDecision#NO_MATCH} when no edge matched
    public RoutingDecision getNextNode(
            String currentNodeId, String outcome, ExecutionSnapshot state) {
        for (Edge edge : plan.getEdgesFrom(currentNodeId)) {
            if (!edge.outcome().equals(outcome)) {
                continue;
            }
            if (conditionEvaluator.allMatch(edge.conditions(), state)) {
                logger.fine(
                        () ->
                                "Edge "
                                        + edge.edgeId()
                                        + " matched "
                                        + currentNodeId
                                        + "/"
                                        + outcome
                                        + " -> "
                                        + edge.toNodeId());
                return RoutingDecision.of(edge);
            }
        }
        return RoutingDecision.NO_MATCH;
    }

    /// Routes an outcome and fails when nothing matches.
    ///
    /// @throws NoMatchingEdgeException if no edge matches
    public RoutingDecision requireNextNode(
            String currentNodeId, String outcome, ExecutionSnapshot state)
            throws NoMatchingEdgeException {
        RoutingDecision decision = getNextNode(currentNodeId, outcome, state);
        if (!decision.matched()) {
            throw new NoMatchingEdgeException(currentNodeId, outcome);
        }
        return decision;
    }

    public boolean isTerminalNode(String nodeId) {
        return plan.getNode(nodeId).map(Node::isEnd).orElse(false);
    }

    /// Returns the terminal outcome declared by an end node.
    public Optional<String> getTerminalOutcome(String nodeId) {
        return plan.getNode(nodeId).filter(Node::isEnd).map(Node::getTerminalOutcome);
    }

    /// Returns the gate outcome declared by an end node.
    public Optional<String> getGateOutcome(String nodeId) {
        return plan.getNode(nodeId).filter(Node::isEnd).map(Node::getGateOutcome);
    }

    public List<String> getEscalationOptions(Edge edge) {
        return edge != null ? edge.escalationOptions() : List.of();
    }

    /// Returns whether at least one edge from the node handles the outcome,
    /// ignoring conditions.
    public boolean validateOutcome(String nodeId, String outcome) {
        return plan.getEdgesFrom(nodeId).stream().anyMatch(e -> e.outcome().equals(outcome));
    }

    public WorkflowPlan getPlan() {
        return plan;
    }
}

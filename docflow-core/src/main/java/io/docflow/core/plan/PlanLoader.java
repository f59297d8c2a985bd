package io.docflow.core.plan;

import io.docflow.core.exception.PlanLoadException;
import io.docflow.core.plan.edge.ConditionOperator;
import io.docflow.core.plan.edge.ConditionType;
import io.docflow.core.plan.edge.Edge;
import io.docflow.core.plan.edge.EdgeCondition;
import io.docflow.core.plan.edge.EdgeKind;
import io.docflow.core.plan.governance.CircuitBreaker;
import io.docflow.core.plan.governance.DownstreamRequirements;
import io.docflow.core.plan.governance.Governance;
import io.docflow.core.plan.governance.StalenessHandling;
import io.docflow.core.plan.node.Node;
import io.docflow.core.plan.node.NodeType;
import io.docflow.core.plan.validation.PlanValidationError;
import io.docflow.core.plan.validation.PlanValidationResult;
import io.docflow.core.plan.validation.PlanValidator;
import io.docflow.core.util.RawMaps;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Builds {@link WorkflowPlan}s from raw definitions.
///
/// Every definition is validated first; a plan is never constructed from a definition
/// with validation errors. Warnings are logged and do not block loading.
///
/// @see PlanValidator for the validation phases
/// @see PlanRegistry#load(PlanLoader, PlanDefinitionSource) for startup loading
public class PlanLoader {

    private static final Logger logger = Logger.getLogger(PlanLoader.class.getName());

    private static final Set<String> TYPED_NODE_FIELDS =
            Set.of(
                    "node_id",
                    "type",
                    "description",
                    "task_ref",
                    "produces",
                    "requires_consent",
                    "requires_qa",
                    "gate_outcomes",
                    "terminal_outcome",
                    "gate_outcome");

    private final PlanValidator validator;

    public PlanLoader() {
        this(new PlanValidator());
    }

    public PlanLoader(PlanValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    /// Validates and builds a single plan.
    ///
    /// @param raw definition tree, not null
    /// @return the plan, never null
    /// @throws PlanLoadException if the definition has validation errors
    public WorkflowPlan load(Map<String, Object> raw) throws PlanLoadException {
        return load(new PlanDefinition("<inline>", raw));
    }

    /// Validates and builds a single plan.
    ///
    /// @param definition definition with its source name, not null
    /// @return the plan, never null
    /// @throws PlanLoadException carrying up to five errors if the definition is invalid
    public WorkflowPlan load(PlanDefinition definition) throws PlanLoadException {
        PlanValidationResult result = validator.validate(definition.raw());
        for (PlanValidationError warning : result.warnings()) {
            logger.warning("Plan " + definition.source() + ": " + warning);
        }
        if (!result.valid()) {
            throw new PlanLoadException(definition.source(), result.errors());
        }
        WorkflowPlan plan = build(definition.raw());
        logger.fine(() -> "Loaded " + plan + " from " + definition.source());
        return plan;
    }

    /// Loads every definition a source yields.
    ///
    /// @param source definition source, not null
    /// @return plans in source order, never null
    /// @throws PlanLoadException on the first definition that cannot be read or is invalid
    public List<WorkflowPlan> loadAll(PlanDefinitionSource source) throws PlanLoadException {
        List<WorkflowPlan> plans = new ArrayList<>();
        for (PlanDefinition definition : source.readAll()) {
            plans.add(load(definition));
        }
        return plans;
    }

    private WorkflowPlan build(Map<String, Object> raw) {
        WorkflowPlan.Builder builder =
                WorkflowPlan.builder()
                        .workflowId(RawMaps.string(raw, "workflow_id"))
                        .version(RawMaps.string(raw, "version"))
                        .name(RawMaps.string(raw, "name"))
                        .description(RawMaps.string(raw, "description"))
                        .scopeType(RawMaps.string(raw, "scope_type"))
                        .documentType(RawMaps.string(raw, "document_type"))
                        .entryNodeIds(RawMaps.strings(raw, "entry_node_ids"))
                        .metadata(RawMaps.map(raw, "metadata"));

        for (Map<String, Object> node : RawMaps.maps(raw, "nodes")) {
            builder.node(buildNode(node));
        }
        for (Map<String, Object> edge : RawMaps.maps(raw, "edges")) {
            builder.edge(buildEdge(edge));
        }

        Map<String, Object> outcomeMapping = RawMaps.map(raw, "outcome_mapping");
        if (outcomeMapping != null) {
            for (Map<String, Object> mapping : RawMaps.maps(outcomeMapping, "mappings")) {
                builder.mapOutcome(
                        RawMaps.string(mapping, "gate_outcome"),
                        RawMaps.string(mapping, "terminal_outcome"));
            }
        }

        Map<String, Object> ownership = RawMaps.map(raw, "thread_ownership");
        if (ownership != null) {
            builder.threadOwnership(
                    new ThreadOwnership(
                            RawMaps.bool(ownership, "owns_thread", false),
                            RawMaps.string(ownership, "thread_purpose")));
        }

        Map<String, Object> governance = RawMaps.map(raw, "governance");
        if (governance != null) {
            builder.governance(buildGovernance(governance));
        }
        return builder.build();
    }

    private Node buildNode(Map<String, Object> raw) {
        Map<String, Object> extra = new HashMap<>(raw);
        extra.keySet().removeAll(TYPED_NODE_FIELDS);
        return Node.builder()
                .nodeId(RawMaps.string(raw, "node_id"))
                .type(NodeType.fromWire(RawMaps.string(raw, "type")).orElseThrow())
                .description(RawMaps.string(raw, "description"))
                .taskRef(RawMaps.string(raw, "task_ref"))
                .produces(RawMaps.string(raw, "produces"))
                .requiresConsent(RawMaps.bool(raw, "requires_consent", false))
                .requiresQa(RawMaps.bool(raw, "requires_qa", true))
                .gateOutcomes(RawMaps.strings(raw, "gate_outcomes"))
                .terminalOutcome(RawMaps.string(raw, "terminal_outcome"))
                .gateOutcome(RawMaps.string(raw, "gate_outcome"))
                .config(extra)
                .build();
    }

    private Edge buildEdge(Map<String, Object> raw) {
        String kind = RawMaps.string(raw, "kind");
        Edge.Builder builder =
                Edge.builder()
                        .edgeId(RawMaps.string(raw, "edge_id"))
                        .from(RawMaps.string(raw, "from_node_id"))
                        .to(RawMaps.string(raw, "to_node_id"))
                        .outcome(RawMaps.string(raw, "outcome"))
                        .label(RawMaps.string(raw, "label"))
                        .kind(kind != null ? EdgeKind.fromWire(kind).orElseThrow() : EdgeKind.AUTO)
                        .escalationOptions(RawMaps.strings(raw, "escalation_options"));
        for (Map<String, Object> condition : RawMaps.maps(raw, "conditions")) {
            builder.condition(
                    new EdgeCondition(
                            ConditionType.fromWire(RawMaps.string(condition, "type")).orElseThrow(),
                            ConditionOperator.fromWire(RawMaps.string(condition, "operator"))
                                    .orElseThrow(),
                            condition.get("value")));
        }
        return builder.build();
    }

    private Governance buildGovernance(Map<String, Object> raw) {
        CircuitBreaker breaker = null;
        Map<String, Object> rawBreaker = RawMaps.map(raw, "circuit_breaker");
        if (rawBreaker != null) {
            breaker =
                    new CircuitBreaker(
                            ((Number) rawBreaker.get("max_retries")).intValue(),
                            RawMaps.strings(rawBreaker, "applies_to"),
                            RawMaps.string(rawBreaker, "escalation_per_adr"));
        }

        StalenessHandling staleness = null;
        Map<String, Object> rawStaleness = RawMaps.map(raw, "staleness_handling");
        if (rawStaleness != null) {
            staleness =
                    new StalenessHandling(
                            RawMaps.bool(rawStaleness, "auto_reentry"),
                            RawMaps.string(rawStaleness, "refresh_option"),
                            RawMaps.string(rawStaleness, "description"));
        }

        DownstreamRequirements downstream = null;
        Map<String, Object> rawDownstream = RawMaps.map(raw, "downstream_requirements");
        if (rawDownstream != null) {
            downstream =
                    new DownstreamRequirements(
                            RawMaps.strings(rawDownstream, "conditions"),
                            RawMaps.string(rawDownstream, "description"));
        }

        return new Governance(
                RawMaps.strings(raw, "adr_references"), breaker, staleness, downstream);
    }
}

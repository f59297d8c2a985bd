package io.docflow.core.plan.validation;

import static io.docflow.core.plan.validation.PlanValidationErrorCode.*;

import io.docflow.core.plan.edge.ConditionOperator;
import io.docflow.core.plan.edge.ConditionType;
import io.docflow.core.plan.edge.EdgeKind;
import io.docflow.core.plan.node.NodeType;
import io.docflow.core.util.RawMaps;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/// Validates raw plan definitions before they are turned into {@link io.docflow.core.plan.WorkflowPlan}s.
///
/// Validation runs in four ordered phases:
/// 1. **Schema** - required fields, field types, enum values, duplicate ids.
///    Later phases are skipped if this phase reports errors.
/// 2. **Graph** - edge endpoints and entry nodes resolve, non-terminal nodes have an
///    outbound edge, every node is reachable from an entry node (warning only).
/// 3. **Outcome mapping** - every gate outcome is mapped to a terminal outcome.
/// 4. **Governance** - circuit breaker and staleness handling are well formed.
///
/// All findings of a phase are collected; the validator never fails fast on the
/// first one and never throws for malformed input.
///
/// @implNote Stateless and thread-safe.
public class PlanValidator {

    private static final Logger logger = Logger.getLogger(PlanValidator.class.getName());

    private static final List<String> REQUIRED_FIELDS =
            List.of("workflow_id", "nodes", "edges", "entry_node_ids");

    /// Validates a raw definition.
    ///
    /// @param raw definition as a JSON-shaped map, not null
    /// @return validation result, never null
    public PlanValidationResult validate(Map<String, Object> raw) {
        List<PlanValidationError> errors = new ArrayList<>();
        List<PlanValidationError> warnings = new ArrayList<>();

        validateSchema(raw, errors);
        if (!errors.isEmpty()) {
            logger.fine(() -> "Schema validation failed with " + errors.size() + " error(s)");
            return new PlanValidationResult(errors, warnings);
        }

        validateGraph(raw, errors, warnings);
        validateOutcomeMapping(raw, errors);
        validateGovernance(raw, errors, warnings);
        return new PlanValidationResult(errors, warnings);
    }

    // -- schema ---------------------------------------------------------------

    private void validateSchema(Map<String, Object> raw, List<PlanValidationError> errors) {
        for (String field : REQUIRED_FIELDS) {
            if (!raw.containsKey(field) || raw.get(field) == null) {
                errors.add(
                        new PlanValidationError(
                                MISSING_REQUIRED_FIELD,
                                "Missing required field: " + field,
                                "$." + field));
            }
        }

        if (raw.containsKey("workflow_id") && !(raw.get("workflow_id") instanceof String)) {
            errors.add(typeError("$.workflow_id", "workflow_id must be a string"));
        }
        for (String field : List.of("nodes", "edges", "entry_node_ids")) {
            Object value = raw.get(field);
            if (value != null && !(value instanceof List)) {
                errors.add(typeError("$." + field, field + " must be an array"));
            }
        }
        List<Object> entries = RawMaps.list(raw, "entry_node_ids");
        if (entries != null && entries.isEmpty()) {
            errors.add(
                    new PlanValidationError(
                            MISSING_REQUIRED_FIELD,
                            "entry_node_ids must not be empty",
                            "$.entry_node_ids"));
        }

        List<Object> nodes = RawMaps.list(raw, "nodes");
        if (nodes != null) {
            Set<String> seen = new HashSet<>();
            for (int i = 0; i < nodes.size(); i++) {
                validateNode(nodes.get(i), i, seen, errors);
            }
        }
        List<Object> edges = RawMaps.list(raw, "edges");
        if (edges != null) {
            Set<String> seen = new HashSet<>();
            for (int i = 0; i < edges.size(); i++) {
                validateEdge(edges.get(i), i, seen, errors);
            }
        }
    }

    private void validateNode(
            Object element, int index, Set<String> seen, List<PlanValidationError> errors) {
        String path = "$.nodes[" + index + "]";
        Map<String, Object> node = RawMaps.asMap(element);
        if (node == null) {
            errors.add(typeError(path, "node must be an object"));
            return;
        }
        String nodeId = RawMaps.string(node, "node_id");
        if (nodeId == null) {
            errors.add(
                    new PlanValidationError(
                            MISSING_REQUIRED_FIELD, "Node missing node_id", path + ".node_id"));
        } else if (!seen.add(nodeId)) {
            errors.add(
                    new PlanValidationError(
                            DUPLICATE_NODE_ID,
                            "Duplicate node_id: " + nodeId,
                            path + ".node_id",
                            Map.of("node_id", nodeId)));
        }

        String type = RawMaps.string(node, "type");
        if (type == null) {
            errors.add(
                    new PlanValidationError(
                            MISSING_REQUIRED_FIELD,
                            "Node " + nodeId + " missing type",
                            path + ".type"));
            return;
        }
        if (NodeType.fromWire(type).isEmpty()) {
            errors.add(
                    new PlanValidationError(
                            INVALID_ENUM_VALUE,
                            "Invalid node type: " + type,
                            path + ".type",
                            Map.of("value", type, "allowed", wireValues(NodeType.values()))));
            return;
        }
        if (NodeType.END.wireValue().equals(type) && RawMaps.string(node, "terminal_outcome") == null) {
            errors.add(
                    new PlanValidationError(
                            MISSING_REQUIRED_FIELD,
                            "End node " + nodeId + " missing terminal_outcome",
                            path + ".terminal_outcome"));
        }
        Object gateOutcomes = node.get("gate_outcomes");
        if (gateOutcomes != null && !(gateOutcomes instanceof List)) {
            errors.add(typeError(path + ".gate_outcomes", "gate_outcomes must be an array"));
        }
    }

    private void validateEdge(
            Object element, int index, Set<String> seen, List<PlanValidationError> errors) {
        String path = "$.edges[" + index + "]";
        Map<String, Object> edge = RawMaps.asMap(element);
        if (edge == null) {
            errors.add(typeError(path, "edge must be an object"));
            return;
        }
        for (String field : List.of("edge_id", "from_node_id", "outcome")) {
            if (RawMaps.string(edge, field) == null) {
                errors.add(
                        new PlanValidationError(
                                MISSING_REQUIRED_FIELD,
                                "Edge missing required field: " + field,
                                path + "." + field));
            }
        }
        String edgeId = RawMaps.string(edge, "edge_id");
        if (edgeId != null && !seen.add(edgeId)) {
            errors.add(
                    new PlanValidationError(
                            DUPLICATE_EDGE_ID,
                            "Duplicate edge_id: " + edgeId,
                            path + ".edge_id",
                            Map.of("edge_id", edgeId)));
        }
        String kind = RawMaps.string(edge, "kind");
        if (kind != null && EdgeKind.fromWire(kind).isEmpty()) {
            errors.add(
                    new PlanValidationError(
                            INVALID_ENUM_VALUE,
                            "Invalid edge kind: " + kind,
                            path + ".kind",
                            Map.of("value", kind, "allowed", wireValues(EdgeKind.values()))));
        }

        Object conditions = edge.get("conditions");
        if (conditions == null) {
            return;
        }
        if (!(conditions instanceof List<?> list)) {
            errors.add(typeError(path + ".conditions", "conditions must be an array"));
            return;
        }
        for (int j = 0; j < list.size(); j++) {
            validateCondition(list.get(j), path + ".conditions[" + j + "]", errors);
        }
    }

    private void validateCondition(Object element, String path, List<PlanValidationError> errors) {
        Map<String, Object> condition = RawMaps.asMap(element);
        if (condition == null) {
            errors.add(typeError(path, "condition must be an object"));
            return;
        }
        for (String field : List.of("type", "operator", "value")) {
            if (!condition.containsKey(field)) {
                errors.add(
                        new PlanValidationError(
                                MISSING_REQUIRED_FIELD,
                                "Condition missing required field: " + field,
                                path + "." + field));
            }
        }
        String type = RawMaps.string(condition, "type");
        if (type != null && ConditionType.fromWire(type).isEmpty()) {
            errors.add(
                    new PlanValidationError(
                            INVALID_ENUM_VALUE,
                            "Invalid condition type: " + type,
                            path + ".type",
                            Map.of("value", type, "allowed", wireValues(ConditionType.values()))));
        }
        String operator = RawMaps.string(condition, "operator");
        if (operator != null && ConditionOperator.fromWire(operator).isEmpty()) {
            errors.add(
                    new PlanValidationError(
                            INVALID_ENUM_VALUE,
                            "Invalid condition operator: " + operator,
                            path + ".operator",
                            Map.of(
                                    "value",
                                    operator,
                                    "allowed",
                                    wireValues(ConditionOperator.values()))));
        }
    }

    // -- graph ----------------------------------------------------------------

    private void validateGraph(
            Map<String, Object> raw,
            List<PlanValidationError> errors,
            List<PlanValidationError> warnings) {
        List<Map<String, Object>> nodes = RawMaps.maps(raw, "nodes");
        List<Map<String, Object>> edges = RawMaps.maps(raw, "edges");

        Set<String> nodeIds = new LinkedHashSet<>();
        Map<String, String> typeById = new HashMap<>();
        for (Map<String, Object> node : nodes) {
            String id = RawMaps.string(node, "node_id");
            nodeIds.add(id);
            typeById.put(id, RawMaps.string(node, "type"));
        }

        Set<String> withOutbound = new HashSet<>();
        for (int i = 0; i < edges.size(); i++) {
            Map<String, Object> edge = edges.get(i);
            String edgeId = RawMaps.string(edge, "edge_id");
            String from = RawMaps.string(edge, "from_node_id");
            String to = RawMaps.string(edge, "to_node_id");
            if (!nodeIds.contains(from)) {
                errors.add(
                        new PlanValidationError(
                                EDGE_SOURCE_NOT_FOUND,
                                "Edge " + edgeId + " references unknown source node: " + from,
                                "$.edges[" + i + "].from_node_id",
                                Map.of("edge_id", edgeId, "from_node_id", from)));
            }
            if (to != null && !nodeIds.contains(to)) {
                errors.add(
                        new PlanValidationError(
                                EDGE_TARGET_NOT_FOUND,
                                "Edge " + edgeId + " references unknown target node: " + to,
                                "$.edges[" + i + "].to_node_id",
                                Map.of("edge_id", edgeId, "to_node_id", to)));
            }
            withOutbound.add(from);
        }

        List<String> entryIds = RawMaps.strings(raw, "entry_node_ids");
        for (int i = 0; i < entryIds.size(); i++) {
            String entry = entryIds.get(i);
            if (!nodeIds.contains(entry)) {
                errors.add(
                        new PlanValidationError(
                                ENTRY_NODE_NOT_FOUND,
                                "Entry node not found: " + entry,
                                "$.entry_node_ids[" + i + "]",
                                Map.of("node_id", entry)));
            }
        }

        for (String nodeId : nodeIds) {
            if (!NodeType.END.wireValue().equals(typeById.get(nodeId))
                    && !withOutbound.contains(nodeId)) {
                errors.add(
                        new PlanValidationError(
                                NO_OUTBOUND_EDGES,
                                "Non-terminal node has no outbound edges: " + nodeId,
                                "$.nodes[?(@.node_id=='" + nodeId + "')]",
                                Map.of("node_id", nodeId)));
            }
        }

        Set<String> reachable = reachableFrom(entryIds, edges);
        for (String nodeId : nodeIds) {
            if (!reachable.contains(nodeId)) {
                warnings.add(
                        new PlanValidationError(
                                ORPHAN_NODE,
                                "Node is not reachable from any entry node: " + nodeId,
                                "$.nodes[?(@.node_id=='" + nodeId + "')]",
                                Map.of("node_id", nodeId)));
            }
        }
    }

    /// Breadth-first search over advancing edges starting at the entry nodes.
    private Set<String> reachableFrom(List<String> entryIds, List<Map<String, Object>> edges) {
        Map<String, List<String>> adjacency = new HashMap<>();
        for (Map<String, Object> edge : edges) {
            String to = RawMaps.string(edge, "to_node_id");
            if (to != null) {
                adjacency
                        .computeIfAbsent(RawMaps.string(edge, "from_node_id"), k -> new ArrayList<>())
                        .add(to);
            }
        }
        Set<String> reachable = new HashSet<>(entryIds);
        Deque<String> queue = new ArrayDeque<>(entryIds);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : adjacency.getOrDefault(current, List.of())) {
                if (reachable.add(next)) {
                    queue.add(next);
                }
            }
        }
        return reachable;
    }

    // -- outcome mapping ------------------------------------------------------

    private void validateOutcomeMapping(Map<String, Object> raw, List<PlanValidationError> errors) {
        Set<String> gateOutcomes = new LinkedHashSet<>();
        for (Map<String, Object> node : RawMaps.maps(raw, "nodes")) {
            NodeType type = NodeType.fromWire(RawMaps.string(node, "type")).orElseThrow();
            if (type.isGate()) {
                gateOutcomes.addAll(RawMaps.strings(node, "gate_outcomes"));
            }
        }

        Map<String, Object> outcomeMapping = RawMaps.map(raw, "outcome_mapping");
        List<Map<String, Object>> mappings =
                outcomeMapping != null ? RawMaps.maps(outcomeMapping, "mappings") : List.of();
        if (mappings.isEmpty()) {
            if (!gateOutcomes.isEmpty()) {
                errors.add(
                        new PlanValidationError(
                                MISSING_OUTCOME_MAPPING,
                                "Plan has gate outcomes but no outcome_mapping",
                                "$.outcome_mapping",
                                Map.of("gate_outcomes", List.copyOf(gateOutcomes))));
            }
            return;
        }

        Set<String> mapped = new HashSet<>();
        for (int i = 0; i < mappings.size(); i++) {
            Map<String, Object> mapping = mappings.get(i);
            String gate = RawMaps.string(mapping, "gate_outcome");
            if (gate == null || RawMaps.string(mapping, "terminal_outcome") == null) {
                errors.add(
                        new PlanValidationError(
                                MISSING_REQUIRED_FIELD,
                                "Outcome mapping requires gate_outcome and terminal_outcome",
                                "$.outcome_mapping.mappings[" + i + "]"));
                continue;
            }
            mapped.add(gate);
        }

        List<String> unmapped = new ArrayList<>();
        for (String outcome : gateOutcomes) {
            if (!mapped.contains(outcome)) {
                unmapped.add(outcome);
            }
        }
        if (!unmapped.isEmpty()) {
            errors.add(
                    new PlanValidationError(
                            INCOMPLETE_OUTCOME_MAPPING,
                            "Gate outcomes not mapped: " + unmapped,
                            "$.outcome_mapping.mappings",
                            Map.of("unmapped", unmapped)));
        }
    }

    // -- governance -----------------------------------------------------------

    private void validateGovernance(
            Map<String, Object> raw,
            List<PlanValidationError> errors,
            List<PlanValidationError> warnings) {
        Map<String, Object> governance = RawMaps.map(raw, "governance");
        if (governance == null) {
            return;
        }

        Map<String, Object> breaker = RawMaps.map(governance, "circuit_breaker");
        if (breaker != null) {
            Object maxRetries = breaker.get("max_retries");
            if (maxRetries == null) {
                errors.add(
                        new PlanValidationError(
                                INVALID_CIRCUIT_BREAKER,
                                "circuit_breaker missing required field: max_retries",
                                "$.governance.circuit_breaker"));
            } else if (!RawMaps.isInteger(maxRetries)) {
                errors.add(
                        new PlanValidationError(
                                INVALID_CIRCUIT_BREAKER,
                                "circuit_breaker.max_retries must be an integer",
                                "$.governance.circuit_breaker.max_retries"));
            } else if (maxRetries instanceof Number number && number.longValue() < 1) {
                errors.add(
                        new PlanValidationError(
                                INVALID_CIRCUIT_BREAKER,
                                "circuit_breaker.max_retries must be >= 1",
                                "$.governance.circuit_breaker.max_retries"));
            }
        }

        Map<String, Object> staleness = RawMaps.map(governance, "staleness_handling");
        if (staleness != null && !staleness.containsKey("auto_reentry")) {
            warnings.add(
                    new PlanValidationError(
                            INVALID_GOVERNANCE,
                            "staleness_handling should specify auto_reentry",
                            "$.governance.staleness_handling"));
        }
    }

    private static PlanValidationError typeError(String path, String message) {
        return new PlanValidationError(INVALID_FIELD_TYPE, message, path);
    }

    private static List<String> wireValues(Enum<?>[] values) {
        List<String> result = new ArrayList<>();
        for (Enum<?> value : values) {
            result.add(value.name().toLowerCase());
        }
        return result;
    }
}

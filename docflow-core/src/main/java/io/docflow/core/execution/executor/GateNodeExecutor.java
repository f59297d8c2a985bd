package io.docflow.core.execution.executor;

import io.docflow.core.plan.node.Node;
import io.docflow.core.plan.node.NodeType;
import io.docflow.core.state.ExecutionSnapshot;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Executes decision gates.
///
/// Three shapes, checked in order:
/// - **Consent gate** (`requires_consent`): asks `proceed` / `not_ready`; proceed-type
///   answers report `success`, decline-type answers report `blocked`.
/// - **Outcome gate** (`gate_outcomes` declared): asks for one of the outcomes and
///   reports the selection as both outcome and `gate_outcome` metadata.
/// - **Pass-through gate**: reports `success`.
///
/// Only an explicit choice submitted with the step advances a gate. Invalid
/// selections re-prompt with the same choices.
public class GateNodeExecutor implements NodeExecutor {

    private static final Logger logger = Logger.getLogger(GateNodeExecutor.class.getName());

    public static final String PROCEED = "proceed";
    public static final String NOT_READY = "not_ready";
    public static final List<String> CONSENT_CHOICES = List.of(PROCEED, NOT_READY);

    private static final Set<String> PROCEED_ANSWERS = Set.of(PROCEED, "yes", "consent_proceed");
    private static final Set<String> DECLINE_ANSWERS = Set.of(NOT_READY, "no", "consent_decline");

    @Override
    public NodeType getNodeType() {
        return NodeType.GATE;
    }

    @Override
    public NodeResult execute(Node node, NodeContext context, ExecutionSnapshot state) {
        Optional<String> selection = context.getUserChoice();
        if (node.isRequiresConsent()) {
            return consent(node, selection.orElse(null));
        }
        if (!node.getGateOutcomes().isEmpty()) {
            return selectOutcome(node, selection.orElse(null));
        }
        logger.fine(() -> "Gate " + node.getNodeId() + " passed (no conditions)");
        return NodeResult.builder(NodeResult.SUCCESS).metadata("gate_id", node.getNodeId()).build();
    }

    private NodeResult consent(Node node, String selection) {
        String nodeId = node.getNodeId();
        if (selection == null) {
            logger.info("Gate " + nodeId + " requesting consent");
            return NodeResult.builder(NodeResult.NEEDS_USER_INPUT)
                    .requiresUserInput(
                            "Do you want to proceed with document generation?", CONSENT_CHOICES)
                    .metadata("gate_id", nodeId)
                    .metadata("consent_required", true)
                    .build();
        }
        if (PROCEED_ANSWERS.contains(selection)) {
            logger.info("Gate " + nodeId + " consent granted via '" + selection + "'");
            return consentResult(NodeResult.SUCCESS, nodeId, true, selection);
        }
        if (DECLINE_ANSWERS.contains(selection)) {
            logger.info("Gate " + nodeId + " consent declined via '" + selection + "'");
            return consentResult(NodeResult.BLOCKED, nodeId, false, selection);
        }
        logger.warning("Gate " + nodeId + " received invalid consent option: '" + selection + "'");
        return NodeResult.builder(NodeResult.NEEDS_USER_INPUT)
                .requiresUserInput("Please select a valid option: proceed or not_ready", CONSENT_CHOICES)
                .metadata("gate_id", nodeId)
                .metadata("consent_required", true)
                .metadata("invalid_selection", selection)
                .build();
    }

    private NodeResult consentResult(String outcome, String nodeId, boolean consent, String selection) {
        return NodeResult.builder(outcome)
                .metadata("gate_id", nodeId)
                .metadata("consent", consent)
                .metadata("selected_option_id", selection)
                .build();
    }

    private NodeResult selectOutcome(Node node, String selection) {
        String nodeId = node.getNodeId();
        List<String> outcomes = node.getGateOutcomes();
        if (selection == null) {
            logger.info("Gate " + nodeId + " requesting outcome selection from " + outcomes);
            return NodeResult.builder(NodeResult.NEEDS_USER_INPUT)
                    .requiresUserInput("Select the appropriate outcome for this gate", outcomes)
                    .metadata("gate_id", nodeId)
                    .metadata("outcome_selection", true)
                    .build();
        }
        if (!outcomes.contains(selection)) {
            logger.warning(
                    "Gate " + nodeId + " received invalid option '" + selection + "', valid: " + outcomes);
            return NodeResult.builder(NodeResult.NEEDS_USER_INPUT)
                    .requiresUserInput(
                            "Invalid selection. Please choose from: " + String.join(", ", outcomes),
                            outcomes)
                    .metadata("gate_id", nodeId)
                    .metadata("outcome_selection", true)
                    .metadata("invalid_selection", selection)
                    .build();
        }
        logger.info("Gate " + nodeId + " outcome selected: " + selection);
        return NodeResult.builder(selection)
                .metadata("gate_id", nodeId)
                .metadata("gate_outcome", selection)
                .metadata("selected_option_id", selection)
                .build();
    }
}

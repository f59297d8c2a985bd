package io.docflow.core.execution.executor;

import io.docflow.core.llm.IntakeClassification;
import io.docflow.core.llm.IntakeClassifier;
import io.docflow.core.plan.node.Node;
import io.docflow.core.plan.node.NodeType;
import io.docflow.core.state.ExecutionSnapshot;
import io.docflow.core.state.NodeExecution;
import io.docflow.core.util.RawMaps;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Executes intake-classification gates.
///
/// Accumulates the user's intake text across pauses and asks the
/// {@link IntakeClassifier} whether it is sufficient. The extracted intake frame is
/// carried in history metadata (`intake_frame`) so answered questions are never
/// asked again.
///
/// - no input yet: pauses asking for a description
/// - classification incomplete: pauses with the classifier's single follow-up question
/// - classification complete: reports the classified outcome, with `gate_outcome`
///   and `intake_summary` metadata
public class IntakeGateNodeExecutor implements NodeExecutor {

    private static final Logger logger = Logger.getLogger(IntakeGateNodeExecutor.class.getName());

    public static final String INTAKE_FRAME = "intake_frame";
    public static final String RAW_INPUTS = "raw_inputs";

    private final IntakeClassifier classifier;

    public IntakeGateNodeExecutor(IntakeClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.INTAKE_GATE;
    }

    @Override
    public NodeResult execute(Node node, NodeContext context, ExecutionSnapshot state)
            throws Exception {
        String nodeId = node.getNodeId();
        Optional<String> input = context.getUserInput().or(context::getUserChoice);
        if (input.isEmpty()) {
            logger.info("Intake gate " + nodeId + ": no input, requesting description");
            return NodeResult.needsInput("Please describe what you'd like to build or accomplish.", null);
        }

        Map<String, Object> previousFrame = previousFrame(nodeId, state);
        List<String> rawInputs = rawInputs(previousFrame);
        rawInputs.add(input.get());

        IntakeClassification classification =
                classifier.classify(String.join(" ", rawInputs), previousFrame, node.getGateOutcomes());
        Map<String, Object> frame = new LinkedHashMap<>(classification.frame());
        frame.put(RAW_INPUTS, rawInputs);

        if (!classification.isComplete()) {
            String question =
                    classification.followUpQuestion() != null
                            ? classification.followUpQuestion()
                            : "Please provide more details.";
            logger.info("Intake gate " + nodeId + ": incomplete, asking follow-up");
            return NodeResult.builder(NodeResult.NEEDS_USER_INPUT)
                    .requiresUserInput(question, null)
                    .metadata(INTAKE_FRAME, frame)
                    .build();
        }

        String outcome = classification.outcome();
        if (!node.getGateOutcomes().isEmpty() && !node.getGateOutcomes().contains(outcome)) {
            throw new IllegalStateException(
                    "Intake classifier returned undeclared outcome '"
                            + outcome
                            + "' for gate "
                            + nodeId
                            + ", declared: "
                            + node.getGateOutcomes());
        }
        Map<String, Object> summary = new LinkedHashMap<>(classification.frame());
        summary.put("input", String.join(" ", rawInputs));
        logger.info("Intake gate " + nodeId + ": classified as " + outcome);
        return NodeResult.builder(outcome)
                .metadata(INTAKE_FRAME, frame)
                .metadata("gate_outcome", outcome)
                .metadata("intake_summary", summary)
                .build();
    }

    private static Map<String, Object> previousFrame(String nodeId, ExecutionSnapshot state) {
        List<NodeExecution> history = state.nodeHistory();
        for (int i = history.size() - 1; i >= 0; i--) {
            NodeExecution entry = history.get(i);
            Map<String, Object> frame = RawMaps.asMap(entry.metadata().get(INTAKE_FRAME));
            if (entry.nodeId().equals(nodeId) && frame != null) {
                return frame;
            }
        }
        return Map.of();
    }

    private static List<String> rawInputs(Map<String, Object> frame) {
        List<String> inputs = new ArrayList<>();
        if (frame.get(RAW_INPUTS) instanceof List<?> raw) {
            for (Object value : raw) {
                inputs.add(String.valueOf(value));
            }
        }
        return inputs;
    }
}

package io.docflow.core.execution.executor;

import io.docflow.core.llm.QaEvaluator;
import io.docflow.core.llm.QaVerdict;
import io.docflow.core.llm.SchemaValidationResult;
import io.docflow.core.llm.SchemaValidator;
import io.docflow.core.plan.node.Node;
import io.docflow.core.plan.node.NodeType;
import io.docflow.core.state.ExecutionSnapshot;
import io.docflow.core.state.NodeExecution;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Executes QA nodes over the most recently generated document.
///
/// Checks run in order and stop at the first failure: structural validation
/// through the optional {@link SchemaValidator}, then semantic review through the
/// optional {@link QaEvaluator}. Reports `success` or `failed`; a failure carries
/// `issues` and `feedback` metadata that the plan executor stores as QA feedback.
///
/// This executor never touches retry counters and never decides whether a circuit
/// breaker trips.
public class QaNodeExecutor implements NodeExecutor {

    private static final Logger logger = Logger.getLogger(QaNodeExecutor.class.getName());

    private final SchemaValidator schemaValidator;
    private final QaEvaluator qaEvaluator;

    /// @param schemaValidator structural check, may be null to skip
    /// @param qaEvaluator semantic check, may be null to skip
    public QaNodeExecutor(SchemaValidator schemaValidator, QaEvaluator qaEvaluator) {
        this.schemaValidator = schemaValidator;
        this.qaEvaluator = qaEvaluator;
    }

    @Override
    public NodeType getNodeType() {
        return NodeType.QA;
    }

    @Override
    public NodeResult execute(Node node, NodeContext context, ExecutionSnapshot state) {
        String nodeId = node.getNodeId();
        if (!node.isRequiresQa()) {
            logger.fine(() -> "QA node " + nodeId + " skipped (requires_qa=false)");
            return NodeResult.builder(NodeResult.SUCCESS).metadata("skipped", true).build();
        }

        Optional<Map.Entry<String, Object>> latest = documentUnderReview(context, state);
        if (latest.isEmpty()) {
            return failure(
                    List.of(issue("missing_document", "No document available for QA")),
                    "No document to review");
        }
        String documentType = latest.get().getKey();
        Object document = latest.get().getValue();

        if (schemaValidator != null) {
            SchemaValidationResult validation = schemaValidator.validate(document, documentType);
            if (!validation.valid()) {
                List<Map<String, Object>> issues = new ArrayList<>();
                validation.errors().forEach(e -> issues.add(issue("schema", e)));
                logger.info("QA node " + nodeId + " failed schema validation: " + validation.errors());
                return failure(issues, "Schema validation failed");
            }
        }

        if (qaEvaluator != null) {
            QaVerdict verdict;
            try {
                verdict = qaEvaluator.evaluate(documentType, document);
            } catch (Exception e) {
                logger.log(Level.WARNING, "QA node " + nodeId + " evaluation failed", e);
                return failure(
                        List.of(issue("evaluation_error", String.valueOf(e.getMessage()))),
                        "QA evaluation could not be completed");
            }
            if (!verdict.passed()) {
                logger.info("QA node " + nodeId + " failed with " + verdict.issues().size() + " issue(s)");
                return failure(verdict.issues(), verdict.summary());
            }
        }

        logger.info("QA node " + nodeId + " passed");
        return NodeResult.builder(NodeResult.SUCCESS).metadata("document_type", documentType).build();
    }

    /// The document under review is the one named by the `produces` metadata of the
    /// most recent generation entry in history, else the last document in context.
    private static Optional<Map.Entry<String, Object>> documentUnderReview(
            NodeContext context, ExecutionSnapshot state) {
        Map<String, Object> documents = context.getDocumentContent();
        List<NodeExecution> history = state.nodeHistory();
        for (int i = history.size() - 1; i >= 0; i--) {
            Object produces = history.get(i).metadata().get("produces");
            if (produces != null && documents.containsKey(produces.toString())) {
                return Optional.of(
                        Map.entry(produces.toString(), documents.get(produces.toString())));
            }
        }
        Map.Entry<String, Object> last = null;
        for (Map.Entry<String, Object> entry : documents.entrySet()) {
            last = entry;
        }
        return Optional.ofNullable(last);
    }

    private static NodeResult failure(List<Map<String, Object>> issues, String summary) {
        Map<String, Object> feedback = new LinkedHashMap<>();
        feedback.put("issues", issues);
        feedback.put("summary", summary);
        feedback.put("source", "qa");
        return NodeResult.builder(NodeResult.FAILED)
                .metadata("issues", issues)
                .metadata("feedback", feedback)
                .build();
    }

    private static Map<String, Object> issue(String type, String message) {
        Map<String, Object> issue = new LinkedHashMap<>();
        issue.put("type", type);
        issue.put("message", message);
        return issue;
    }
}

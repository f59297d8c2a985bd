package io.docflow.core.execution.executor;

import io.docflow.core.llm.ChatMessage;
import io.docflow.core.llm.CompletionOptions;
import io.docflow.core.llm.CompletionService;
import io.docflow.core.llm.DocumentParser;
import io.docflow.core.llm.PromptLoader;
import io.docflow.core.plan.node.Node;
import io.docflow.core.plan.node.NodeType;
import io.docflow.core.state.ContextState;
import io.docflow.core.state.ExecutionSnapshot;
import io.docflow.core.util.RawMaps;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Executes generation nodes (`task` and `pgc`).
///
/// Loads the node's task prompt, assembles the user message from the governed
/// context (user request, bound constraints, QA feedback from the previous attempt,
/// input documents), calls the completion capability and parses the response.
///
/// - `task` nodes report `success` with the produced document, or `failed`
/// - `pgc` nodes report `needs_user_input` with the generated question set as a
///   structured payload and a `schema://<schema_version>` reference
///
/// Capability failures are reported as a `failed` outcome so the plan can route
/// them; they are not thrown.
public class TaskNodeExecutor implements NodeExecutor {

    private static final Logger logger = Logger.getLogger(TaskNodeExecutor.class.getName());

    public static final String DEFAULT_QUESTION_SCHEMA = "clarification_question_set.v2";

    private final NodeType nodeType;
    private final CompletionService completionService;
    private final PromptLoader promptLoader;
    private final DocumentParser documentParser;

    public TaskNodeExecutor(
            NodeType nodeType,
            CompletionService completionService,
            PromptLoader promptLoader,
            DocumentParser documentParser) {
        if (!Objects.requireNonNull(nodeType, "nodeType").isGenerating()) {
            throw new IllegalArgumentException("Not a generation node type: " + nodeType);
        }
        this.nodeType = nodeType;
        this.completionService = Objects.requireNonNull(completionService, "completionService");
        this.promptLoader = Objects.requireNonNull(promptLoader, "promptLoader");
        this.documentParser = Objects.requireNonNull(documentParser, "documentParser");
    }

    @Override
    public NodeType getNodeType() {
        return nodeType;
    }

    @Override
    public NodeResult execute(Node node, NodeContext context, ExecutionSnapshot state) {
        String nodeId = node.getNodeId();
        String taskRef = node.getTaskRef();
        if (taskRef == null) {
            logger.severe("Task node " + nodeId + " missing task_ref");
            return NodeResult.failed("Task node " + nodeId + " missing task_ref configuration");
        }

        Map<String, Object> document;
        try {
            String systemPrompt = promptLoader.loadTaskPrompt(taskRef);
            List<ChatMessage> messages = buildMessages(context);
            String role = node.getType() == NodeType.PGC ? "PGC Generator" : "Document Generator";
            String response =
                    completionService.complete(
                            messages,
                            systemPrompt,
                            CompletionOptions.tracking(
                                    context.getExecutionId(),
                                    nodeId,
                                    taskRef,
                                    context.getDocumentType(),
                                    role));
            document = documentParser.parse(response, node.getProduces());
        } catch (Exception e) {
            logger.log(Level.WARNING, "Task node " + nodeId + " failed: " + e.getMessage(), e);
            return NodeResult.builder(NodeResult.FAILED)
                    .metadata("reason", String.valueOf(e.getMessage()))
                    .metadata("task_ref", taskRef)
                    .build();
        }

        if (node.getProduces() != null) {
            context.getDocumentContent().put(node.getProduces(), document);
        }

        if (node.getType() == NodeType.PGC) {
            Object version = document.get("schema_version");
            String schemaRef = "schema://" + (version != null ? version : DEFAULT_QUESTION_SCHEMA);
            logger.info("PGC node " + nodeId + " pausing for answers, schema_ref=" + schemaRef);
            return NodeResult.builder(NodeResult.NEEDS_USER_INPUT)
                    .producedDocument(document)
                    .requiresUserInput(formatQuestions(document), null)
                    .payload(document, schemaRef)
                    .metadata("task_ref", taskRef)
                    .metadata("produces", node.getProduces())
                    .build();
        }

        logger.info("Task node " + nodeId + " completed");
        return NodeResult.builder(NodeResult.SUCCESS)
                .producedDocument(document)
                .metadata("task_ref", taskRef)
                .metadata("produces", node.getProduces())
                .build();
    }

    private List<ChatMessage> buildMessages(NodeContext context) {
        ContextState contextState = context.getContextState();
        List<String> parts = new ArrayList<>();

        String userInput = context.getUserInput().orElse(contextState.userInput().orElse(null));
        if (userInput != null) {
            parts.add("## User Request\n" + userInput);
        }

        List<Object> invariants = contextState.pgcInvariants();
        if (!invariants.isEmpty()) {
            StringBuilder bound = new StringBuilder("## Bound Constraints (final, do not reopen)\n");
            for (Object invariant : invariants) {
                bound.append("- ").append(describeInvariant(invariant)).append('\n');
            }
            parts.add(bound.toString().trim());
        }

        String feedback = renderQaFeedback(contextState.qaFeedback());
        if (feedback != null) {
            parts.add(feedback);
        }

        context.getDocumentContent()
                .forEach((type, content) -> parts.add("## Input Document: " + type + "\n" + content));

        List<ChatMessage> messages = new ArrayList<>(context.getConversationHistory());
        messages.add(
                ChatMessage.user(
                        parts.isEmpty() ? "Generate the document." : String.join("\n\n", parts)));
        return messages;
    }

    private static String describeInvariant(Object invariant) {
        Map<String, Object> map = RawMaps.asMap(invariant);
        if (map == null) {
            return String.valueOf(invariant);
        }
        Object label = map.getOrDefault("user_answer_label", map.get("user_answer"));
        String line = map.getOrDefault("id", "UNKNOWN") + ": " + label;
        return "exclusion".equals(map.get("binding_source")) ? line + " (excluded)" : line;
    }

    private static String renderQaFeedback(Map<String, Object> feedback) {
        if (!(feedback.get("issues") instanceof List<?> issues) || issues.isEmpty()) {
            return null;
        }
        StringBuilder text =
                new StringBuilder("## Previous QA Feedback (must address)\n")
                        .append("The previous generation attempt failed QA. Fix these issues:\n");
        int i = 1;
        for (Object issue : issues) {
            Object message = issue instanceof Map<?, ?> entry ? entry.get("message") : issue;
            text.append(i++).append(". ").append(message).append('\n');
        }
        return text.toString().trim();
    }

    private static String formatQuestions(Map<String, Object> document) {
        if (!(document.get("questions") instanceof List<?> questions) || questions.isEmpty()) {
            return "No clarification questions needed.";
        }
        StringBuilder text = new StringBuilder("Please answer the following questions:\n");
        int i = 1;
        for (Object question : questions) {
            Object body = question instanceof Map<?, ?> entry ? entry.get("text") : question;
            text.append(i++).append(". ").append(body).append('\n');
        }
        return text.toString().trim();
    }
}

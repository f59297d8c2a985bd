package io.docflow.serialization.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.docflow.core.llm.ChatMessage;
import io.docflow.core.llm.CompletionException;
import io.docflow.core.llm.CompletionOptions;
import io.docflow.core.llm.CompletionService;
import io.docflow.core.llm.IntakeClassification;
import io.docflow.core.llm.IntakeClassifier;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// {@link IntakeClassifier} that asks an LLM whether intake is sufficient.
///
/// Expected response:
/// ```json
/// {"outcome": "qualified", "follow_up_question": null, "frame": {"audience": "..."}}
/// ```
///
/// `outcome` must be one of the allowed outcomes; anything else, or an empty outcome,
/// is treated as insufficient intake. The new frame is merged over the previous one.
/// A response that is not a JSON object fails with {@link CompletionException}.
public class LlmIntakeClassifier implements IntakeClassifier {

    private static final Logger logger = Logger.getLogger(LlmIntakeClassifier.class.getName());

    static final String DEFAULT_QUESTION = "Could you tell me more about what you want to build and who it is for?";

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    private final CompletionService completionService;
    private final ObjectMapper objectMapper;

    public LlmIntakeClassifier(CompletionService completionService, ObjectMapper objectMapper) {
        this.completionService =
                Objects.requireNonNull(completionService, "completionService must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public IntakeClassification classify(
            String input, Map<String, Object> previousFrame, List<String> allowedOutcomes)
            throws CompletionException {
        String systemPrompt =
                "Classify whether the user's request is specific enough to start work. "
                        + "Allowed outcomes: "
                        + allowedOutcomes
                        + ". Answer with JSON: {\"outcome\": str or null, "
                        + "\"follow_up_question\": str or null, \"frame\": object}.";
        String request;
        try {
            request =
                    "Known facts: "
                            + objectMapper.writeValueAsString(previousFrame)
                            + "\n\nUser input:\n"
                            + input;
        } catch (JsonProcessingException e) {
            throw new CompletionException("Cannot encode intake frame", e);
        }
        String response =
                completionService.complete(
                        List.of(ChatMessage.user(request)),
                        systemPrompt,
                        CompletionOptions.tracking(null, null, null, null, "Intake"));

        JsonNode root;
        try {
            root = objectMapper.readTree(JsonResponses.stripCodeFences(response));
        } catch (JsonProcessingException e) {
            throw new CompletionException("Intake classification is not JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new CompletionException("Intake classification is not a JSON object");
        }

        Map<String, Object> frame = new LinkedHashMap<>(previousFrame);
        if (root.path("frame").isObject()) {
            frame.putAll(objectMapper.convertValue(root.get("frame"), OBJECT_MAP));
        }
        String outcome = root.hasNonNull("outcome") ? root.get("outcome").asText() : null;
        if (outcome != null && !allowedOutcomes.isEmpty() && !allowedOutcomes.contains(outcome)) {
            logger.warning("Classifier returned undeclared outcome '" + outcome + "', asking again");
            outcome = null;
        }
        if (outcome == null || outcome.isBlank()) {
            String question =
                    root.hasNonNull("follow_up_question")
                            ? root.get("follow_up_question").asText()
                            : DEFAULT_QUESTION;
            return new IntakeClassification(null, question, frame);
        }
        return new IntakeClassification(outcome, null, frame);
    }
}

package io.docflow.serialization.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.docflow.core.llm.ChatMessage;
import io.docflow.core.llm.CompletionException;
import io.docflow.core.llm.CompletionOptions;
import io.docflow.core.llm.CompletionService;
import io.docflow.core.llm.QaEvaluator;
import io.docflow.core.llm.QaVerdict;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// {@link QaEvaluator} that asks an LLM to judge a document.
///
/// The response is read as JSON first: an object with a `passed` flag and optional
/// `issues` (strings or objects with `message`) and `summary`. Free-text responses
/// are judged in three tiers:
/// 1. an explicit `Result: PASS` / `Result: FAIL` line
/// 2. pass or fail keywords, pass keywords checked first
/// 3. ambiguous text passes
///
/// On failure, bullet lines after an `### Issues` or `issues found` heading become issues.
public class LlmQaEvaluator implements QaEvaluator {

    static final String SYSTEM_PROMPT =
            "You are a quality reviewer. Judge the document against its type's expectations. "
                    + "Answer with JSON: {\"passed\": bool, \"issues\": [{\"type\": str, "
                    + "\"message\": str}], \"summary\": str}.";

    private static final Pattern RESULT_LINE = Pattern.compile("\\*{0,2}result\\*{0,2}:?\\*{0,2}\\s*(pass|fail)");
    private static final List<String> PASS_INDICATORS =
            List.of("passes all", "meets requirements", "approved", "no issues found", "quality: pass");
    private static final List<String> FAIL_INDICATORS =
            List.of("fails", "issues found", "rejected", "needs revision", "quality: fail");
    private static final Pattern BULLET = Pattern.compile("^\\s*(?:[-*\\u2022]|\\[[ x]?])\\s*(.+)$");
    private static final int MAX_ISSUE_LINES = 9;

    private final CompletionService completionService;
    private final ObjectMapper objectMapper;

    public LlmQaEvaluator(CompletionService completionService, ObjectMapper objectMapper) {
        this.completionService =
                Objects.requireNonNull(completionService, "completionService must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public QaVerdict evaluate(String documentType, Object document) throws CompletionException {
        String body;
        try {
            body = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            body = String.valueOf(document);
        }
        String request = "Document type: " + documentType + "\n\n```json\n" + body + "\n```";
        CompletionOptions options =
                CompletionOptions.tracking(null, null, null, documentType, "Quality Assurance");
        String response =
                completionService.complete(List.of(ChatMessage.user(request)), SYSTEM_PROMPT, options);
        return parse(response);
    }

    /// Parses a QA response, JSON first and free text otherwise.
    QaVerdict parse(String response) {
        QaVerdict structured = parseJson(response);
        if (structured != null) {
            return structured;
        }
        if (detectPass(response)) {
            return QaVerdict.pass(response);
        }
        return QaVerdict.fail(extractIssues(response), response);
    }

    private QaVerdict parseJson(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(JsonResponses.stripCodeFences(response));
        } catch (JsonProcessingException e) {
            return null;
        }
        if (root == null || !root.isObject() || !root.has("passed")) {
            return null;
        }
        List<Map<String, Object>> issues = new ArrayList<>();
        for (JsonNode issue : root.path("issues")) {
            Map<String, Object> entry = new LinkedHashMap<>();
            if (issue.isObject()) {
                entry.put("type", issue.path("type").asText("semantic"));
                entry.put("message", issue.has("message") ? issue.get("message").asText() : issue.toString());
            } else {
                entry.put("type", "semantic");
                entry.put("message", issue.asText());
            }
            issues.add(entry);
        }
        String summary = root.hasNonNull("summary") ? root.get("summary").asText() : null;
        return new QaVerdict(root.get("passed").asBoolean(), issues, summary);
    }

    static boolean detectPass(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        Matcher result = RESULT_LINE.matcher(lower);
        if (result.find()) {
            return "pass".equals(result.group(1));
        }
        if (PASS_INDICATORS.stream().anyMatch(lower::contains)) {
            return true;
        }
        return FAIL_INDICATORS.stream().noneMatch(lower::contains);
    }

    static List<Map<String, Object>> extractIssues(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        int start = lower.indexOf("### issues");
        if (start < 0) {
            start = lower.indexOf("issues found");
        }
        List<Map<String, Object>> issues = new ArrayList<>();
        if (start < 0) {
            return issues;
        }
        String[] lines = text.substring(start).split("\n");
        for (int i = 1; i < lines.length && i <= MAX_ISSUE_LINES; i++) {
            Matcher bullet = BULLET.matcher(lines[i]);
            if (bullet.matches()) {
                Map<String, Object> issue = new LinkedHashMap<>();
                issue.put("type", "semantic");
                issue.put("message", bullet.group(1).trim());
                issues.add(issue);
            }
        }
        return issues;
    }
}

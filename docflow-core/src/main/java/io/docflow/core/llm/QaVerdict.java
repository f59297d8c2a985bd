package io.docflow.core.llm;

import java.util.List;
import java.util.Map;

/// Semantic QA judgement of a document.
///
/// @param passed whether the document passed
/// @param issues structured issues, each with at least `type` and `message`, never null
/// @param summary free-text summary, may be null
public record QaVerdict(boolean passed, List<Map<String, Object>> issues, String summary) {

    public QaVerdict {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public static QaVerdict pass(String summary) {
        return new QaVerdict(true, List.of(), summary);
    }

    public static QaVerdict fail(List<Map<String, Object>> issues, String summary) {
        return new QaVerdict(false, issues, summary);
    }
}

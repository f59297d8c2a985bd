package io.docflow.serialization.llm;

/// Helpers for pulling JSON out of LLM responses.
final class JsonResponses {

    private JsonResponses() {}

    /// Returns the body of the first fenced block (```json preferred), or the trimmed text.
    static String stripCodeFences(String content) {
        String text = content.trim();
        int start = text.indexOf("```json");
        if (start >= 0) {
            int bodyStart = start + "```json".length();
            int end = text.indexOf("```", bodyStart);
            if (end > bodyStart) {
                return text.substring(bodyStart, end).trim();
            }
        }
        start = text.indexOf("```");
        if (start >= 0) {
            int bodyStart = text.indexOf('\n', start);
            int end = bodyStart >= 0 ? text.indexOf("```", bodyStart) : -1;
            if (end > bodyStart) {
                return text.substring(bodyStart, end).trim();
            }
        }
        return text;
    }

    /// Returns whether the response carries a JSON object candidate.
    static boolean looksLikeJsonObject(String content) {
        String text = content.trim();
        return text.contains("```json") || text.startsWith("{");
    }
}

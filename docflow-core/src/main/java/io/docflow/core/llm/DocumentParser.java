package io.docflow.core.llm;

import java.util.Map;

/// Turns raw completion text into a structured document.
///
/// Implementations never fail on unparseable text; they fall back to wrapping the
/// raw content so the QA node can judge it.
@FunctionalInterface
public interface DocumentParser {

    /// @param response completion text, not null
    /// @param produces document type being produced, may be null
    /// @return parsed document, never null
    Map<String, Object> parse(String response, String produces);
}

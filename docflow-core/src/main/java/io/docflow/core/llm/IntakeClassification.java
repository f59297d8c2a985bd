package io.docflow.core.llm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Result of classifying accumulated intake text.
///
/// @param outcome gate outcome when intake is sufficient, null when more input is needed
/// @param followUpQuestion single question to ask when `outcome` is null, may be null
/// @param frame extracted intake facts, carried across pauses, never null
public record IntakeClassification(
        String outcome, String followUpQuestion, Map<String, Object> frame) {

    public IntakeClassification {
        frame =
                frame != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(frame))
                        : Map.of();
    }

    public boolean isComplete() {
        return outcome != null;
    }
}

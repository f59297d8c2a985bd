package io.docflow.core.llm;

import java.io.IOException;

/// Resolves task prompt references to prompt text.
@FunctionalInterface
public interface PromptLoader {

    /// @param taskRef prompt reference declared on a node, not null
    /// @return prompt text, never null
    /// @throws IOException if the prompt does not exist or cannot be read
    String loadTaskPrompt(String taskRef) throws IOException;
}

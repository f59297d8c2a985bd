package io.docflow.core.llm;

import java.util.List;

/// LLM completion capability injected into generation, QA and intake executors.
///
/// Timeouts and transient-failure retries are the implementation's concern; the
/// engine calls once and treats any exception as a failed node.
@FunctionalInterface
public interface CompletionService {

    /// Produces a completion.
    ///
    /// @param messages conversation in order, not null
    /// @param systemPrompt system prompt, may be null
    /// @param options tracking and tuning options, not null
    /// @return completion text, never null
    /// @throws CompletionException if no completion could be produced
    String complete(List<ChatMessage> messages, String systemPrompt, CompletionOptions options)
            throws CompletionException;
}

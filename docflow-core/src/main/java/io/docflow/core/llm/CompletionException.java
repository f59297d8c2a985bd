package io.docflow.core.llm;

import java.io.Serial;

/// Raised by a {@link CompletionService} when a completion cannot be produced.
public class CompletionException extends Exception {

    @Serial private static final long serialVersionUID = -6407393214356925741L;

    public CompletionException(String message) {
        super(message);
    }

    public CompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}

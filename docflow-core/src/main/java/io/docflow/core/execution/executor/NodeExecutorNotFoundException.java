package io.docflow.core.execution.executor;

import java.io.Serial;

public class NodeExecutorNotFoundException extends Exception {

    @Serial private static final long serialVersionUID = 2880373340542290151L;

    public NodeExecutorNotFoundException(String message) {
        super(message);
    }
}

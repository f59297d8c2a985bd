package io.docflow.core.execution.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.docflow.core.plan.node.NodeType;
import org.junit.jupiter.api.Test;

class DefaultNodeExecutorRegistryTest {

    private final DefaultNodeExecutorRegistry registry = new DefaultNodeExecutorRegistry();

    @Test
    void shouldRegisterCapabilityFreeExecutorsByDefault() {
        assertThat(registry.hasExecutor(NodeType.GATE)).isTrue();
        assertThat(registry.hasExecutor(NodeType.END)).isTrue();
        assertThat(registry.hasExecutor(NodeType.TASK)).isFalse();
    }

    @Test
    void shouldThrowForMissingExecutor() {
        assertThatThrownBy(() -> registry.getExecutorOrThrow(NodeType.QA))
                .isInstanceOf(NodeExecutorNotFoundException.class)
                .hasMessageContaining("qa");
    }

    @Test
    void shouldReplaceExecutorOfSameType() throws Exception {
        QaNodeExecutor qa = new QaNodeExecutor(null, null);

        registry.register(qa);

        assertThat(registry.getExecutorOrThrow(NodeType.QA)).isSameAs(qa);
    }
}

package io.docflow.serialization.llm;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class JsonResponsesTest {

    @Test
    void shouldPreferJsonFence() {
        String text = "```text\nnope\n```\n```json\n{\"a\": 1}\n```";

        assertThat(JsonResponses.stripCodeFences(text)).isEqualTo("{\"a\": 1}");
    }

    @Test
    void shouldStripBareFence() {
        assertThat(JsonResponses.stripCodeFences("```\n{\"a\": 1}\n```")).isEqualTo("{\"a\": 1}");
    }

    @Test
    void shouldReturnTrimmedTextWithoutFence() {
        assertThat(JsonResponses.stripCodeFences("  {\"a\": 1}\n")).isEqualTo("{\"a\": 1}");
    }

    @Test
    void shouldDetectJsonCandidates() {
        assertThat(JsonResponses.looksLikeJsonObject(" {\"a\": 1}")).isTrue();
        assertThat(JsonResponses.looksLikeJsonObject("see ```json {}```")).isTrue();
        assertThat(JsonResponses.looksLikeJsonObject("[1, 2]")).isFalse();
    }
}

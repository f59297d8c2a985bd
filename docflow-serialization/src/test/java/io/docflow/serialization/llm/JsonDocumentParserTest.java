package io.docflow.serialization.llm;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonDocumentParserTest {

    private final JsonDocumentParser parser = new JsonDocumentParser();

    @Test
    void shouldParsePlainJsonObject() {
        Map<String, Object> document = parser.parse("{\"title\": \"Alpha\", \"phases\": 3}", "scope_doc");

        assertThat(document).containsEntry("title", "Alpha").containsEntry("phases", 3);
    }

    @Test
    void shouldParseFencedBlockInsideProse() {
        String response = "Here is the document:\n```json\n{\"title\": \"Alpha\"}\n```\nLet me know.";

        assertThat(parser.parse(response, "scope_doc")).containsExactly(Map.entry("title", "Alpha"));
    }

    @Test
    void shouldFallBackToRawContentForProse() {
        Map<String, Object> document = parser.parse("I could not produce JSON today.", "scope_doc");

        assertThat(document)
                .containsEntry("type", "scope_doc")
                .containsEntry("content", "I could not produce JSON today.")
                .containsEntry("raw", true);
    }

    @Test
    void shouldFallBackToRawContentForMalformedJson() {
        Map<String, Object> document = parser.parse("{\"title\": ", null);

        assertThat(document).containsEntry("type", "unknown").containsEntry("raw", true);
    }
}

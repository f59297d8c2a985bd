package io.docflow.serialization.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.docflow.core.llm.ChatMessage;
import io.docflow.core.llm.CompletionException;
import io.docflow.core.llm.CompletionService;
import io.docflow.core.llm.IntakeClassification;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LlmIntakeClassifierTest {

    private static final List<String> OUTCOMES = List.of("qualified", "out_of_scope");

    @Mock private CompletionService completionService;
    @Captor private ArgumentCaptor<List<ChatMessage>> messagesCaptor;

    private LlmIntakeClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new LlmIntakeClassifier(completionService, new ObjectMapper());
    }

    private void respond(String response) throws CompletionException {
        when(completionService.complete(anyList(), anyString(), any())).thenReturn(response);
    }

    @Test
    void shouldClassifyAndMergeFrame() throws Exception {
        respond("{\"outcome\": \"qualified\", \"frame\": {\"audience\": \"ops team\"}}");

        IntakeClassification result =
                classifier.classify("Migrate billing", Map.of("artifact_type", "runbook"), OUTCOMES);

        assertThat(result.outcome()).isEqualTo("qualified");
        assertThat(result.followUpQuestion()).isNull();
        assertThat(result.frame())
                .containsEntry("artifact_type", "runbook")
                .containsEntry("audience", "ops team");
        verify(completionService).complete(messagesCaptor.capture(), anyString(), any());
        assertThat(messagesCaptor.getValue().get(0).content())
                .contains("\"artifact_type\":\"runbook\"", "Migrate billing");
    }

    @Test
    void shouldReturnFollowUpQuestion() throws Exception {
        respond("```json\n{\"outcome\": null, \"follow_up_question\": \"Who reads it?\"}\n```");

        IntakeClassification result = classifier.classify("A doc", Map.of(), OUTCOMES);

        assertThat(result.outcome()).isNull();
        assertThat(result.followUpQuestion()).isEqualTo("Who reads it?");
    }

    @Test
    void shouldTreatUndeclaredOutcomeAsInsufficient() throws Exception {
        respond("{\"outcome\": \"maybe\"}");

        IntakeClassification result = classifier.classify("A doc", Map.of(), OUTCOMES);

        assertThat(result.outcome()).isNull();
        assertThat(result.followUpQuestion()).isEqualTo(LlmIntakeClassifier.DEFAULT_QUESTION);
    }

    @Test
    void shouldRejectNonObjectResponse() throws Exception {
        respond("[\"qualified\"]");

        assertThatThrownBy(() -> classifier.classify("A doc", Map.of(), OUTCOMES))
                .isInstanceOf(CompletionException.class)
                .hasMessageContaining("not a JSON object");
    }

    @Test
    void shouldRejectProseResponse() throws Exception {
        respond("Sounds qualified to me!");

        assertThatThrownBy(() -> classifier.classify("A doc", Map.of(), OUTCOMES))
                .isInstanceOf(CompletionException.class)
                .hasMessageContaining("not JSON");
    }
}

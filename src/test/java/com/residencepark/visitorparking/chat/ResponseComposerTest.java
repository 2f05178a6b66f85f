package com.residencepark.visitorparking.chat;

import com.residencepark.visitorparking.exception.BackendUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResponseComposerTest {

    @Mock
    private GenerativeModel generativeModel;

    @InjectMocks
    private ResponseComposer responseComposer;

    // ── Templated replies ────────────────────────────────────────────────────

    @Test
    @DisplayName("greeting and help come from fixed templates")
    void templated_greetingAndHelp() {
        assertThat(responseComposer.templatedReply(ClassifiedIntent.of(ChatIntent.GREETING), "hi"))
                .contains(ResponseComposer.GREETING_REPLY);
        assertThat(responseComposer.templatedReply(ClassifiedIntent.of(ChatIntent.HELP), "help"))
                .contains(ResponseComposer.HELP_REPLY);
        verifyNoInteractions(generativeModel);
    }

    @Test
    @DisplayName("how-to reply is chosen by keyword: search/find, then unit, then general")
    void templated_howToVariants() {
        ClassifiedIntent howTo = ClassifiedIntent.of(ChatIntent.HOW_TO);

        assertThat(responseComposer.templatedReply(howTo, "How can I search for a visitor"))
                .contains(ResponseComposer.HOW_TO_SEARCH_REPLY);
        assertThat(responseComposer.templatedReply(howTo, "how do I find visitors by unit"))
                .contains(ResponseComposer.HOW_TO_SEARCH_REPLY);
        assertThat(responseComposer.templatedReply(howTo, "how to check a unit"))
                .contains(ResponseComposer.HOW_TO_UNIT_REPLY);
        assertThat(responseComposer.templatedReply(howTo, "how to use this"))
                .contains(ResponseComposer.HOW_TO_GENERAL_REPLY);
    }

    @Test
    @DisplayName("tool-backed intents have no template")
    void templated_noneForToolIntents() {
        assertThat(responseComposer.templatedReply(ClassifiedIntent.of(ChatIntent.STATS), "count")).isEmpty();
        assertThat(responseComposer.templatedReply(ClassifiedIntent.of(ChatIntent.GENERAL), "weather")).isEmpty();
    }

    // ── Model-phrased replies ────────────────────────────────────────────────

    @Test
    @DisplayName("context result is embedded in the prompt sent to the model")
    void compose_contextGoesThroughModel() {
        when(generativeModel.generate(anyString())).thenReturn("There are 102 spots free.");

        String answer = responseComposer.compose("how many spots?",
                ToolResult.context(ChatIntent.STATS, "Available spots: 102/105"));

        assertThat(answer).isEqualTo("There are 102 spots free.");
        verify(generativeModel).generate(argThat(prompt ->
                prompt.contains("Context/Data: Available spots: 102/105")
                        && prompt.contains("User Question: how many spots?")));
    }

    @Test
    @DisplayName("direct result is returned verbatim without a model call")
    void compose_directSkipsModel() {
        String answer = responseComposer.compose("find visitor",
                ToolResult.direct(ChatIntent.SEARCH, ToolDispatcher.MISSING_NAME_REPLY));

        assertThat(answer).isEqualTo(ToolDispatcher.MISSING_NAME_REPLY);
        verifyNoInteractions(generativeModel);
    }

    @Test
    @DisplayName("model failure propagates as BackendUnavailableException")
    void compose_modelFailure() {
        when(generativeModel.generate(anyString()))
                .thenThrow(new BackendUnavailableException("Generative model call failed"));

        assertThatThrownBy(() -> responseComposer.compose("status?",
                ToolResult.context(ChatIntent.SUMMARY, "PARKING AVAILABLE")))
                .isInstanceOf(BackendUnavailableException.class);
    }
}

package com.residencepark.visitorparking.chat;

import com.residencepark.visitorparking.exception.BackendUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Conversational entry point: query → IntentClassifier → ToolDispatcher →
 * ResponseComposer → answer.
 *
 * Read-only and stateless; one shared instance serves every request.
 * Never throws: any failure becomes an apologetic answer, since the chat
 * surface has no structured error channel.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParkingAssistant {

    static final String UNAVAILABLE_REPLY =
            "The parking assistant is unavailable right now. Please check the assistant API key configuration.";

    static final String BACKEND_ERROR_REPLY =
            "Sorry, I couldn't reach the parking records or the language service just now. Please try again shortly.";

    static final String UNEXPECTED_ERROR_REPLY =
            "Sorry, something went wrong while answering your question. Please try rephrasing it.";

    private final IntentClassifier intentClassifier;
    private final ToolDispatcher toolDispatcher;
    private final ResponseComposer responseComposer;

    public ChatReply reply(String query) {
        String text = query != null ? query.trim() : "";
        ClassifiedIntent classified = ClassifiedIntent.of(ChatIntent.HELP);
        try {
            classified = text.isEmpty()
                    ? ClassifiedIntent.of(ChatIntent.HELP)
                    : intentClassifier.classify(text);
            log.info("Assistant query classified as {} (parameter: {})",
                    classified.getIntent(), classified.getParameter().orElse("-"));

            String answer = respond(text, classified);
            return toReply(classified, answer);
        } catch (BackendUnavailableException e) {
            log.error("Assistant backend failure for {}: {}", classified.getIntent(), e.getMessage());
            return toReply(classified, BACKEND_ERROR_REPLY);
        } catch (RuntimeException e) {
            log.error("Assistant failed to answer '{}'", text, e);
            return toReply(classified, UNEXPECTED_ERROR_REPLY);
        }
    }

    private String respond(String query, ClassifiedIntent classified) {
        return responseComposer.templatedReply(classified, query)
                .orElseGet(() -> {
                    if (!responseComposer.isModelAvailable()) {
                        return UNAVAILABLE_REPLY;
                    }
                    ToolResult toolResult = toolDispatcher.dispatch(classified);
                    return responseComposer.compose(query, toolResult);
                });
    }

    private static ChatReply toReply(ClassifiedIntent classified, String answer) {
        return new ChatReply(classified.getIntent().value(), classified.getParameter().orElse(null), answer);
    }
}

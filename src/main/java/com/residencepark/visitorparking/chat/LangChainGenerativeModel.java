package com.residencepark.visitorparking.chat;

import com.residencepark.visitorparking.exception.BackendUnavailableException;
import dev.langchain4j.model.chat.ChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * GenerativeModel backed by a langchain4j ChatModel.
 */
@RequiredArgsConstructor
@Slf4j
public class LangChainGenerativeModel implements GenerativeModel {

    private final ChatModel chatModel;

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String generate(String prompt) {
        long start = System.currentTimeMillis();
        String text;
        try {
            text = chatModel.chat(prompt);
        } catch (RuntimeException e) {
            log.error("Generative model call failed after {} ms: {}",
                    System.currentTimeMillis() - start, e.getMessage());
            throw new BackendUnavailableException("Generative model call failed", e);
        }
        if (text == null || text.isBlank()) {
            throw new BackendUnavailableException("Generative model returned an empty answer");
        }
        log.debug("Generative model answered in {} ms ({} chars)", System.currentTimeMillis() - start, text.length());
        return text;
    }
}

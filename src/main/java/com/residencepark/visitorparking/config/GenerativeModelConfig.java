package com.residencepark.visitorparking.config;

import com.residencepark.visitorparking.chat.GenerativeModel;
import com.residencepark.visitorparking.chat.LangChainGenerativeModel;
import com.residencepark.visitorparking.chat.UnavailableGenerativeModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Wires the assistant's generative backend.
 *
 * Any OpenAI-compatible chat endpoint works; the default points at Gemini's
 * OpenAI-compatible API. Without an API key the assistant still answers
 * greeting / help / how-to questions and reports itself unavailable for the rest.
 */
@Configuration
@Slf4j
public class GenerativeModelConfig {

    @Value("${assistant.api-key:}")
    private String apiKey;

    @Value("${assistant.base-url:https://generativelanguage.googleapis.com/v1beta/openai/}")
    private String baseUrl;

    @Value("${assistant.model:gemini-1.5-flash}")
    private String modelName;

    @Value("${assistant.temperature:0.3}")
    private double temperature;

    @Value("${assistant.timeout-seconds:60}")
    private int timeoutSeconds;

    @Bean
    public GenerativeModel generativeModel() {
        if (!StringUtils.hasText(apiKey)) {
            log.warn("assistant.api-key not set — parking assistant will only serve templated replies");
            return new UnavailableGenerativeModel();
        }

        ChatModel chatModel = OpenAiChatModel.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(temperature)
                .timeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
                .build();

        log.info("Parking assistant using model '{}' at {}", modelName, baseUrl);
        return new LangChainGenerativeModel(chatModel);
    }
}

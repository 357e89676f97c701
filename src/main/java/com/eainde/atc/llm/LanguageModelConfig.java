package com.eainde.atc.llm;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.ollama.OllamaChatModel;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Wires the chat model used by all three agents.
 *
 * <p>The provider is a local Ollama server. Provider-side retries are disabled: retry policy
 * belongs to the agent invoker, which retries exactly once.</p>
 */
@Log4j2
@Configuration
public class LanguageModelConfig {

    @Value("${atc.llm.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${atc.llm.model-name:llama3.2:3b}")
    private String modelName;

    @Value("${atc.llm.temperature:0.2}")
    private double temperature;

    @Value("${atc.llm.request-timeout:PT150S}")
    private Duration requestTimeout;

    @Value("${atc.llm.max-concurrent-calls:4}")
    private int maxConcurrentCalls;

    @Value("${atc.llm.log-requests:false}")
    private boolean logRequests;

    @Bean
    public ChatModelListener modelCallLoggingListener() {
        return new ModelCallLoggingListener();
    }

    @Bean
    public ChatModel chatModel(List<ChatModelListener> listeners) {
        log.info("Configuring Ollama chat model {} at {} (timeout {})", modelName, baseUrl, requestTimeout);
        return OllamaChatModel.builder()
                .baseUrl(baseUrl)
                .modelName(modelName)
                .temperature(temperature)
                .timeout(requestTimeout)
                .maxRetries(0)
                .logRequests(logRequests)
                .logResponses(logRequests)
                .listeners(listeners)
                .build();
    }

    @Bean
    public LanguageModelBackend languageModelBackend(ChatModel chatModel) {
        return new ChatModelBackend(chatModel);
    }

    @Bean
    public ModelCallGate modelCallGate() {
        log.info("Model calls capped at {} concurrent requests", maxConcurrentCalls);
        return new ModelCallGate(maxConcurrentCalls);
    }
}

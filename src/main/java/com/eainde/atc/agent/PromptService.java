package com.eainde.atc.agent;

import dev.langchain4j.model.input.PromptTemplate;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads prompt templates from external resources and renders them with LangChain4j's
 * {@link PromptTemplate} ({@code {{variable}}} placeholders).
 *
 * <p>Templates live at {@code <atc.prompts.location><agentName>.txt}, so prompt wording
 * can change without touching the pipeline code. All known templates are loaded at startup;
 * a missing one fails the application context.</p>
 */
@Service
public class PromptService {

    private static final Logger log = LoggerFactory.getLogger(PromptService.class);

    static final List<String> KNOWN_TEMPLATES = List.of(
            AgentNames.FATIGUE, AgentNames.SAFETY, AgentNames.SUMMARIZER, AgentNames.RETRY_INSTRUCTION);

    private final ResourceLoader resourceLoader;
    private final String location;
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();

    public PromptService(ResourceLoader resourceLoader,
                         @Value("${atc.prompts.location:classpath:prompts/}") String location) {
        this.resourceLoader = resourceLoader;
        this.location = location.endsWith("/") ? location : location + "/";
    }

    @PostConstruct
    public void loadTemplates() {
        KNOWN_TEMPLATES.forEach(this::getTemplate);
        log.info("Loaded {} prompt templates from {}", templates.size(), location);
    }

    /**
     * Renders the named template. Every placeholder in the template must have a value.
     */
    public String render(String templateName, Map<String, Object> variables) {
        return getTemplate(templateName).apply(variables).text();
    }

    public String renderRetryInstruction(String problem, List<String> requiredKeys) {
        return render(AgentNames.RETRY_INSTRUCTION, Map.of(
                "problem", problem,
                "requiredKeys", String.join(", ", requiredKeys)));
    }

    PromptTemplate getTemplate(String templateName) {
        return templates.computeIfAbsent(templateName, this::load);
    }

    private PromptTemplate load(String templateName) {
        Resource resource = resourceLoader.getResource(location + templateName + ".txt");
        if (!resource.exists()) {
            throw new IllegalStateException("Prompt template not found: " + resource.getDescription());
        }
        try {
            String text = resource.getContentAsString(StandardCharsets.UTF_8);
            log.debug("Loaded prompt template {} ({} chars)", templateName, text.length());
            return PromptTemplate.from(text);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read prompt template " + templateName, e);
        }
    }
}

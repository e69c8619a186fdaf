package com.phillippitts.speaktorobot.service.llm;

import com.phillippitts.speaktorobot.exception.PromptNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Loads the system prompt that instructs the model to reply with the command JSON.
 * Missing or empty prompts fail fast at startup.
 */
public final class SystemPromptLoader {

    private static final Logger LOG = LogManager.getLogger(SystemPromptLoader.class);

    private final ResourceLoader resourceLoader;

    public SystemPromptLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /**
     * @param location Spring resource location, e.g. {@code classpath:prompts/system_prompt.txt}
     * @return prompt text, trimmed
     * @throws PromptNotFoundException if the resource is missing, unreadable or blank
     */
    public String load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new PromptNotFoundException(location);
        }
        try (InputStream in = resource.getInputStream()) {
            String prompt = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            if (prompt.isEmpty()) {
                throw new PromptNotFoundException(location);
            }
            LOG.info("Loaded system prompt from {} ({} chars)", location, prompt.length());
            return prompt;
        } catch (IOException e) {
            throw new PromptNotFoundException(location, e);
        }
    }
}

package com.phillippitts.speaktorobot.config.llm;

import com.phillippitts.speaktorobot.config.properties.ExtractionProperties;
import com.phillippitts.speaktorobot.config.properties.LanguageModelProperties;
import com.phillippitts.speaktorobot.service.llm.LanguageModelService;
import com.phillippitts.speaktorobot.service.llm.OpenAiCompatibleLanguageModelService;
import com.phillippitts.speaktorobot.service.llm.SystemPromptLoader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.net.http.HttpClient;

/**
 * Wires the OpenAI-compatible language-model client. The system prompt is loaded once here, so a
 * missing prompt fails application startup.
 */
@Configuration
public class LanguageModelConfig {

    private static final Logger LOG = LogManager.getLogger(LanguageModelConfig.class);

    @Bean
    public HttpClient languageModelHttpClient(LanguageModelProperties props) {
        return HttpClient.newBuilder()
                .connectTimeout(props.getConnectTimeout())
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Bean
    public LanguageModelService languageModelService(HttpClient languageModelHttpClient,
                                                     LanguageModelProperties props,
                                                     ExtractionProperties extractionProps,
                                                     ResourceLoader resourceLoader) {
        String systemPrompt = new SystemPromptLoader(resourceLoader).load(props.getSystemPromptLocation());
        LOG.info("Language model: model={}, baseUrl={}, temperature={}, maxTokens={}, requestTimeout={}",
                props.getModel(), props.getBaseUrl(), props.getTemperature(), props.getMaxTokens(),
                extractionProps.getAttemptTimeout());
        return new OpenAiCompatibleLanguageModelService(languageModelHttpClient, props, systemPrompt,
                extractionProps.getAttemptTimeout());
    }
}

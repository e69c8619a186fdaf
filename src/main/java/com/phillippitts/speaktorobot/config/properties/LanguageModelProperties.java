package com.phillippitts.speaktorobot.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection and sampling settings for the OpenAI-compatible language-model endpoint.
 */
@ConfigurationProperties(prefix = "robot.llm")
@Validated
public class LanguageModelProperties {

    /** Base URL up to and including the API version segment, e.g. {@code http://localhost:12434/engines/v1}. */
    @NotBlank(message = "robot.llm.base-url must be set")
    private String baseUrl = "http://localhost:12434/engines/v1";

    @NotBlank(message = "robot.llm.model must be set")
    private String model = "ai/llama3.2";

    /** Optional bearer token; blank means no Authorization header. */
    private String apiKey = "";

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double temperature = 0.1;

    @Positive
    private int maxTokens = 512;

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(5);

    /** Spring resource location of the system prompt. */
    @NotBlank
    private String systemPromptLocation = "classpath:prompts/system_prompt.txt";

    /** Request {@code response_format: json_object} from the endpoint. */
    private boolean jsonResponseFormat = true;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public String getSystemPromptLocation() {
        return systemPromptLocation;
    }

    public void setSystemPromptLocation(String systemPromptLocation) {
        this.systemPromptLocation = systemPromptLocation;
    }

    public boolean isJsonResponseFormat() {
        return jsonResponseFormat;
    }

    public void setJsonResponseFormat(boolean jsonResponseFormat) {
        this.jsonResponseFormat = jsonResponseFormat;
    }
}

package com.phillippitts.speaktorobot.service.llm;

import com.phillippitts.speaktorobot.config.properties.LanguageModelProperties;
import com.phillippitts.speaktorobot.exception.RequestCancelledException;
import com.phillippitts.speaktorobot.exception.UpstreamServiceExceptionBuilder;
import com.phillippitts.speaktorobot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link LanguageModelService} backed by an OpenAI-compatible {@code /chat/completions} endpoint
 * (Docker Model Runner, Ollama, vLLM, OpenAI itself).
 *
 * <p>Each call sends the system prompt and the user's utterance. On a retry the corrective
 * feedback is appended to the user message as {@code "\n\nPrevious error: <feedback>"}.
 *
 * <p>Thread-safe: the {@link HttpClient} is shared and the class holds no mutable state.
 */
public class OpenAiCompatibleLanguageModelService implements LanguageModelService {

    private static final Logger LOG = LogManager.getLogger(OpenAiCompatibleLanguageModelService.class);

    static final String RETRY_CONTEXT_PREFIX = "\n\nPrevious error: ";
    static final Duration PROBE_TIMEOUT = Duration.ofSeconds(3);
    private static final int ERROR_BODY_PREVIEW = 200;

    private final HttpClient httpClient;
    private final LanguageModelProperties props;
    private final String systemPrompt;
    private final URI completionsUri;
    private final URI modelsUri;
    private final Duration requestTimeout;

    /**
     * @param requestTimeout upper bound for one completion request; the HTTP layer gives up on
     *                       its own even when no caller is waiting with a timeout
     */
    public OpenAiCompatibleLanguageModelService(HttpClient httpClient,
                                                LanguageModelProperties props,
                                                String systemPrompt,
                                                Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        if (requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        this.props = Objects.requireNonNull(props, "props");
        this.systemPrompt = Objects.requireNonNull(systemPrompt, "systemPrompt");
        String base = stripTrailingSlash(props.getBaseUrl());
        this.completionsUri = URI.create(base + "/chat/completions");
        this.modelsUri = URI.create(base + "/models");
    }

    @Override
    public String generate(ExtractionRequest request) {
        String body = buildRequestBody(request).toString();
        HttpRequest.Builder builder = HttpRequest.newBuilder(completionsUri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (request.correlationId() != null) {
            builder.header("X-Correlation-ID", request.correlationId());
        }
        addAuthorization(builder);

        long start = System.nanoTime();
        LOG.debug("Calling language model {} attempt={} retry={} input='{}'",
                props.getModel(), request.attempt(), request.isRetry(), LogSanitizer.preview(request.userInput()));

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestCancelledException(request.correlationId(), e);
        } catch (IOException e) {
            throw UpstreamServiceExceptionBuilder.create("Language model request failed")
                    .cause(e)
                    .durationMs(elapsedMs(start))
                    .metadata("attempt", request.attempt())
                    .build();
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw UpstreamServiceExceptionBuilder.create("Language model returned an error status")
                    .statusCode(status)
                    .durationMs(elapsedMs(start))
                    .metadata("attempt", request.attempt())
                    .metadata("body", LogSanitizer.preview(response.body(), ERROR_BODY_PREVIEW))
                    .build();
        }

        String content = extractContent(response.body(), request.attempt(), start);
        LOG.debug("Language model replied in {} ms ({} chars)", elapsedMs(start), content.length());
        return content;
    }

    @Override
    public boolean isAvailable() {
        HttpRequest.Builder builder = HttpRequest.newBuilder(modelsUri).timeout(PROBE_TIMEOUT).GET();
        addAuthorization(builder);
        try {
            HttpResponse<Void> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.discarding());
            return response.statusCode() >= 200 && response.statusCode() < 300;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (IOException e) {
            LOG.debug("Language model probe failed: {}", e.toString());
            return false;
        }
    }

    JSONObject buildRequestBody(ExtractionRequest request) {
        String userContent = request.retryContext() == null
                ? request.userInput()
                : request.userInput() + RETRY_CONTEXT_PREFIX + request.retryContext();

        JSONArray messages = new JSONArray()
                .put(new JSONObject().put("role", "system").put("content", systemPrompt))
                .put(new JSONObject().put("role", "user").put("content", userContent));

        JSONObject body = new JSONObject()
                .put("model", props.getModel())
                .put("messages", messages)
                .put("temperature", props.getTemperature())
                .put("max_tokens", props.getMaxTokens());
        if (props.isJsonResponseFormat()) {
            body.put("response_format", new JSONObject().put("type", "json_object"));
        }
        return body;
    }

    /**
     * Reads {@code choices[0].message.content} from the completion envelope.
     */
    private static String extractContent(String body, int attempt, long start) {
        try {
            JSONObject envelope = new JSONObject(body);
            JSONObject message = envelope.getJSONArray("choices").getJSONObject(0).getJSONObject("message");
            return message.optString("content", "");
        } catch (JSONException e) {
            throw UpstreamServiceExceptionBuilder.create("Malformed language model response")
                    .cause(e)
                    .durationMs(elapsedMs(start))
                    .metadata("attempt", attempt)
                    .build();
        }
    }

    private void addAuthorization(HttpRequest.Builder builder) {
        String apiKey = props.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    private static String stripTrailingSlash(String url) {
        String u = url.trim();
        while (u.endsWith("/")) {
            u = u.substring(0, u.length() - 1);
        }
        return u;
    }
}

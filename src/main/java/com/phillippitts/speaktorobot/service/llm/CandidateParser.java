package com.phillippitts.speaktorobot.service.llm;

import com.phillippitts.speaktorobot.domain.CommandCandidate;
import com.phillippitts.speaktorobot.service.schema.CommandSchema;
import com.phillippitts.speaktorobot.service.schema.CommandSpec;
import com.phillippitts.speaktorobot.service.schema.ParameterSpec;
import com.phillippitts.speaktorobot.service.schema.ParameterType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Parses free-text language-model output into a {@link CommandCandidate}.
 *
 * <p>Expected shape: {@code {"response": "...", "command": "rotate", "command_params": {...}}}.
 * Tolerated variance:
 * <ul>
 *   <li>markdown code fences and prose before or after the JSON object</li>
 *   <li>{@code params} or {@code parameters} instead of {@code command_params}</li>
 *   <li>parameters given as a JSON-encoded string</li>
 *   <li>{@code command} nested as {@code {"name": ..., "params": {...}}}</li>
 * </ul>
 *
 * <p>Simple English number words in numeric parameters are converted to numbers here, before
 * validation (see {@link WordNumberNormalizer}). No other interpretation happens: whether the
 * candidate is an acceptable command is the validator's decision.
 *
 * <p>Thread-safe: stateless apart from the immutable schema.
 */
@Component
public class CandidateParser {

    private static final Logger LOG = LogManager.getLogger(CandidateParser.class);

    /** Model output beyond this size is truncated before parsing. */
    static final int MAX_OUTPUT_CHARS = 65_536;

    private static final String[] PARAM_KEYS = {"command_params", "params", "parameters"};

    private final CommandSchema schema;

    public CandidateParser(CommandSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    /**
     * @param raw raw model output (nullable)
     * @return parsed candidate, or a failure description
     */
    public ParsedOutput parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return ParsedOutput.failed("empty response");
        }
        String text = raw.length() > MAX_OUTPUT_CHARS ? raw.substring(0, MAX_OUTPUT_CHARS) : raw;

        int start = text.indexOf('{');
        if (start < 0) {
            return ParsedOutput.failed("no JSON object found");
        }

        JSONObject obj;
        try {
            // nextValue stops after the first complete value; trailing fences or prose are ignored
            Object value = new JSONTokener(text.substring(start)).nextValue();
            if (!(value instanceof JSONObject o)) {
                return ParsedOutput.failed("no JSON object found");
            }
            obj = o;
        } catch (JSONException e) {
            LOG.debug("Model output is not valid JSON: {}", e.getMessage());
            return ParsedOutput.failed("invalid JSON (" + e.getMessage() + ")");
        }

        String responseText = obj.optString("response", null);
        Object command = obj.opt("command");
        Object params = firstPresent(obj);
        String name;

        if (command == null || JSONObject.NULL.equals(command)) {
            name = null;
        } else if (command instanceof JSONObject nested) {
            name = nested.optString("name", nested.optString("command", null));
            if (params == null) {
                params = firstPresent(nested);
            }
        } else {
            name = command.toString();
        }

        Map<String, Object> paramMap;
        try {
            paramMap = toParamMap(name, params);
        } catch (JSONException e) {
            return ParsedOutput.failed("command_params is not a JSON object (" + e.getMessage() + ")");
        }
        if (paramMap == null) {
            return ParsedOutput.failed("command_params is not a JSON object");
        }
        return ParsedOutput.parsed(new CommandCandidate(name, paramMap, responseText, raw));
    }

    private static Object firstPresent(JSONObject obj) {
        for (String key : PARAM_KEYS) {
            Object v = obj.opt(key);
            if (v != null && !JSONObject.NULL.equals(v)) {
                return v;
            }
        }
        return null;
    }

    /**
     * @return parameter map (empty if absent), or null if params has an unusable shape
     */
    private Map<String, Object> toParamMap(String commandName, Object params) {
        if (params == null) {
            return new LinkedHashMap<>();
        }
        JSONObject obj;
        if (params instanceof JSONObject o) {
            obj = o;
        } else if (params instanceof String s) {
            if (s.isBlank()) {
                return new LinkedHashMap<>();
            }
            obj = new JSONObject(s);
        } else {
            return null;
        }

        Optional<CommandSpec> spec = schema.find(commandName);
        Map<String, Object> result = new LinkedHashMap<>();
        // JSONObject does not keep member order; sorted keys keep reasons reproducible
        for (String key : new TreeSet<>(obj.keySet())) {
            Object value = toJava(obj.opt(key));
            if (isNumericParameter(spec, key)) {
                value = WordNumberNormalizer.normalize(value);
            }
            result.put(key, value);
        }
        return result;
    }

    private static boolean isNumericParameter(Optional<CommandSpec> spec, String key) {
        return spec.flatMap(s -> s.parameter(key))
                .map(ParameterSpec::type)
                .map(ParameterType::isNumeric)
                .orElse(false);
    }

    private static Object toJava(Object value) {
        if (value == null || JSONObject.NULL.equals(value)) {
            return null;
        }
        if (value instanceof JSONObject o) {
            return o.toMap();
        }
        if (value instanceof JSONArray a) {
            return a.toList();
        }
        return value;
    }
}

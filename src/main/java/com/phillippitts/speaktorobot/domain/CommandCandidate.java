package com.phillippitts.speaktorobot.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An unvalidated attempt at a {@link Command}, parsed from raw language-model output.
 *
 * @param commandName  claimed command name (nullable when the model produced none)
 * @param params       raw parameter values keyed by name, in the order the model produced them
 * @param responseText the model's human-readable reply (nullable)
 * @param rawText      the raw model output this candidate was parsed from (nullable)
 */
public record CommandCandidate(
        String commandName,
        Map<String, Object> params,
        String responseText,
        String rawText
) {

    public CommandCandidate {
        // LinkedHashMap keeps model order and tolerates null values
        params = params == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    /**
     * Creates a candidate with no response text or raw output, e.g. for direct command submission.
     */
    public static CommandCandidate of(String commandName, Map<String, Object> params) {
        return new CommandCandidate(commandName, params, null, null);
    }

    public boolean hasResponseText() {
        return responseText != null && !responseText.isBlank();
    }
}

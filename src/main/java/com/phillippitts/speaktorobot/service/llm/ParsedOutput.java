package com.phillippitts.speaktorobot.service.llm;

import com.phillippitts.speaktorobot.domain.CommandCandidate;

/**
 * Result of parsing raw model output: either a candidate or the reason no candidate could be read.
 *
 * @param candidate parsed candidate (null on failure)
 * @param error     parse failure description (null on success)
 */
public record ParsedOutput(CommandCandidate candidate, String error) {

    public static ParsedOutput parsed(CommandCandidate candidate) {
        return new ParsedOutput(candidate, null);
    }

    public static ParsedOutput failed(String error) {
        return new ParsedOutput(null, error);
    }

    public boolean isParsed() {
        return candidate != null;
    }
}

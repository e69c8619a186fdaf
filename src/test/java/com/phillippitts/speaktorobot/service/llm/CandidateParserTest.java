package com.phillippitts.speaktorobot.service.llm;

import com.phillippitts.speaktorobot.domain.CommandCandidate;
import com.phillippitts.speaktorobot.service.schema.CommandSchema;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateParserTest {

    private final CandidateParser parser = new CandidateParser(CommandSchema.standard(-100, 100, List.of(), false));

    private CommandCandidate parsed(String raw) {
        ParsedOutput out = parser.parse(raw);
        assertThat(out.isParsed()).as("parse error: %s", out.error()).isTrue();
        return out.candidate();
    }

    @Test
    void parsesWellFormedCommand() {
        String raw = "{\"response\": \"Heading to (5, 7).\", \"command\": \"move_to\", "
                + "\"command_params\": {\"x\": 5, \"y\": 7}}";

        CommandCandidate candidate = parsed(raw);

        assertThat(candidate.commandName()).isEqualTo("move_to");
        assertThat(candidate.params()).containsEntry("x", 5).containsEntry("y", 7);
        assertThat(candidate.responseText()).isEqualTo("Heading to (5, 7).");
        assertThat(candidate.rawText()).isEqualTo(raw);
    }

    @Test
    void nullCommandMeansConversation() {
        CommandCandidate candidate = parsed("{\"response\": \"Hello!\", \"command\": null, \"command_params\": null}");

        assertThat(candidate.commandName()).isNull();
        assertThat(candidate.params()).isEmpty();
        assertThat(candidate.responseText()).isEqualTo("Hello!");
    }

    @Test
    void toleratesCodeFencesAndSurroundingProse() {
        String raw = "Sure! Here you go:\n```json\n{\"command\": \"rotate\", "
                + "\"command_params\": {\"angle\": 90, \"direction\": \"clockwise\"}}\n```\nAnything else?";

        CommandCandidate candidate = parsed(raw);

        assertThat(candidate.commandName()).isEqualTo("rotate");
        assertThat(candidate.params()).containsEntry("direction", "clockwise");
        assertThat(candidate.responseText()).isNull();
    }

    @Test
    void acceptsNestedCommandObject() {
        CommandCandidate candidate = parsed(
                "{\"command\": {\"name\": \"start_patrol\", \"params\": {\"route\": \"bedrooms\"}}}");

        assertThat(candidate.commandName()).isEqualTo("start_patrol");
        assertThat(candidate.params()).containsEntry("route", "bedrooms");
    }

    @Test
    void acceptsParamsEncodedAsJsonString() {
        CommandCandidate candidate = parsed(
                "{\"command\": \"move_to\", \"command_params\": \"{\\\"x\\\": 1, \\\"y\\\": 2}\"}");

        assertThat(candidate.params()).containsEntry("x", 1).containsEntry("y", 2);
    }

    @Test
    void acceptsAlternativeParamsKey() {
        CommandCandidate candidate = parsed("{\"command\": \"move_to\", \"parameters\": {\"x\": 3, \"y\": 4}}");

        assertThat(candidate.params()).containsKeys("x", "y");
    }

    @Test
    void normalizesWordNumbersForNumericParametersOnly() {
        CommandCandidate candidate = parsed("{\"command\": \"start_patrol\", \"command_params\": "
                + "{\"route\": \"five\", \"repeat_count\": \"three\", \"speed\": \"fast\"}}");

        assertThat(candidate.params())
                .containsEntry("repeat_count", 3)
                .containsEntry("route", "five");
    }

    @Test
    void ordersParamKeysDeterministically() {
        CommandCandidate candidate = parsed("{\"command\": \"move_to\", \"command_params\": "
                + "{\"y\": 1, \"z\": 0, \"x\": 2}}");

        assertThat(candidate.params().keySet()).containsExactly("x", "y", "z");
    }

    @Test
    void keepsUnknownCommandForValidatorToReject() {
        CommandCandidate candidate = parsed("{\"command\": \"fly_to\", \"command_params\": {\"destination\": \"moon\"}}");

        assertThat(candidate.commandName()).isEqualTo("fly_to");
        assertThat(candidate.params()).containsEntry("destination", "moon");
    }

    @Test
    void reportsEmptyResponse() {
        assertThat(parser.parse("  ").error()).isEqualTo("empty response");
        assertThat(parser.parse(null).error()).isEqualTo("empty response");
    }

    @Test
    void reportsMissingJsonObject() {
        assertThat(parser.parse("I will move to 5, 7 now").error()).isEqualTo("no JSON object found");
    }

    @Test
    void reportsMalformedJson() {
        ParsedOutput out = parser.parse("{\"command\": \"move_to\", \"command_params\": {\"x\": 5,");

        assertThat(out.isParsed()).isFalse();
        assertThat(out.error()).startsWith("invalid JSON (");
    }

    @Test
    void reportsParamsThatAreNotAnObject() {
        assertThat(parser.parse("{\"command\": \"move_to\", \"command_params\": [5, 7]}").error())
                .isEqualTo("command_params is not a JSON object");
        assertThat(parser.parse("{\"command\": \"move_to\", \"command_params\": \"x=5\"}").error())
                .startsWith("command_params is not a JSON object (");
    }
}

package com.phillippitts.speaktorobot.service.execution;

import com.phillippitts.speaktorobot.domain.ExecuteCommandRequest;
import com.phillippitts.speaktorobot.domain.ExecutionResponse;
import com.phillippitts.speaktorobot.service.schema.CommandSchema;
import com.phillippitts.speaktorobot.service.validation.CommandValidator;
import com.phillippitts.speaktorobot.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CommandExecutionServiceTest {

    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final CommandExecutionService service = new CommandExecutionService(
            new CommandValidator(CommandSchema.standard(-100, 100, List.of(), false)),
            new SimulatedRobotDispatcher(publisher));

    @Test
    void executesValidCommand() {
        ExecutionResponse response = service.execute(
                new ExecuteCommandRequest("rotate", Map.of("angle", 90, "direction", "clockwise")));

        assertThat(response.success()).isTrue();
        assertThat(response.command()).isEqualTo("rotate");
        assertThat(response.commandParams()).containsEntry("angle", 90.0);
        assertThat(response.message())
                .startsWith("Received and validated command: 'rotate' with params ")
                .endsWith("SIMULATION: Robot rotating 90 degrees clockwise");
        assertThat(response.error()).isNull();
        assertThat(publisher.events()).hasSize(1);
    }

    @Test
    void unknownCommandListsValidOnes() {
        ExecutionResponse response = service.execute(new ExecuteCommandRequest("dance", Map.of()));

        assertThat(response.success()).isFalse();
        assertThat(response.error()).isEqualTo("Invalid command. Reason: Unknown command name 'dance'");
        assertThat(response.details()).isEqualTo("Valid commands are: move_to, rotate, start_patrol");
        assertThat(publisher.events()).isEmpty();
    }

    @Test
    void missingCommandNameIsUnknown() {
        ExecutionResponse response = service.execute(new ExecuteCommandRequest(null, null));

        assertThat(response.success()).isFalse();
        assertThat(response.error()).isEqualTo("Invalid command. Reason: Unknown command name 'null'");
    }

    @Test
    void invalidParamsNameExpectedSchema() {
        ExecutionResponse response = service.execute(
                new ExecuteCommandRequest("rotate", Map.of("angle", 400, "direction", "clockwise")));

        assertThat(response.success()).isFalse();
        assertThat(response.error()).isEqualTo("Invalid params for 'rotate': angle must be in (0, 360], got 400");
        assertThat(response.details()).isEqualTo("Expected parameters: angle:NUMBER, direction:ENUM");
        assertThat(response.message()).isNull();
    }

    @Test
    void patrolDefaultsAppearInExpectedParameters() {
        ExecutionResponse response = service.execute(new ExecuteCommandRequest("start_patrol", Map.of()));

        assertThat(response.error()).isEqualTo("Invalid params for 'start_patrol': route is required for start_patrol");
        assertThat(response.details())
                .isEqualTo("Expected parameters: route:STRING, repeat_count:INTEGER=1, speed:ENUM=medium");
    }
}

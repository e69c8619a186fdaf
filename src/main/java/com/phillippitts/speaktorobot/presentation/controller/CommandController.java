package com.phillippitts.speaktorobot.presentation.controller;

import com.phillippitts.speaktorobot.config.logging.MdcFilter;
import com.phillippitts.speaktorobot.domain.CommandResponse;
import com.phillippitts.speaktorobot.domain.ExecuteCommandRequest;
import com.phillippitts.speaktorobot.domain.ExecutionResponse;
import com.phillippitts.speaktorobot.domain.UtteranceRequest;
import com.phillippitts.speaktorobot.exception.ClientInputException;
import com.phillippitts.speaktorobot.service.execution.CommandExecutionService;
import com.phillippitts.speaktorobot.service.orchestration.CommandOrchestrator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP boundary of the command pipeline.
 *
 * <ul>
 *   <li>{@code POST /process} - utterance in, command response out</li>
 *   <li>{@code POST /execute_command} - validate and execute a structured command directly</li>
 * </ul>
 */
@RestController
class CommandController {

    private final CommandOrchestrator orchestrator;
    private final CommandExecutionService executionService;

    CommandController(CommandOrchestrator orchestrator, CommandExecutionService executionService) {
        this.orchestrator = orchestrator;
        this.executionService = executionService;
    }

    @PostMapping("/process")
    ResponseEntity<CommandResponse> process(
            @RequestBody(required = false) UtteranceRequest request,
            @RequestHeader(value = MdcFilter.CORRELATION_ID_HEADER, required = false) String correlationId) {
        CommandResponse response = orchestrator.process(request, correlationId);
        return ResponseEntity.ok()
                .header(MdcFilter.CORRELATION_ID_HEADER, response.correlationId())
                .body(response);
    }

    @PostMapping("/execute_command")
    ResponseEntity<ExecutionResponse> executeCommand(@RequestBody(required = false) ExecuteCommandRequest request) {
        if (request == null) {
            throw ClientInputException.missing("command");
        }
        return ResponseEntity.ok(executionService.execute(request));
    }
}

package com.phillippitts.speaktorobot.presentation.controller;

import com.phillippitts.speaktorobot.config.IntegrationTestConfiguration;
import com.phillippitts.speaktorobot.exception.UpstreamServiceException;
import com.phillippitts.speaktorobot.testutil.ScriptedLanguageModelService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static com.phillippitts.speaktorobot.testutil.Replies.command;
import static com.phillippitts.speaktorobot.testutil.Replies.conversation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end HTTP tests through the filter, controller, pipeline and exception handler, with a
 * scripted language model.
 */
@ActiveProfiles("test")
@Import(IntegrationTestConfiguration.class)
@SpringBootTest
@AutoConfigureMockMvc
class CommandControllerTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ScriptedLanguageModelService model;

    @BeforeEach
    void resetModel() {
        model.reset();
    }

    @Test
    void processReturnsExtractedCommand() throws Exception {
        model.thenReply(command("Heading to (5, 7).", "move_to", "{\"x\": 5, \"y\": 7}"));

        mvc.perform(post("/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_input\": \"Go to coordinates 5, 7\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response").value("Heading to (5, 7)."))
                .andExpect(jsonPath("$.command").value("move_to"))
                .andExpect(jsonPath("$.command_params.x").value(5.0))
                .andExpect(jsonPath("$.command_params.y").value(7.0))
                .andExpect(jsonPath("$.execution_result").value("SIMULATION: Robot navigating to coordinates (5, 7)"))
                .andExpect(jsonPath("$.diagnostic").doesNotExist())
                .andExpect(header().exists("X-Correlation-ID"))
                .andExpect(header().exists("X-Request-ID"));
    }

    @Test
    void processReusesCallerCorrelationId() throws Exception {
        model.thenReply(conversation("Hello!"));

        mvc.perform(post("/process")
                        .header("X-Correlation-ID", "caller-123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_input\": \"hi there\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Correlation-ID", "caller-123"))
                .andExpect(jsonPath("$.correlation_id").value("caller-123"));

        assertThat(model.requests().get(0).correlationId()).isEqualTo("caller-123");
    }

    @Test
    void processReturnsConversationalReply() throws Exception {
        model.thenReply(conversation("I can't fly, but I can patrol the house."));

        mvc.perform(post("/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_input\": \"Fly to the moon\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response").value("I can't fly, but I can patrol the house."))
                .andExpect(jsonPath("$.command").isEmpty())
                .andExpect(jsonPath("$.command_params").isEmpty());

        assertThat(model.callCount()).isEqualTo(1);
    }

    @Test
    void processReportsExhaustion() throws Exception {
        String bad = command("Rotating.", "rotate", "{\"angle\": 400, \"direction\": \"clockwise\"}");
        model.thenReply(bad).thenReply(bad);

        mvc.perform(post("/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_input\": \"Rotate 400 degrees\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.diagnostic").value("EXTRACTION_EXHAUSTED"))
                .andExpect(jsonPath("$.response").value(startsWith("Sorry, I couldn't turn that")))
                .andExpect(jsonPath("$.exhausted").doesNotExist());
    }

    @Test
    void processRejectsEmptyInput() throws Exception {
        mvc.perform(post("/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_input\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("ClientInputException"))
                .andExpect(jsonPath("$.details").value("field: user_input"));

        assertThat(model.callCount()).isZero();
    }

    @Test
    void processRejectsMissingBody() throws Exception {
        mvc.perform(post("/process").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("ClientInputException"));
    }

    @Test
    void processRejectsMalformedJson() throws Exception {
        mvc.perform(post("/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_input\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("MalformedRequest"));
    }

    @Test
    void processMapsUpstreamFailureTo503() throws Exception {
        model.thenThrow(new UpstreamServiceException("connection refused", UpstreamServiceException.LANGUAGE_MODEL));

        mvc.perform(post("/process")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_input\": \"Go to 5, 7\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value("Language model service temporarily unavailable"))
                .andExpect(content -> assertThat(content.getResponse().getContentAsString())
                        .doesNotContain("connection refused"));
    }

    @Test
    void executeCommandRunsValidCommand() throws Exception {
        mvc.perform(post("/execute_command")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"command\": \"start_patrol\", \"command_params\": "
                                + "{\"route\": \"bedrooms\", \"repeat_count\": 2, \"speed\": \"slow\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.command").value("start_patrol"))
                .andExpect(jsonPath("$.message").value(containsString(
                        "SIMULATION: Robot starting bedrooms patrol at slow speed, repeating 2 time(s)")))
                .andExpect(jsonPath("$.error").doesNotExist());

        assertThat(model.callCount()).isZero();
    }

    @Test
    void executeCommandReportsInvalidParams() throws Exception {
        mvc.perform(post("/execute_command")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"command\": \"rotate\", \"command_params\": {\"angle\": 400, \"direction\": \"clockwise\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Invalid params for 'rotate': angle must be in (0, 360], got 400"))
                .andExpect(jsonPath("$.details").value("Expected parameters: angle:NUMBER, direction:ENUM"));
    }

    @Test
    void executeCommandReportsUnknownCommand() throws Exception {
        mvc.perform(post("/execute_command")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"command\": \"dance\", \"command_params\": {}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.details").value("Valid commands are: move_to, rotate, start_patrol"));
    }

    @Test
    void executeCommandRejectsMissingBody() throws Exception {
        mvc.perform(post("/execute_command").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").value("field: command"));
    }
}

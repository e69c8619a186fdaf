package com.phillippitts.speaktorobot.service.events;

import com.phillippitts.speaktorobot.domain.MoveToCommand;
import com.phillippitts.speaktorobot.service.execution.event.CommandDispatchedEvent;
import com.phillippitts.speaktorobot.service.orchestration.event.CommandExtractedEvent;
import com.phillippitts.speaktorobot.service.orchestration.event.ExtractionExhaustedEvent;
import com.phillippitts.speaktorobot.service.orchestration.event.UpstreamFailureEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ExtractionEventsListenerTest {

    @Test
    void throttlesRepeatLogs() {
        ExtractionEventsListener l = new ExtractionEventsListener();
        // first occurrence logs
        assertThat(l.shouldLog("exhausted")).isTrue();
        // immediate repeat is suppressed
        assertThat(l.shouldLog("exhausted")).isFalse();
        // other keys are independent
        assertThat(l.shouldLog("upstream-language-model-503")).isTrue();
    }

    @Test
    void handlersDoNotThrow() {
        ExtractionEventsListener l = new ExtractionEventsListener();
        MoveToCommand move = new MoveToCommand(5, 7);

        assertThatCode(() -> {
            l.onCommandExtracted(new CommandExtractedEvent("cid", move, 1, Instant.now()));
            l.onCommandDispatched(new CommandDispatchedEvent("cid", move, "SIMULATION: Robot ...", Instant.now()));
            l.onExtractionExhausted(new ExtractionExhaustedEvent("cid", 2, List.of("bad angle"), Instant.now()));
            l.onExtractionExhausted(new ExtractionExhaustedEvent("cid", 2, List.of("bad angle"), Instant.now()));
            l.onUpstreamFailure(new UpstreamFailureEvent("cid", "language-model", -1, true, "timed out", Instant.now()));
        }).doesNotThrowAnyException();
    }
}

package com.phillippitts.speaktorobot.service.execution;

import com.phillippitts.speaktorobot.domain.Command;
import com.phillippitts.speaktorobot.domain.MoveToCommand;
import com.phillippitts.speaktorobot.domain.RotateCommand;
import com.phillippitts.speaktorobot.domain.StartPatrolCommand;
import com.phillippitts.speaktorobot.service.execution.event.CommandDispatchedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;

/**
 * {@link CommandDispatcher} that simulates the robot: it describes what the robot would do,
 * logs it and publishes a {@link CommandDispatchedEvent}.
 */
@Component
public class SimulatedRobotDispatcher implements CommandDispatcher {

    private static final Logger LOG = LogManager.getLogger(SimulatedRobotDispatcher.class);

    static final String PREFIX = "SIMULATION: Robot ";

    private final ApplicationEventPublisher publisher;

    public SimulatedRobotDispatcher(ApplicationEventPublisher publisher) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    @Override
    public String dispatch(Command command, String correlationId) {
        Objects.requireNonNull(command, "command");
        String summary = describe(command);
        LOG.info("[ROBOT-SIMULATOR] {}", summary);
        publisher.publishEvent(new CommandDispatchedEvent(correlationId, command, summary, Instant.now()));
        return summary;
    }

    static String describe(Command command) {
        if (command instanceof MoveToCommand move) {
            return PREFIX + "navigating to coordinates (" + number(move.x()) + ", " + number(move.y()) + ")";
        }
        if (command instanceof RotateCommand rotate) {
            return PREFIX + "rotating " + number(rotate.angle()) + " degrees " + rotate.direction().wireName();
        }
        if (command instanceof StartPatrolCommand patrol) {
            String repeat = patrol.isContinuous() ? "continuous patrol" : patrol.repeatCount() + " time(s)";
            return PREFIX + "starting " + patrol.route() + " patrol at " + patrol.speed().wireName()
                    + " speed, repeating " + repeat;
        }
        throw new IllegalArgumentException("Not an actionable command: " + command);
    }

    /** Whole numbers without a fraction: 90.0 prints as "90". */
    private static String number(double d) {
        if (d == Math.rint(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }
}

package com.phillippitts.speaktorobot.service.health;

import com.phillippitts.speaktorobot.config.properties.LanguageModelProperties;
import com.phillippitts.speaktorobot.service.llm.LanguageModelService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the language-model endpoint.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: the endpoint answered the probe</li>
 *   <li>DOWN: the endpoint is unreachable or returned an error</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class LanguageModelHealthIndicator implements HealthIndicator {

    private final LanguageModelService modelService;
    private final LanguageModelProperties props;

    public LanguageModelHealthIndicator(LanguageModelService modelService, LanguageModelProperties props) {
        this.modelService = modelService;
        this.props = props;
    }

    @Override
    public Health health() {
        Health.Builder builder = modelService.isAvailable() ? Health.up() : Health.down();
        return builder
                .withDetail("model", props.getModel())
                .withDetail("baseUrl", props.getBaseUrl())
                .build();
    }
}

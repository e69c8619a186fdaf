package com.phillippitts.speaktorobot.config.orchestration;

import com.phillippitts.speaktorobot.config.properties.ExtractionProperties;
import com.phillippitts.speaktorobot.service.execution.CommandDispatcher;
import com.phillippitts.speaktorobot.service.extraction.DefaultExtractionRetryLoop;
import com.phillippitts.speaktorobot.service.extraction.ExtractionRetryLoop;
import com.phillippitts.speaktorobot.service.llm.CandidateParser;
import com.phillippitts.speaktorobot.service.llm.LanguageModelService;
import com.phillippitts.speaktorobot.service.orchestration.CommandMetricsPublisher;
import com.phillippitts.speaktorobot.service.orchestration.CommandOrchestrator;
import com.phillippitts.speaktorobot.service.orchestration.CorrelationIdGenerator;
import com.phillippitts.speaktorobot.service.orchestration.DefaultCommandOrchestrator;
import com.phillippitts.speaktorobot.service.orchestration.UuidCorrelationIdGenerator;
import com.phillippitts.speaktorobot.service.validation.CommandValidator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires the extraction loop and the orchestrator explicitly.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    public CorrelationIdGenerator correlationIdGenerator() {
        return new UuidCorrelationIdGenerator();
    }

    @Bean
    public ExtractionRetryLoop extractionRetryLoop(LanguageModelService languageModelService,
                                                   CandidateParser candidateParser,
                                                   CommandValidator commandValidator,
                                                   @Qualifier("llmExecutor") Executor llmExecutor,
                                                   ExtractionProperties extractionProperties) {
        return new DefaultExtractionRetryLoop(languageModelService, candidateParser, commandValidator,
                llmExecutor, extractionProperties);
    }

    @Bean
    public CommandOrchestrator commandOrchestrator(ExtractionRetryLoop extractionRetryLoop,
                                                   CommandDispatcher commandDispatcher,
                                                   CorrelationIdGenerator correlationIdGenerator,
                                                   ApplicationEventPublisher publisher,
                                                   CommandMetricsPublisher metricsPublisher) {
        return new DefaultCommandOrchestrator(extractionRetryLoop, commandDispatcher, correlationIdGenerator,
                publisher, metricsPublisher);
    }
}

/**
 * Language-model boundary: the {@link com.phillippitts.speaktorobot.service.llm.LanguageModelService}
 * contract, its OpenAI-compatible HTTP implementation, and parsing of raw replies into
 * {@link com.phillippitts.speaktorobot.domain.CommandCandidate}s.
 */
package com.phillippitts.speaktorobot.service.llm;

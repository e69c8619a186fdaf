/**
 * Service layer: command schema, validation, language-model access, the extraction-retry loop,
 * orchestration and downstream execution.
 */
package com.phillippitts.speaktorobot.service;

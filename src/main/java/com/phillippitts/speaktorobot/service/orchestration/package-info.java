/**
 * Request orchestration: correlation IDs, input guard, extraction, dispatch and response mapping.
 */
package com.phillippitts.speaktorobot.service.orchestration;

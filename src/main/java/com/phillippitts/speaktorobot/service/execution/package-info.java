/**
 * Downstream execution of validated commands, simulated by default.
 */
package com.phillippitts.speaktorobot.service.execution;

/**
 * Command validation: turns unvalidated candidates into {@link com.phillippitts.speaktorobot.domain.Verdict}s.
 */
package com.phillippitts.speaktorobot.service.validation;

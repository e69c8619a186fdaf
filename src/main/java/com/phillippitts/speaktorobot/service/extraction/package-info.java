/**
 * The extraction-retry loop: bounded model calls with validator-driven corrective feedback.
 */
package com.phillippitts.speaktorobot.service.extraction;

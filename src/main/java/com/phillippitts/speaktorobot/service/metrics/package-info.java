/**
 * Micrometer instrumentation for the extraction pipeline.
 */
package com.phillippitts.speaktorobot.service.metrics;

/**
 * Spring configuration: typed properties, bean wiring, thread pools and logging infrastructure.
 */
package com.phillippitts.speaktorobot.config;

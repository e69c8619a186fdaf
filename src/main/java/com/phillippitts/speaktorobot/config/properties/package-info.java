/**
 * Typed {@code @ConfigurationProperties} for the extraction loop, command schema,
 * language-model client and thread pools.
 */
package com.phillippitts.speaktorobot.config.properties;

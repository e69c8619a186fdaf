/**
 * Small stateless helpers shared across layers.
 */
package com.phillippitts.speaktorobot.util;

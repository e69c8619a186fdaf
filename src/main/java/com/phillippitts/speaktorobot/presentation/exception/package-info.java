/**
 * Maps application exceptions to HTTP status codes and a uniform error body.
 */
package com.phillippitts.speaktorobot.presentation.exception;

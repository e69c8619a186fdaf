/**
 * REST controllers. Thin adapters over the orchestration and execution services.
 */
package com.phillippitts.speaktorobot.presentation.controller;

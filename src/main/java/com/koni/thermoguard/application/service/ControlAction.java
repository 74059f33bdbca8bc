package com.koni.thermoguard.application.service;

/**
 * Decision of the hysteresis controller for one temperature sample.
 */
public enum ControlAction {
    TURN_ON,
    TURN_OFF,
    HOLD
}

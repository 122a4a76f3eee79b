package com.triggerd.service;

/**
 * A trigger definition was rejected when it was created or updated: blank
 * script path, duplicate name, bad cron. Always raised to the caller, never
 * stored as a half-valid trigger.
 */
public class TriggerConfigurationException extends RuntimeException {

    public TriggerConfigurationException(String message) {
        super(message);
    }

    public TriggerConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

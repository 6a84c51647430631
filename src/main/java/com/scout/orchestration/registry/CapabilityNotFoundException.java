package com.scout.orchestration.registry;

/**
 * Raised when an intent that passed plan validation has no registered handler.
 * Signals a defect, never a user error.
 */
public class CapabilityNotFoundException extends RuntimeException {

    private final String intent;

    public CapabilityNotFoundException(String intent) {
        super("No capability handler registered for intent '" + intent + "'");
        this.intent = intent;
    }

    public String getIntent() {
        return intent;
    }
}

package com.mco.core.state;

/**
 * Thrown when a state mutation targets an orchestration id that was never initialized.
 */
public class OrchestrationNotFoundException extends RuntimeException {

    private final String orchestrationId;

    public OrchestrationNotFoundException(String orchestrationId) {
        super("Unknown orchestration: " + orchestrationId);
        this.orchestrationId = orchestrationId;
    }

    public String getOrchestrationId() {
        return orchestrationId;
    }
}

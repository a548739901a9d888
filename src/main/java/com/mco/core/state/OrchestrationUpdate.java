package com.mco.core.state;

import com.mco.core.model.OrchestrationStatus;

import java.util.Map;

/**
 * Partial update applied by {@link StateStore#update}. Null fields are left untouched;
 * {@code variables} are merged key-wise into the existing variables.
 */
public record OrchestrationUpdate(
    OrchestrationStatus status,
    Integer currentStepIndex,
    Map<String, Object> variables
) {

    public static OrchestrationUpdate status(OrchestrationStatus status) {
        return new OrchestrationUpdate(status, null, null);
    }

    public static OrchestrationUpdate variables(Map<String, Object> variables) {
        return new OrchestrationUpdate(null, null, variables);
    }
}

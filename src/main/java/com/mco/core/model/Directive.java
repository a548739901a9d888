package com.mco.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * A single unit of work handed to an executor. Rebuilt on every request, never persisted.
 *
 * @param stepId            id of the step this directive covers
 * @param stepType          the step's type tag; nullable
 * @param instruction       task text with known {@code {var}} placeholders substituted
 * @param guidance          goal, audience, vision and criteria rendered as plain text
 * @param stepIndex         zero-based position of the step
 * @param totalSteps        number of steps in the workflow
 * @param persistentContext core and success-criteria data, present on every directive
 * @param injectedContext   features and/or styles, present only at planned steps
 */
public record Directive(
    @JsonProperty("step_id") String stepId,
    @JsonProperty("step_type") String stepType,
    @JsonProperty("instruction") String instruction,
    @JsonProperty("guidance") String guidance,
    @JsonProperty("step_index") int stepIndex,
    @JsonProperty("total_steps") int totalSteps,
    @JsonProperty("persistent_context") Map<String, Object> persistentContext,
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonProperty("injected_context") Map<String, Object> injectedContext
) {

    public Directive {
        persistentContext = persistentContext == null ? Map.of() : persistentContext;
        injectedContext = injectedContext == null ? Map.of() : injectedContext;
    }

    public boolean hasInjectedContext() {
        return !injectedContext.isEmpty();
    }
}

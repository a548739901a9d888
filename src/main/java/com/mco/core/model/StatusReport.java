package com.mco.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Read-only progress view of an orchestration.
 *
 * @param progress completed steps divided by total steps; 0.0 when the workflow is empty
 */
public record StatusReport(
    @JsonProperty("orchestration_id") String orchestrationId,
    @JsonProperty("status") OrchestrationStatus status,
    @JsonProperty("current_step_index") int currentStepIndex,
    @JsonProperty("completed_steps") List<String> completedSteps,
    @JsonProperty("total_steps") int totalSteps,
    @JsonProperty("progress") double progress
) {
}

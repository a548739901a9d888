package com.mco.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Short description of a loaded workflow, returned by validation.
 */
public record WorkflowSummary(
    @JsonProperty("name") String name,
    @JsonProperty("goal") String goal,
    @JsonProperty("step_count") int stepCount,
    @JsonProperty("criteria_count") int criteriaCount,
    @JsonProperty("feature_count") int featureCount,
    @JsonProperty("style_count") int styleCount
) {

    public static WorkflowSummary of(WorkflowConfig config) {
        return new WorkflowSummary(
                config.core().name(),
                config.successCriteria().goal(),
                config.totalSteps(),
                config.successCriteria().criteria().size(),
                config.features().blocks().size(),
                config.styles().blocks().size());
    }
}

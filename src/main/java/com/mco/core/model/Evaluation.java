package com.mco.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Heuristic verdict on a step result. Only {@link #success()} drives state changes.
 *
 * @param success  whether the step is considered passed
 * @param feedback explanation of the verdict
 * @param progress fraction of the workflow covered once this step is counted, in [0, 1]
 * @param context  goal, target audience and developer vision echoed back; nullable
 */
public record Evaluation(
    boolean success,
    String feedback,
    double progress,
    @JsonInclude(JsonInclude.Include.NON_NULL) Map<String, Object> context
) {

    public static Evaluation failure(String feedback) {
        return new Evaluation(false, feedback, 0.0, null);
    }
}

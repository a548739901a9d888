package com.mco.core.model;

/**
 * Output reported for one directive, either by an adapter or by a caller-driven executor.
 *
 * @param output free-text executor output; nullable
 * @param status reported status
 * @param error  error description when status is ERROR; nullable
 */
public record StepResult(
    String output,
    ResultStatus status,
    String error
) {

    public StepResult {
        status = status == null ? ResultStatus.SUCCESS : status;
    }

    public static StepResult success(String output) {
        return new StepResult(output, ResultStatus.SUCCESS, null);
    }

    public static StepResult error(String error) {
        return new StepResult(null, ResultStatus.ERROR, error);
    }

    public boolean failed() {
        return status == ResultStatus.ERROR;
    }
}

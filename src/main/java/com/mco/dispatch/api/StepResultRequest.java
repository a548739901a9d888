package com.mco.dispatch.api;

import com.mco.core.model.ResultStatus;
import com.mco.core.model.StepResult;

/**
 * Inbound JSON body for POST /api/v1/orchestrations/{id}/result.
 *
 * @param output executor output; nullable
 * @param status "success" or "error" (case-insensitive); nullable, defaults to success
 * @param error  error description for an error result; nullable
 */
public record StepResultRequest(
    String output,
    String status,
    String error
) {

    public StepResult toStepResult() {
        ResultStatus resultStatus = status != null && status.equalsIgnoreCase("error")
                ? ResultStatus.ERROR
                : ResultStatus.SUCCESS;
        return new StepResult(output, resultStatus, error);
    }
}

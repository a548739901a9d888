package com.mco.core.model;

/**
 * What a core-driven execution produced: the adapter's result and its evaluation.
 */
public record ExecutionOutcome(
    StepResult result,
    Evaluation evaluation
) {
}

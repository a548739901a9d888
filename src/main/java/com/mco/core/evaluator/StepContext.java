package com.mco.core.evaluator;

/**
 * Position of the evaluated step within its workflow.
 */
public record StepContext(int stepIndex, int totalSteps) {

    /** {@code (stepIndex + 1) / totalSteps}, or 0.0 for an empty workflow. */
    public double progress() {
        if (totalSteps <= 0) {
            return 0.0;
        }
        return Math.min(1.0, (stepIndex + 1) / (double) totalSteps);
    }
}

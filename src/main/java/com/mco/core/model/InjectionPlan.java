package com.mco.core.model;

import java.util.Set;

/**
 * Step indices at which optional context is surfaced. Computed once per orchestration.
 *
 * @param featureSteps indices that receive the feature blocks
 * @param styleSteps   indices that receive the style blocks
 */
public record InjectionPlan(
    Set<Integer> featureSteps,
    Set<Integer> styleSteps
) {

    public InjectionPlan {
        featureSteps = featureSteps == null ? Set.of() : Set.copyOf(featureSteps);
        styleSteps = styleSteps == null ? Set.of() : Set.copyOf(styleSteps);
    }

    public static InjectionPlan empty() {
        return new InjectionPlan(Set.of(), Set.of());
    }

    public boolean injectsFeaturesAt(int stepIndex) {
        return featureSteps.contains(stepIndex);
    }

    public boolean injectsStylesAt(int stepIndex) {
        return styleSteps.contains(stepIndex);
    }
}

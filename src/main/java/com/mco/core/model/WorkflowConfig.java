package com.mco.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Immutable, fully parsed workflow definition loaded from one directory.
 * Shared read-only by every orchestration started from the same directory.
 *
 * @param configDir       normalized directory the documents were read from
 * @param core            core document contents
 * @param successCriteria success-criteria document contents
 * @param features        optional feature blocks
 * @param styles          optional style blocks
 */
public record WorkflowConfig(
    Path configDir,
    CoreConfig core,
    SuccessCriteria successCriteria,
    FeatureSet features,
    StyleSet styles
) {

    public WorkflowConfig {
        features = features == null ? FeatureSet.empty() : features;
        styles = styles == null ? StyleSet.empty() : styles;
    }

    public List<Step> steps() {
        return core.steps();
    }

    public int totalSteps() {
        return core.steps().size();
    }
}

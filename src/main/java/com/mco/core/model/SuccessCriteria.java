package com.mco.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Parsed contents of a workflow's success-criteria document.
 *
 * @param goal             overall goal statement
 * @param criteria         ordered criterion strings
 * @param targetAudience   who the output is for; nullable
 * @param developerVision  free-text vision statement; nullable
 */
public record SuccessCriteria(
    String goal,
    List<String> criteria,
    String targetAudience,
    String developerVision
) implements Serializable {

    public SuccessCriteria {
        criteria = criteria == null ? List.of() : List.copyOf(criteria);
    }
}

package com.mco.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of one running workflow instance. Instances are immutable; the state store
 * hands out a fresh snapshot after every mutation.
 *
 * @param id               opaque orchestration id
 * @param status           lifecycle status
 * @param currentStepIndex index of the next step to issue; never decreases
 * @param completedSteps   ids of steps that passed evaluation, in completion order, no duplicates
 * @param variables        variables available for {@code {var}} substitution
 * @param createdAt        creation time; null for the unknown default
 * @param updatedAt        last mutation time; null for the unknown default
 */
public record Orchestration(
    @JsonProperty("orchestration_id") String id,
    @JsonProperty("status") OrchestrationStatus status,
    @JsonProperty("current_step_index") int currentStepIndex,
    @JsonProperty("completed_steps") List<String> completedSteps,
    @JsonProperty("variables") Map<String, Object> variables,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {

    public Orchestration {
        completedSteps = completedSteps == null ? List.of() : List.copyOf(completedSteps);
        variables = variables == null ? Map.of() : unmodifiableCopy(variables);
    }

    /** Freshly initialized orchestration. */
    public static Orchestration created(String id, Map<String, Object> variables, Instant now) {
        return new Orchestration(id, OrchestrationStatus.CREATED, 0, List.of(), variables, now, now);
    }

    /** Default returned for ids that were never initialized. */
    public static Orchestration unknown(String id) {
        return new Orchestration(id, OrchestrationStatus.UNKNOWN, 0, List.of(), Map.of(), null, null);
    }

    @JsonIgnore
    public boolean isKnown() {
        return status != OrchestrationStatus.UNKNOWN;
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == OrchestrationStatus.COMPLETED;
    }

    public Orchestration withStatus(OrchestrationStatus newStatus, Instant now) {
        return new Orchestration(id, newStatus, currentStepIndex, completedSteps, variables, createdAt, now);
    }

    public Orchestration withCurrentStepIndex(int index, Instant now) {
        return new Orchestration(id, status, index, completedSteps, variables, createdAt, now);
    }

    /** Returns a copy with {@code stepId} appended, or {@code this} if it is already recorded. */
    public Orchestration withCompletedStep(String stepId, Instant now) {
        if (completedSteps.contains(stepId)) {
            return this;
        }
        List<String> next = new ArrayList<>(completedSteps);
        next.add(stepId);
        return new Orchestration(id, status, currentStepIndex, next, variables, createdAt, now);
    }

    /** Key-wise merge: entries in {@code changes} overwrite, all others are kept. */
    public Orchestration withMergedVariables(Map<String, Object> changes, Instant now) {
        Map<String, Object> merged = new LinkedHashMap<>(variables);
        merged.putAll(changes);
        return new Orchestration(id, status, currentStepIndex, completedSteps, merged, createdAt, now);
    }

    // Map.copyOf rejects null values, which variables may legitimately carry
    private static Map<String, Object> unmodifiableCopy(Map<String, Object> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}

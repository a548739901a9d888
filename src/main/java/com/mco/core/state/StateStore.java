package com.mco.core.state;

import com.mco.core.model.Orchestration;

import java.util.List;
import java.util.Map;

/**
 * Per-orchestration progress and variables behind a pluggable persistence backend.
 * <p>
 * Mutations for one id are linearizable. Every method returns a fresh snapshot.
 */
public interface StateStore {

    /**
     * Creates the record for {@code id}. Idempotent: an existing record is returned unchanged.
     */
    Orchestration init(String id, Map<String, Object> variables);

    /**
     * Current state of {@code id}, or {@link Orchestration#unknown(String)} for unseen ids.
     * Never throws for a missing id.
     */
    Orchestration get(String id);

    /**
     * Merges non-null fields of {@code update}; variables are merged key-wise.
     *
     * @throws OrchestrationNotFoundException if {@code id} was never initialized
     */
    Orchestration update(String id, OrchestrationUpdate update);

    /**
     * Adds {@code stepId} to the completed set. Calling it twice has no further effect.
     *
     * @throws OrchestrationNotFoundException if {@code id} was never initialized
     */
    Orchestration markStepComplete(String id, String stepId);

    /**
     * Sets the step pointer directly.
     *
     * @throws OrchestrationNotFoundException if {@code id} was never initialized
     */
    Orchestration setCurrentStep(String id, int index);

    List<String> listIds();

    /**
     * @return true if a record was removed
     */
    boolean delete(String id);
}

package com.mco.adapter;

import com.mco.core.model.Directive;
import com.mco.core.model.StepResult;

/**
 * Boundary to an external execution backend (typically a language-model-driven agent).
 * Implementations are Spring beans collected into the {@link AdapterRegistry}.
 * <p>
 * The orchestrator treats {@link #execute} as blocking and adds no retries, timeouts
 * or circuit-breaking of its own.
 */
public interface ExecutorAdapter {

    /**
     * Registry key used to bind an orchestration to this adapter (e.g. "echo").
     */
    String name();

    /**
     * Runs one directive to completion.
     *
     * @return the executor's output; a result with status ERROR is a normal step failure
     * @throws AdapterExecutionException if the backend could not run the directive at all
     */
    StepResult execute(Directive directive);

    /**
     * Releases backend resources. Called once on shutdown.
     */
    default void cleanup() {
    }
}

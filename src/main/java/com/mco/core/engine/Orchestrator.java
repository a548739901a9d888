package com.mco.core.engine;

import com.mco.adapter.AdapterExecutionException;
import com.mco.adapter.AdapterRegistry;
import com.mco.adapter.ExecutorAdapter;
import com.mco.core.config.WorkflowConfigLoader;
import com.mco.core.evaluator.StepContext;
import com.mco.core.evaluator.SuccessEvaluator;
import com.mco.core.logging.MdcContext;
import com.mco.core.metrics.McoMetrics;
import com.mco.core.model.Directive;
import com.mco.core.model.DirectiveEnvelope;
import com.mco.core.model.Evaluation;
import com.mco.core.model.ExecutionOutcome;
import com.mco.core.model.InjectionPlan;
import com.mco.core.model.Orchestration;
import com.mco.core.model.OrchestrationStatus;
import com.mco.core.model.StatusReport;
import com.mco.core.model.StepResult;
import com.mco.core.model.WorkflowConfig;
import com.mco.core.planner.ContextInjectionPlanner;
import com.mco.core.state.OrchestrationNotFoundException;
import com.mco.core.state.OrchestrationUpdate;
import com.mco.core.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives the directive/result loop of every running orchestration.
 * <p>
 * State machine: {@code CREATED -> RUNNING -> COMPLETED}. The step pointer advances only
 * when a result is evaluated as a success; a failed step leaves state untouched so the
 * identical directive is issued again. There is no retry cap.
 * <p>
 * Calls for distinct orchestrations may run concurrently. Calls for one orchestration
 * are expected to be serialized by the caller.
 */
@Service
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final WorkflowConfigLoader configLoader;
    private final StateStore stateStore;
    private final ContextInjectionPlanner planner;
    private final SuccessEvaluator evaluator;
    private final AdapterRegistry adapterRegistry;
    private final McoMetrics metrics;

    /** In-process sessions keyed by orchestration id. */
    private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();

    public Orchestrator(WorkflowConfigLoader configLoader,
                        StateStore stateStore,
                        ContextInjectionPlanner planner,
                        SuccessEvaluator evaluator,
                        AdapterRegistry adapterRegistry,
                        McoMetrics metrics) {
        this.configLoader = configLoader;
        this.stateStore = stateStore;
        this.planner = planner;
        this.evaluator = evaluator;
        this.adapterRegistry = adapterRegistry;
        this.metrics = metrics;
    }

    /**
     * Loads the workflow, creates the orchestration record and computes its injection plan.
     *
     * @param configDir    workflow directory
     * @param adapterName  registered adapter to bind, or null/blank for caller-driven execution
     * @param initialVars  initial variables for {@code {var}} substitution; nullable
     * @return the new orchestration id
     * @throws com.mco.core.config.ConfigException if the workflow cannot be loaded
     * @throws com.mco.adapter.AdapterNotFoundException if {@code adapterName} is not registered
     */
    public String start(String configDir, String adapterName, Map<String, Object> initialVars) {
        WorkflowConfig config = configLoader.load(configDir);
        ExecutorAdapter adapter = adapterName == null || adapterName.isBlank()
                ? null
                : adapterRegistry.get(adapterName);

        String id = generateOrchestrationId();
        MdcContext.setOrchestration(id);
        try {
            stateStore.init(id, initialVars == null ? Map.of() : initialVars);
            InjectionPlan plan = planner.plan(config.steps());
            sessions.put(id, new Session(config, plan, adapter));

            boolean empty = config.totalSteps() == 0;
            stateStore.update(id, OrchestrationUpdate.status(
                    empty ? OrchestrationStatus.COMPLETED : OrchestrationStatus.RUNNING));

            log.info("Started orchestration {} for workflow '{}' ({} steps, adapter {})",
                    id, config.core().name(), config.totalSteps(), adapter == null ? "none" : adapter.name());
            metrics.recordOrchestrationStarted();

            if (empty) {
                onCompleted(id);
            }
            return id;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Builds the directive for the current step and caches it as the pending directive.
     *
     * @return EXECUTE with the directive, COMPLETE once every step has passed, or ERROR for
     *         an orchestration without an active session
     */
    public DirectiveEnvelope getNextDirective(String id) {
        Orchestration state = stateStore.get(id);
        if (state.isCompleted()) {
            return DirectiveEnvelope.complete("Orchestration complete");
        }
        Session session = sessions.get(id);
        if (session == null) {
            log.warn("Directive requested for orchestration {} with no active session", id);
            return DirectiveEnvelope.error("Unknown orchestration: " + id);
        }

        synchronized (session) {
            int index = state.currentStepIndex();
            int total = session.config.totalSteps();
            if (index >= total) {
                stateStore.update(id, OrchestrationUpdate.status(OrchestrationStatus.COMPLETED));
                onCompleted(id);
                return DirectiveEnvelope.complete("All steps complete");
            }

            Directive directive = DirectiveBuilder.build(session.config, session.plan, index, state.variables());
            session.pending = directive;

            MdcContext.setStep(id, directive.stepId());
            try {
                log.info("Issuing step {}/{} ({}){}", index + 1, total, directive.stepId(),
                        directive.hasInjectedContext() ? " with " + directive.injectedContext().keySet() : "");
            } finally {
                MdcContext.clear();
            }
            metrics.recordDirectiveIssued(directive.hasInjectedContext());
            return DirectiveEnvelope.execute(directive);
        }
    }

    /**
     * Evaluates {@code result} against the pending directive. On success the step is marked
     * complete and the pointer advances; on failure nothing changes. Reporting the same
     * result twice for one pending directive has no further effect on state.
     */
    public Evaluation processResult(String id, StepResult result) {
        Session session = sessions.get(id);
        if (session == null) {
            return Evaluation.failure("Unknown orchestration: " + id);
        }

        synchronized (session) {
            Directive pending = session.pending;
            if (pending == null) {
                log.warn("Result reported for orchestration {} with no current directive", id);
                return Evaluation.failure("No current directive");
            }

            MdcContext.setStep(id, pending.stepId());
            try {
                Evaluation evaluation = evaluator.evaluate(pending.stepId(), result,
                        session.config.successCriteria(),
                        new StepContext(pending.stepIndex(), pending.totalSteps()));
                metrics.recordEvaluation(evaluation.success());

                if (evaluation.success()) {
                    advance(id, pending);
                    log.info("Step {} passed: {}", pending.stepId(), evaluation.feedback());
                } else {
                    log.info("Step {} failed, will be reissued: {}", pending.stepId(), evaluation.feedback());
                }
                return evaluation;
            } finally {
                MdcContext.clear();
            }
        }
    }

    /**
     * Runs the pending directive through the bound adapter, then evaluates the result.
     *
     * @throws OrchestrationNotFoundException if the orchestration has no active session
     * @throws IllegalStateException if no adapter is bound or no directive is pending
     * @throws AdapterExecutionException if the adapter fails; state is left unchanged
     */
    public ExecutionOutcome executeDirective(String id) {
        Session session = sessions.get(id);
        if (session == null) {
            throw new OrchestrationNotFoundException(id);
        }
        if (session.adapter == null) {
            throw new IllegalStateException("Orchestration " + id
                    + " has no adapter bound; report results with processResult instead");
        }
        Directive pending = session.pending;
        if (pending == null) {
            throw new IllegalStateException("Orchestration " + id + " has no current directive; request one first");
        }

        ExecutorAdapter adapter = session.adapter;
        StepResult result;
        MdcContext.setAdapter(id, pending.stepId(), adapter.name());
        long start = System.currentTimeMillis();
        try {
            result = adapter.execute(pending);
            metrics.recordAdapterExecution(adapter.name(), true, System.currentTimeMillis() - start);
        } catch (AdapterExecutionException e) {
            metrics.recordAdapterExecution(adapter.name(), false, System.currentTimeMillis() - start);
            log.warn("Adapter '{}' failed on step {}: {}", adapter.name(), pending.stepId(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordAdapterExecution(adapter.name(), false, System.currentTimeMillis() - start);
            log.warn("Adapter '{}' threw on step {}: {}", adapter.name(), pending.stepId(), e.getMessage(), e);
            throw new AdapterExecutionException(adapter.name(),
                    "Adapter '" + adapter.name() + "' failed: " + e.getMessage(), e);
        } finally {
            MdcContext.clear();
        }

        Evaluation evaluation = processResult(id, result);
        return new ExecutionOutcome(result, evaluation);
    }

    /**
     * Progress view. For an orchestration without an active session the step count is not
     * known; a completed one reports its completed steps as the total.
     */
    public StatusReport getStatus(String id) {
        Orchestration state = stateStore.get(id);
        Session session = sessions.get(id);
        int completed = state.completedSteps().size();
        int total;
        if (session != null) {
            total = session.config.totalSteps();
        } else {
            total = state.isCompleted() ? completed : 0;
        }
        double progress = total > 0 ? Math.min(1.0, completed / (double) total) : 0.0;
        return new StatusReport(id, state.status(), state.currentStepIndex(),
                state.completedSteps(), total, progress);
    }

    /**
     * Core and success-criteria context of the orchestration's workflow.
     *
     * @throws OrchestrationNotFoundException if the orchestration has no active session
     */
    public Map<String, Object> getPersistentContext(String id) {
        Session session = sessions.get(id);
        if (session == null) {
            throw new OrchestrationNotFoundException(id);
        }
        return DirectiveBuilder.persistentContext(session.config);
    }

    /**
     * Sets one variable; it is used from the next directive on.
     *
     * @throws OrchestrationNotFoundException if the orchestration was never started
     */
    public void setVariable(String id, String key, Object value) {
        stateStore.update(id, OrchestrationUpdate.variables(Collections.singletonMap(key, value)));
        log.debug("Set variable '{}' on orchestration {}", key, id);
    }

    public Optional<Object> getVariable(String id, String key) {
        return Optional.ofNullable(stateStore.get(id).variables().get(key));
    }

    /**
     * Drops the in-process session. Persisted state stays queryable through {@link #getStatus}.
     *
     * @return true if a session was active
     */
    public boolean release(String id) {
        Session removed = sessions.remove(id);
        if (removed != null) {
            log.info("Released orchestration {}", id);
        }
        return removed != null;
    }

    public String generateOrchestrationId() {
        return UUID.randomUUID().toString();
    }

    private void advance(String id, Directive pending) {
        stateStore.markStepComplete(id, pending.stepId());
        Orchestration state = stateStore.get(id);
        int next = Math.max(state.currentStepIndex(), pending.stepIndex() + 1);
        if (next != state.currentStepIndex()) {
            state = stateStore.setCurrentStep(id, next);
        }
        if (next >= pending.totalSteps() && !state.isCompleted()) {
            stateStore.update(id, OrchestrationUpdate.status(OrchestrationStatus.COMPLETED));
            onCompleted(id);
        }
    }

    private void onCompleted(String id) {
        log.info("Orchestration {} completed", id);
        metrics.recordOrchestrationCompleted();
    }

    private static final class Session {
        private final WorkflowConfig config;
        private final InjectionPlan plan;
        private final ExecutorAdapter adapter;
        private volatile Directive pending;

        Session(WorkflowConfig config, InjectionPlan plan, ExecutorAdapter adapter) {
            this.config = config;
            this.plan = plan;
            this.adapter = adapter;
        }
    }
}

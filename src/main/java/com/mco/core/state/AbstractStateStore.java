package com.mco.core.state;

import com.mco.core.model.Orchestration;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Shared read-modify-write logic for {@link StateStore} backends. Each mutation for an id
 * runs under that id's lock; backends only implement raw document access.
 */
public abstract class AbstractStateStore implements StateStore {

    private final ConcurrentHashMap<String, Object> locks = new ConcurrentHashMap<>();
    private final Clock clock;

    protected AbstractStateStore(Clock clock) {
        this.clock = clock;
    }

    /** Loads the stored record, empty when none exists. */
    protected abstract Optional<Orchestration> read(String id);

    /** Stores {@code orchestration}, replacing any previous record for its id. */
    protected abstract void write(Orchestration orchestration);

    protected abstract boolean remove(String id);

    protected abstract List<String> ids();

    @Override
    public Orchestration init(String id, Map<String, Object> variables) {
        synchronized (lockFor(id)) {
            Optional<Orchestration> existing = read(id);
            if (existing.isPresent()) {
                return existing.get();
            }
            Orchestration created = Orchestration.created(id, variables, now());
            write(created);
            return created;
        }
    }

    @Override
    public Orchestration get(String id) {
        if (id == null || id.isBlank()) {
            return Orchestration.unknown(id);
        }
        return read(id).orElseGet(() -> Orchestration.unknown(id));
    }

    @Override
    public Orchestration update(String id, OrchestrationUpdate update) {
        return mutate(id, current -> {
            Instant now = now();
            Orchestration next = current;
            if (update.status() != null) {
                next = next.withStatus(update.status(), now);
            }
            if (update.currentStepIndex() != null) {
                next = next.withCurrentStepIndex(update.currentStepIndex(), now);
            }
            if (update.variables() != null && !update.variables().isEmpty()) {
                next = next.withMergedVariables(update.variables(), now);
            }
            return next;
        });
    }

    @Override
    public Orchestration markStepComplete(String id, String stepId) {
        return mutate(id, current -> current.withCompletedStep(stepId, now()));
    }

    @Override
    public Orchestration setCurrentStep(String id, int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Step index must not be negative: " + index);
        }
        return mutate(id, current -> current.withCurrentStepIndex(index, now()));
    }

    @Override
    public List<String> listIds() {
        return ids();
    }

    @Override
    public boolean delete(String id) {
        synchronized (lockFor(id)) {
            boolean removed = remove(id);
            locks.remove(id);
            return removed;
        }
    }

    private Orchestration mutate(String id, UnaryOperator<Orchestration> change) {
        synchronized (lockFor(id)) {
            Orchestration current = read(id).orElseThrow(() -> new OrchestrationNotFoundException(id));
            Orchestration next = change.apply(current);
            if (next != current) {
                write(next);
            }
            return next;
        }
    }

    private Object lockFor(String id) {
        return locks.computeIfAbsent(id, k -> new Object());
    }

    private Instant now() {
        return clock.instant();
    }
}

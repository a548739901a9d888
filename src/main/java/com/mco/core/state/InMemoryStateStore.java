package com.mco.core.state;

import com.mco.core.model.Orchestration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local state store. State is lost on restart.
 */
public class InMemoryStateStore extends AbstractStateStore {

    private final ConcurrentHashMap<String, Orchestration> records = new ConcurrentHashMap<>();

    public InMemoryStateStore() {
        this(Clock.systemUTC());
    }

    public InMemoryStateStore(Clock clock) {
        super(clock);
    }

    @Override
    protected Optional<Orchestration> read(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    protected void write(Orchestration orchestration) {
        records.put(orchestration.id(), orchestration);
    }

    @Override
    protected boolean remove(String id) {
        return records.remove(id) != null;
    }

    @Override
    protected List<String> ids() {
        return new ArrayList<>(records.keySet());
    }
}

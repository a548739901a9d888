package com.mco.adapter;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed name-to-adapter table built from the {@link ExecutorAdapter} beans in the context.
 * No discovery happens after construction.
 */
@Component
public class AdapterRegistry {

    private static final Logger log = LoggerFactory.getLogger(AdapterRegistry.class);

    private final Map<String, ExecutorAdapter> adapters;

    public AdapterRegistry(List<ExecutorAdapter> adapters) {
        Map<String, ExecutorAdapter> byName = new LinkedHashMap<>();
        for (ExecutorAdapter adapter : adapters) {
            ExecutorAdapter previous = byName.putIfAbsent(adapter.name(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate adapter name '" + adapter.name() + "': "
                        + previous.getClass().getSimpleName() + " and " + adapter.getClass().getSimpleName());
            }
        }
        this.adapters = Collections.unmodifiableMap(byName);
        log.info("Registered executor adapters: {}", this.adapters.keySet());
    }

    /**
     * @throws AdapterNotFoundException if no adapter is registered under {@code name}
     */
    public ExecutorAdapter get(String name) {
        ExecutorAdapter adapter = adapters.get(name);
        if (adapter == null) {
            throw new AdapterNotFoundException(name, adapters.keySet());
        }
        return adapter;
    }

    public Optional<ExecutorAdapter> find(String name) {
        return Optional.ofNullable(adapters.get(name));
    }

    public Set<String> names() {
        return adapters.keySet();
    }

    @PreDestroy
    public void cleanupAll() {
        for (ExecutorAdapter adapter : adapters.values()) {
            try {
                adapter.cleanup();
            } catch (RuntimeException e) {
                log.warn("Adapter '{}' failed to clean up: {}", adapter.name(), e.getMessage(), e);
            }
        }
    }
}

package com.mco.adapter;

import com.mco.core.model.Directive;
import com.mco.core.model.StepResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link AdapterRegistry}.
 */
class AdapterRegistryTest {

    private static ExecutorAdapter named(String name) {
        return new ExecutorAdapter() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public StepResult execute(Directive directive) {
                return StepResult.success("ran " + name);
            }
        };
    }

    @Test
    @DisplayName("looks adapters up by name")
    void lookup() {
        ExecutorAdapter codex = named("codex");
        var registry = new AdapterRegistry(List.of(new EchoExecutorAdapter(), codex));

        assertSame(codex, registry.get("codex"));
        assertEquals(Set.of("echo", "codex"), registry.names());
        assertTrue(registry.find("echo").isPresent());
        assertTrue(registry.find("other").isEmpty());
    }

    @Test
    @DisplayName("unknown names raise AdapterNotFoundException listing the registered ones")
    void unknownName() {
        var registry = new AdapterRegistry(List.of(new EchoExecutorAdapter()));

        var ex = assertThrows(AdapterNotFoundException.class, () -> registry.get("claude"));
        assertTrue(ex.getMessage().contains("claude"));
        assertTrue(ex.getMessage().contains("echo"));
    }

    @Test
    @DisplayName("duplicate names fail fast")
    void duplicateNames() {
        assertThrows(IllegalStateException.class,
                () -> new AdapterRegistry(List.of(named("same"), named("same"))));
    }

    @Test
    @DisplayName("cleanupAll calls every adapter even when one fails")
    void cleanupAll() {
        ExecutorAdapter failing = mock(ExecutorAdapter.class);
        when(failing.name()).thenReturn("failing");
        doThrow(new IllegalStateException("boom")).when(failing).cleanup();
        ExecutorAdapter healthy = mock(ExecutorAdapter.class);
        when(healthy.name()).thenReturn("healthy");

        new AdapterRegistry(List.of(failing, healthy)).cleanupAll();

        verify(failing).cleanup();
        verify(healthy).cleanup();
    }
}

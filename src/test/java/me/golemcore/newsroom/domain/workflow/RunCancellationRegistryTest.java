package me.golemcore.newsroom.domain.workflow;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunCancellationRegistryTest {

    private final RunCancellationRegistry registry = new RunCancellationRegistry();

    @Test
    void shouldCancelOnlyActiveRuns() {
        assertFalse(registry.cancel("r1"));

        assertTrue(registry.activate("r1"));
        assertFalse(registry.activate("r1"));
        assertTrue(registry.cancel("r1"));
        assertTrue(registry.isCancelled("r1"));

        registry.deactivate("r1");
        assertFalse(registry.isActive("r1"));
        assertFalse(registry.isCancelled("r1"));
    }

    @Test
    void shouldClearStaleCancelOnReactivation() {
        registry.activate("r1");
        registry.cancel("r1");
        registry.deactivate("r1");

        assertTrue(registry.activate("r1"));
        assertFalse(registry.isCancelled("r1"));
    }
}

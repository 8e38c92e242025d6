package com.keystone.routing.metrics;

import com.keystone.config.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CircuitBreakerRegistryTest {

    @Test
    void opensAtThresholdAndResetsOnSuccess() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(3);

        assertFalse(registry.record("lammps", false).open());
        assertFalse(registry.record("lammps", false).open());
        assertTrue(registry.record("lammps", false).open());
        assertTrue(registry.isOpen("lammps"));
        assertFalse(registry.isOpen("fenicsx"));

        CircuitBreakerState reset = registry.record("lammps", true);
        assertEquals(new CircuitBreakerState(false, 0, 3), reset);
    }

    @Test
    void rejectsThresholdBelowOne() {
        assertThrows(ConfigurationException.class, () -> new CircuitBreakerRegistry(0));
    }
}

package com.keystone.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RoutingDefaultsTest {

    @Test
    void defaults() {
        RoutingDefaults d = RoutingDefaults.defaults();
        assertEquals(3, d.getMaxRetries());
        assertEquals(5, d.getCircuitBreakerThreshold());
        assertEquals(2.0, d.getBackoffMultiplier());
        assertSame(d, d.validate());
    }

    @Test
    void validate_rejectsOutOfRangeValues() {
        assertThrows(ConfigurationException.class, () -> new RoutingDefaults(-1, null, null, null).validate());
        assertThrows(ConfigurationException.class, () -> new RoutingDefaults(null, 0, null, null).validate());
        assertThrows(ConfigurationException.class, () -> new RoutingDefaults(null, null, 0.0, null).validate());
        assertThrows(ConfigurationException.class, () -> new RoutingDefaults(null, null, Double.NaN, null).validate());
    }

    @Test
    void zeroRetriesIsAllowed() {
        assertEquals(0, new RoutingDefaults(0, null, null, null).validate().getMaxRetries());
    }
}

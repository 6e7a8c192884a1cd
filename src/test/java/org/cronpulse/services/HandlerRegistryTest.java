package org.cronpulse.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HandlerRegistryTest {

    private final JobHandler fallback = (owner, action) -> { };
    private HandlerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new HandlerRegistry(fallback);
    }

    @Test
    void resolve_shouldReturnRegisteredHandlerIgnoringCase() {
        JobHandler weather = (owner, action) -> { };
        registry.register("Weather_Report", weather);

        assertSame(weather, registry.resolve("weather_report"));
        assertSame(weather, registry.resolve(" WEATHER_REPORT "));
        assertEquals(Set.of("weather_report"), registry.registeredTypes());
    }

    @Test
    void resolve_shouldFallBackToDefaultForUnknownOrMissingType() {
        assertSame(fallback, registry.resolve("unknown"));
        assertSame(fallback, registry.resolve(null));
    }

    @Test
    void register_shouldRejectBlankType() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", fallback));
    }

    @Test
    void register_shouldFailOnceSealed() {
        registry.seal();

        assertTrue(registry.isSealed());
        assertThrows(IllegalStateException.class, () -> registry.register("late", fallback));
        assertTrue(registry.registeredTypes().isEmpty());
    }
}

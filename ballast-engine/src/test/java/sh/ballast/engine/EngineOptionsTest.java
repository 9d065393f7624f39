// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.ballast.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

import sh.ballast.engine.event.EngineEventListener;

class EngineOptionsTest {

    @Test
    void defaultsUseThreeHourWindow() {
        EngineOptions options = EngineOptions.defaults();

        assertEquals(Duration.ofHours(3), options.staleTimeout());
        assertTrue(options.listeners().isEmpty());
        assertNotNull(options.clock());
    }

    @Test
    void builderSetsValues() {
        Clock clock = Clock.fixed(Instant.EPOCH, ZoneOffset.UTC);
        EngineEventListener listener = event -> { };

        EngineOptions options = EngineOptions.builder()
                .clock(clock)
                .staleTimeout(Duration.ofMinutes(30))
                .listener(listener)
                .build();

        assertSame(clock, options.clock());
        assertEquals(Duration.ofMinutes(30), options.staleTimeout());
        assertEquals(1, options.listeners().size());
        assertSame(listener, options.listeners().get(0));
    }

    @Test
    void rejectsInvalidValues() {
        EngineOptions.Builder builder = EngineOptions.builder();

        assertThrows(NullPointerException.class, () -> builder.clock(null));
        assertThrows(NullPointerException.class, () -> builder.listener(null));
        assertThrows(IllegalArgumentException.class, () -> builder.staleTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> builder.staleTimeout(Duration.ofSeconds(-5)));
    }

    @Test
    void listenersAreImmutable() {
        EngineOptions options = EngineOptions.builder().listener(event -> { }).build();

        assertThrows(UnsupportedOperationException.class, () -> options.listeners().add(event -> { }));
    }

    @Test
    void equalityIsByValue() {
        Clock clock = Clock.fixed(Instant.EPOCH, ZoneOffset.UTC);
        EngineOptions a = EngineOptions.builder().clock(clock).staleTimeout(Duration.ofHours(1)).build();
        EngineOptions b = EngineOptions.builder().clock(clock).staleTimeout(Duration.ofHours(1)).build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertTrue(a.toString().contains("PT1H"));
    }
}

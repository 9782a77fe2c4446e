package com.taskforge.coordination.streaming;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StreamingSessionRegistryTest {

    private static final Duration TIMEOUT = Duration.ofHours(1);

    @Test
    void testOpenReturnsSameSession() {
        StreamingSessionRegistry registry = new StreamingSessionRegistry();
        StreamingSessionRegistry.Registration first = registry.open(1L, 10L, 0L);
        StreamingSessionRegistry.Registration second = registry.open(1L, 10L, 100L);

        assertTrue(first.created());
        assertFalse(second.created());
        assertSame(first.session(), second.session());
        assertEquals(1, registry.size());
    }

    @Test
    void testSweepRemovesStaleSessionsOnly() {
        StreamingSessionRegistry registry = new StreamingSessionRegistry();
        long start = 1_000_000L;
        registry.open(1L, 10L, start);
        StreamingSession active = registry.open(1L, 11L, start).session();
        active.markCacheFlushed(start + TIMEOUT.toMillis());

        List<Long> removed = registry.sweep(start + TIMEOUT.toMillis() + 1, TIMEOUT);

        assertEquals(List.of(10L), removed);
        assertTrue(registry.find(10L).isEmpty());
        assertTrue(registry.find(11L).isPresent());
    }

    @Test
    void testSweepKeepsSessionsWithinTimeout() {
        StreamingSessionRegistry registry = new StreamingSessionRegistry();
        registry.open(1L, 10L, 0L);

        assertTrue(registry.sweep(TIMEOUT.toMillis(), TIMEOUT).isEmpty());
        assertEquals(1, registry.size());
    }
}

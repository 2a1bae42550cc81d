package com.mimecast.outpost.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DurationsTest {

    @Test
    void testUnits() {
        assertEquals(Duration.ofMillis(500), Durations.parse("500ms").orElseThrow());
        assertEquals(Duration.ofSeconds(30), Durations.parse("30s").orElseThrow());
        assertEquals(Duration.ofMinutes(2), Durations.parse("2m").orElseThrow());
        assertEquals(Duration.ofHours(1), Durations.parse("1h").orElseThrow());
        assertEquals(Duration.ofDays(3), Durations.parse("3d").orElseThrow());
        assertEquals(Duration.ofDays(14), Durations.parse("2w").orElseThrow());
    }

    @Test
    void testBareNumbers() {
        assertEquals(Duration.ofSeconds(90), Durations.parse("90").orElseThrow());
        assertEquals(Duration.ofSeconds(60), Durations.parse(60.0).orElseThrow());
        assertEquals(Duration.ofSeconds(5), Durations.parse(" 5 S ").orElseThrow());
    }

    @Test
    void testInvalid() {
        assertTrue(Durations.parse("").isEmpty());
        assertTrue(Durations.parse("soon").isEmpty());
        assertTrue(Durations.parse("5y").isEmpty());
        assertTrue(Durations.parse(-1).isEmpty());
        assertTrue(Durations.parse(null).isEmpty());
    }
}

package io.surfworks.entitlement.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Timestamps}.
 */
class TimestampsTest {

    @Test
    @DisplayName("naive timestamps are read as UTC")
    void parse_naiveIsUtc() {
        Instant expected = Instant.parse("2025-12-31T23:59:59Z");

        assertEquals(Optional.of(expected), Timestamps.parse("2025-12-31 23:59:59"));
        assertEquals(Optional.of(expected), Timestamps.parse("2025-12-31T23:59:59"));
    }

    @Test
    @DisplayName("offset and date-only forms are accepted")
    void parse_otherForms() {
        assertEquals(Optional.of(Instant.parse("2025-06-01T10:00:00Z")), Timestamps.parse("2025-06-01T12:00:00+02:00"));
        assertEquals(Optional.of(Instant.parse("2025-06-01T00:00:00Z")), Timestamps.parse("2025-06-01"));
    }

    @Test
    @DisplayName("blank or unparseable values are empty")
    void parse_invalid() {
        assertTrue(Timestamps.parse(null).isEmpty());
        assertTrue(Timestamps.parse("  ").isEmpty());
        assertTrue(Timestamps.parse("next tuesday").isEmpty());
    }

    @Test
    @DisplayName("format writes the service layout in UTC")
    void format_utc() {
        assertEquals("2025-12-31 23:59:59", Timestamps.format(Instant.parse("2025-12-31T23:59:59Z")));
        assertNull(Timestamps.format(null));
    }
}

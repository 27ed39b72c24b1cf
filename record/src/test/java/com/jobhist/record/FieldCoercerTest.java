package com.jobhist.record;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FieldCoercer}.
 */
class FieldCoercerTest {

    private final FieldCatalog catalog = FieldCatalog.pbs();
    private final FieldCoercer coercer = new FieldCoercer(ZoneOffset.UTC);

    // ==================== Numbers ====================

    @Test
    void testInteger() {
        FieldValue value = coercer.coerce(catalog.require("numcpus"), "36");

        assertEquals(FieldKind.INTEGER, value.kind());
        assertEquals(36L, value.asLong());
        assertEquals("36", value.raw());
        assertTrue(value.isCoerced());
    }

    @Test
    void testNegativeExitStatus() {
        assertEquals(-11L, coercer.coerce(catalog.require("status"), "-11").asLong());
    }

    @Test
    void testFloat() {
        assertEquals(12.5, coercer.coerce(catalog.require("avgcpu"), "12.50").asDouble(), 1e-9);
    }

    @Test
    void testNonFiniteFloatRejected() {
        assertThrows(FieldCoercionException.class, () -> coercer.coerce(catalog.require("avgcpu"), "NaN"));
    }

    @Test
    void testIntegerRejectsText() {
        FieldCoercionException e = assertThrows(FieldCoercionException.class,
                () -> coercer.coerce(catalog.require("numcpus"), "lots"));

        assertEquals("numcpus", e.getField());
        assertEquals("lots", e.getRaw());
        assertEquals(FieldKind.INTEGER, e.getKind());
    }

    // ==================== Durations ====================

    @ParameterizedTest
    @CsvSource({
            "01:30:05, 5405",
            "12:00:00, 43200",
            "100:00:00, 360000",
            "05:10, 310",
            "90, 90",
            "00:00:00, 0"
    })
    void testDuration(String raw, long seconds) {
        FieldValue value = coercer.coerce(catalog.require("elapsed"), raw);

        assertEquals(Duration.ofSeconds(seconds), value.asDuration());
        assertEquals(seconds, value.numericValue(), 0.0);
    }

    @ParameterizedTest
    @ValueSource(strings = {"1:75:00", "abc", "1:2:3:4", "", "-5", "1::2"})
    void testInvalidDuration(String raw) {
        assertThrows(FieldCoercionException.class, () -> coercer.coerce(catalog.require("walltime"), raw));
    }

    // ==================== Memory ====================

    @ParameterizedTest
    @CsvSource({
            "4gb, 4294967296",
            "1024kb, 1048576",
            "3MB, 3145728",
            "100b, 100",
            "512, 512",
            "2w, 16",
            "1kw, 8192",
            "1tb, 1099511627776",
            "7k, 7168"
    })
    void testMemory(String raw, long bytes) {
        assertEquals(bytes, coercer.coerce(catalog.require("memory"), raw).asBytes());
    }

    @ParameterizedTest
    @ValueSource(strings = {"4xb", "gb", "1.5gb", "99999999999pb"})
    void testInvalidMemory(String raw) {
        assertThrows(FieldCoercionException.class, () -> coercer.coerce(catalog.require("reqmem"), raw));
    }

    // ==================== Timestamps ====================

    @Test
    void testEpochTimestampInZone() {
        FieldDefinition end = catalog.require("end");

        assertEquals(LocalDateTime.of(2025, 3, 1, 10, 0),
                coercer.coerce(end, "1740823200").asTimestamp());
        assertEquals(LocalDateTime.of(2025, 3, 1, 3, 0),
                new FieldCoercer(ZoneOffset.ofHours(-7)).coerce(end, "1740823200").asTimestamp());
    }

    @ParameterizedTest
    @CsvSource({
            "20250301, 2025-03-01T00:00:00",
            "2025-03-01, 2025-03-01T00:00:00",
            "2025-03-01T08:15, 2025-03-01T08:15:00",
            "2025-03-01T08:15:30, 2025-03-01T08:15:30",
            "2025-03-01 08:15, 2025-03-01T08:15:00",
            "03/01/2025 08:15:30, 2025-03-01T08:15:30"
    })
    void testTimestampForms(String raw, String expected) {
        assertEquals(LocalDateTime.parse(expected), coercer.coerce(catalog.require("start"), raw).asTimestamp());
    }

    @Test
    void testInvalidTimestamp() {
        assertThrows(FieldCoercionException.class, () -> coercer.coerce(catalog.require("start"), "yesterday"));
        assertThrows(FieldCoercionException.class, () -> coercer.coerce(catalog.require("start"), "2025-13-01"));
        assertThrows(FieldCoercionException.class, () -> coercer.coerce(catalog.require("start"), "20251301"));
    }

    @Test
    void testEightDigitsAreADateNotEpochSeconds() {
        FieldDefinition end = catalog.require("end");

        assertEquals(LocalDateTime.of(2025, 3, 1, 0, 0), coercer.coerce(end, "20250301").asTimestamp());
        assertEquals(LocalDateTime.of(1973, 3, 3, 9, 46, 40), coercer.coerce(end, "100000000").asTimestamp());
    }

    // ==================== Idempotence ====================

    @ParameterizedTest
    @CsvSource({
            "numcpus, 36",
            "avgcpu, 0.97",
            "elapsed, 02:00:00",
            "memory, 12gb",
            "end, 1740823200",
            "user, vanderwb"
    })
    void testCoercionIsIdempotent(String field, String raw) {
        FieldDefinition def = catalog.require(field);
        FieldValue once = coercer.coerce(def, raw);
        FieldValue twice = coercer.coerce(def, once);

        assertSame(once, twice);
        assertEquals(once, coercer.coerce(def, twice));
        assertEquals(def.kind(), twice.kind());
    }

    @Test
    void testUncoercedValueIsReread() {
        FieldDefinition def = catalog.require("numcpus");

        assertEquals(4L, coercer.coerce(def, FieldValue.uncoerced("4")).asLong());
        assertThrows(FieldCoercionException.class, () -> coercer.coerce(def, FieldValue.uncoerced("four")));
    }

    @Test
    void testTextIsNeverRejected() {
        FieldValue value = coercer.coerce(catalog.require("jobname"), "  spaced name ");

        assertEquals("  spaced name ", value.asText());
    }
}

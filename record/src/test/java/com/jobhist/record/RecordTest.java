package com.jobhist.record;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Record}, {@link JobId} and {@link FieldValue}.
 */
class RecordTest {

    private static final LocalDateTime TIME = LocalDateTime.of(2025, 3, 1, 9, 30);

    @Test
    void testHeaderPseudoFields() {
        Record record = Record.builder()
                .type(RecordType.STARTED)
                .timestamp(TIME)
                .jobId("55[3].server")
                .build();

        assertEquals("S", record.get(FieldCatalog.RECORD_TYPE).asText());
        assertEquals(TIME, record.get(FieldCatalog.TIMESTAMP).asTimestamp());
        assertEquals("03/01/2025 09:30:00", record.get(FieldCatalog.TIMESTAMP).raw());
        assertEquals("55[3].server", record.get(FieldCatalog.ID).asText());
        assertEquals("55[3]", record.get(FieldCatalog.SHORT_ID).asText());
        assertNull(record.get("user"));
        assertFalse(record.has("user"));
    }

    @Test
    void testFieldsAreUnmodifiable() {
        Record record = Record.builder()
                .tag("E")
                .timestamp(TIME)
                .jobId("1.server")
                .field("user", FieldValue.ofText("alice"))
                .build();

        Map<String, FieldValue> fields = record.getFields();
        assertThrows(UnsupportedOperationException.class, () -> fields.put("user", FieldValue.ofText("eve")));
        assertEquals("alice", record.get("user").asText());
    }

    @Test
    void testBuilderChangesDoNotLeakIntoBuiltRecord() {
        Record.Builder builder = Record.builder()
                .tag("E")
                .timestamp(TIME)
                .jobId("1.server")
                .field("user", FieldValue.ofText("alice"));
        Record record = builder.build();

        builder.field("queue", FieldValue.ofText("main"));

        assertFalse(record.has("queue"));
    }

    @Test
    void testMandatoryHeaderValues() {
        assertThrows(NullPointerException.class, () -> Record.builder().tag("E").jobId("1.server").build());
        assertThrows(NullPointerException.class, () -> Record.builder().timestamp(TIME).jobId("1.server").build());
        assertThrows(IllegalArgumentException.class, () -> JobId.parse("  "));
    }

    @Test
    void testJobIdWithoutSuffix() {
        JobId id = JobId.parse("4123456");

        assertEquals("4123456", id.full());
        assertEquals("4123456", id.shortId());
    }

    @Test
    void testRecordTypeTags() {
        assertEquals(RecordType.ENDED, RecordType.fromTag("E"));
        assertEquals(RecordType.RESTARTED, RecordType.fromTag("T"));
        assertEquals(RecordType.UNKNOWN, RecordType.fromTag("e"));
        assertEquals(RecordType.UNKNOWN, RecordType.fromTag(""));
    }

    @Test
    void testFieldValueComparison() {
        assertTrue(FieldValue.ofInteger("2", 2).compareTo(FieldValue.ofInteger("10", 10)) < 0);
        assertThrows(IllegalArgumentException.class,
                () -> FieldValue.ofInteger("2", 2).compareTo(FieldValue.ofText("2")));
        assertThrows(IllegalStateException.class, () -> FieldValue.ofText("x").asLong());
        assertThrows(IllegalStateException.class, () -> FieldValue.ofText("x").numericValue());
        assertNotEquals(FieldValue.ofText("4"), FieldValue.uncoerced("4"));
    }
}

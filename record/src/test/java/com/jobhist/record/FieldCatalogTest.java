package com.jobhist.record;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FieldCatalog}.
 */
class FieldCatalogTest {

    private final FieldCatalog catalog = FieldCatalog.pbs();

    @Test
    void testLookupByNameAndLogKey() {
        FieldDefinition byName = catalog.require("numcpus");
        FieldDefinition byKey = catalog.require("Resource_List.ncpus");

        assertSame(byName, byKey);
        assertEquals(FieldKind.INTEGER, byName.kind());
        assertSame(byName, catalog.byLogKey("Resource_List.ncpus"));
        assertNull(catalog.byLogKey("numcpus"));
    }

    @Test
    void testLookupIsCaseSensitive() {
        assertNull(catalog.find("NumCpus"));
        assertNull(catalog.find("resource_list.ncpus"));
    }

    @Test
    void testUnknownFieldRejected() {
        UnknownFieldException e = assertThrows(UnknownFieldException.class, () -> catalog.require("bogus"));

        assertEquals("bogus", e.getField());
        assertTrue(e.getMessage().contains("bogus"));
    }

    @Test
    void testHeaderFields() {
        assertTrue(catalog.require(FieldCatalog.ID).isHeaderField());
        assertTrue(catalog.require(FieldCatalog.RECORD_TYPE).isHeaderField());
        assertEquals(FieldKind.TIMESTAMP, catalog.require(FieldCatalog.TIMESTAMP).kind());
        assertFalse(catalog.require("user").isHeaderField());
    }

    @Test
    void testKinds() {
        assertEquals(FieldKind.MEMORY, catalog.require("reqmem").kind());
        assertEquals(FieldKind.DURATION, catalog.require("cputime").kind());
        assertEquals(FieldKind.FLOAT, catalog.require("avgcpu").kind());
        assertEquals(FieldKind.TIMESTAMP, catalog.require("eligible").kind());
        assertEquals(FieldKind.TEXT, catalog.require("select").kind());
    }

    @Test
    void testBuilderRejectsDuplicates() {
        FieldCatalog.Builder builder = FieldCatalog.builder()
                .field("cores", "ncpus", FieldKind.INTEGER, "Cores", "Cores", 5);

        assertThrows(IllegalArgumentException.class,
                () -> builder.field("cores", "cores", FieldKind.INTEGER, "Cores", "Cores", 5));
    }

    @Test
    void testCustomCatalog() {
        FieldCatalog custom = FieldCatalog.builder()
                .header(FieldCatalog.ID, FieldKind.TEXT, "Job", "Job", 10)
                .field("cores", "ncpus", FieldKind.INTEGER, "Cores", "Cores", 5)
                .build();

        assertEquals(2, custom.definitions().size());
        assertEquals("cores", custom.require("ncpus").name());
    }
}

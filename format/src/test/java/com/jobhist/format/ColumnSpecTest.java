package com.jobhist.format;

import com.jobhist.record.FieldCatalog;
import com.jobhist.record.UnknownFieldException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ColumnSpec}.
 */
class ColumnSpecTest {

    private final FieldCatalog catalog = FieldCatalog.pbs();

    @Test
    void testParseList() {
        List<ColumnSpec> columns = ColumnSpec.parseList("user,numcpus:6d,elapsed:t", catalog);

        assertEquals(3, columns.size());
        assertEquals("user", columns.get(0).getName());
        assertFalse(columns.get(0).hasStyle());
        assertEquals(10, columns.get(0).getWidth());
        assertEquals(6, columns.get(1).getWidth());
        assertEquals('d', columns.get(1).getStyle());
        assertEquals('t', columns.get(2).getStyle());
        assertEquals(catalog.require("elapsed").defaultWidth(), columns.get(2).getWidth());
    }

    @Test
    void testFullSpecifier() {
        ColumnSpec column = ColumnSpec.parse("memory:-9.1g", catalog);

        assertTrue(column.isLeftAligned());
        assertFalse(column.isRightAligned());
        assertEquals(9, column.getWidth());
        assertEquals(1, column.getPrecision());
        assertEquals('g', column.getStyle());
        assertEquals("memory:-9.1g", column.toString());
    }

    @Test
    void testAlignment() {
        assertTrue(ColumnSpec.parse("numcpus", catalog).isRightAligned());
        assertFalse(ColumnSpec.parse("numcpus:s", catalog).isRightAligned());
        assertFalse(ColumnSpec.parse("user", catalog).isRightAligned());
        assertFalse(ColumnSpec.parse("end", catalog).isRightAligned());
    }

    @Test
    void testLogKeyAndBlankEntries() {
        List<ColumnSpec> columns = ColumnSpec.parseList(" Resource_List.ncpus:4 ,, user ", catalog);

        assertEquals(2, columns.size());
        assertEquals("numcpus", columns.get(0).getName());
    }

    @ParameterizedTest
    @ValueSource(strings = {"user:t", "numcpus:5x", "numcpus:abc", "numcpus:0d", "end:f", "numcpus:6dd",
            "elapsed:g", "memory:t", "avgcpu:T", "user:D"})
    void testUnsupportedSpecifiers(String entry) {
        assertThrows(UnsupportedFormatSpecifierException.class, () -> ColumnSpec.parse(entry, catalog));
    }

    @Test
    void testSpecifierErrorNamesField() {
        UnsupportedFormatSpecifierException e = assertThrows(UnsupportedFormatSpecifierException.class,
                () -> ColumnSpec.parseList("user,jobname:h", catalog));

        assertEquals("jobname", e.getField());
        assertEquals("h", e.getSpecifier());
    }

    @Test
    void testUnknownField() {
        assertThrows(UnknownFieldException.class, () -> ColumnSpec.parseList("user,cores", catalog));
    }

    @Test
    void testEmptyList() {
        assertThrows(UnsupportedFormatSpecifierException.class, () -> ColumnSpec.parseList(" , ", catalog));
        assertThrows(UnsupportedFormatSpecifierException.class, () -> ColumnSpec.parseList(null, catalog));
    }
}

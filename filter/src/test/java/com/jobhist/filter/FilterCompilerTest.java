package com.jobhist.filter;

import com.jobhist.record.FieldCatalog;
import com.jobhist.record.FieldCoercer;
import com.jobhist.record.FieldKind;
import com.jobhist.record.UnknownFieldException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FilterCompiler}.
 */
class FilterCompilerTest {

    private final FilterCompiler compiler = new FilterCompiler(FieldCatalog.pbs(), new FieldCoercer(ZoneOffset.UTC));

    @Test
    void testCompileConjunction() {
        CompiledFilter filter = compiler.compile("numcpus>1;user==vanderwb");

        List<FilterClause> clauses = filter.getClauses();
        assertEquals(2, clauses.size());
        assertEquals(Operator.GT, clauses.get(0).operator());
        assertEquals("numcpus", clauses.get(0).field().name());
        assertEquals(1L, clauses.get(0).literal().asLong());
        assertEquals(Operator.EQ, clauses.get(1).operator());
        assertEquals("vanderwb", clauses.get(1).literal().asText());
        assertEquals("numcpus>1;user==vanderwb", filter.toString());
    }

    @Test
    void testEmptyFilterMatchesAll() {
        assertTrue(compiler.compile("").isEmpty());
        assertTrue(compiler.compile(null).isEmpty());
        assertTrue(compiler.compile(" ; ;").isEmpty());
    }

    @Test
    void testWhitespaceAndEmptyClausesIgnored() {
        CompiledFilter filter = compiler.compile(" numcpus >= 36 ;; queue == main ;");

        assertEquals(2, filter.getClauses().size());
        assertEquals(Operator.GE, filter.getClauses().get(0).operator());
        assertEquals("main", filter.getClauses().get(1).literal().asText());
    }

    @Test
    void testLongestOperatorWins() {
        assertEquals(Operator.LE, compiler.compile("numcpus<=4").getClauses().get(0).operator());
        assertEquals(Operator.NE, compiler.compile("user!=bob").getClauses().get(0).operator());
        assertEquals(Operator.NOT_CONTAINS, compiler.compile("jobname!~test").getClauses().get(0).operator());
        assertEquals(Operator.CONTAINS, compiler.compile("jobname~test").getClauses().get(0).operator());
    }

    @Test
    void testLiteralsTakeFieldKind() {
        CompiledFilter filter = compiler.compile(
                "elapsed>01:00:00;memory>=4gb;end<2025-03-01T12:00;avgcpu<0.5;record_type==E");

        List<FilterClause> clauses = filter.getClauses();
        assertEquals(FieldKind.DURATION, clauses.get(0).literal().kind());
        assertEquals(3600, clauses.get(0).literal().asDuration().getSeconds());
        assertEquals(4L << 30, clauses.get(1).literal().asBytes());
        assertEquals(FieldKind.TIMESTAMP, clauses.get(2).literal().kind());
        assertEquals(0.5, clauses.get(3).literal().asDouble(), 0.0);
        assertEquals(FieldKind.TEXT, clauses.get(4).literal().kind());
    }

    @Test
    void testCompactDateLiteral() {
        FilterClause clause = compiler.compile("end>20250301").getClauses().get(0);

        assertEquals(LocalDateTime.of(2025, 3, 1, 0, 0), clause.literal().asTimestamp());
        assertEquals("end>20250301", clause.toString());
    }

    @Test
    void testFieldNames() {
        assertEquals(List.of("numcpus", "record_type", "jobname"),
                FilterCompiler.fieldNames(" numcpus>1; record_type!=E;jobname==\"record_type;x\""));
        assertEquals(List.of(), FilterCompiler.fieldNames(""));
        assertEquals(List.of(), FilterCompiler.fieldNames(null));
    }

    @Test
    void testLogKeyAcceptedAsFieldName() {
        FilterClause clause = compiler.compile("Resource_List.ncpus>8").getClauses().get(0);

        assertEquals("numcpus", clause.field().name());
    }

    @Test
    void testQuotedLiteral() {
        CompiledFilter filter = compiler.compile("jobname==\"a; b \\\"c\\\"\";queue==main");

        assertEquals(2, filter.getClauses().size());
        assertEquals("a; b \"c\"", filter.getClauses().get(0).literal().asText());
    }

    @Test
    void testEqualsClauseQuotesValue() {
        String text = FilterCompiler.equalsClause("jobname", "odd \"name\"; here");

        assertEquals("odd \"name\"; here", compiler.compile(text).getClauses().get(0).literal().asText());
    }

    @Test
    void testUnknownField() {
        UnknownFieldException e = assertThrows(UnknownFieldException.class, () -> compiler.compile("cores>1"));

        assertEquals("cores", e.getField());
    }

    @Test
    void testInvalidLiteral() {
        InvalidLiteralException e = assertThrows(InvalidLiteralException.class,
                () -> compiler.compile("user==bob;numcpus>many"));

        assertEquals("numcpus", e.getField());
        assertEquals("many", e.getLiteral());
        assertEquals(FieldKind.INTEGER, e.getKind());
    }

    @ParameterizedTest
    @ValueSource(strings = {"numcpus", "numcpus 4", "user=bob", "==bob", "numcpus>", "user==\"open",
            "user==\"a\"b", "numcpus~4", "elapsed!~01:00"})
    void testInvalidClauses(String text) {
        assertThrows(InvalidFilterException.class, () -> compiler.compile(text));
    }

    @Test
    void testPushDownTypes() {
        assertEquals(Set.of("E"), compiler.compile("record_type==E;numcpus>1").pushDownTypes());
        assertEquals(Set.of(), compiler.compile("record_type!=E").pushDownTypes());
        assertEquals(Set.of(), compiler.compile("numcpus>1").pushDownTypes());
    }

    @Test
    void testAndCombinesClauses() {
        CompiledFilter combined = compiler.compile("numcpus>1").and(compiler.compile("user==bob"));

        assertEquals(2, combined.getClauses().size());
        assertSame(CompiledFilter.matchAll().and(combined), combined);
    }
}

package com.jobhist.format;

import com.jobhist.record.FieldCatalog;
import com.jobhist.record.FieldValue;
import com.jobhist.record.Record;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Aggregator} and {@link AggregateSummary}.
 */
class AggregatorTest {

    @Test
    void testAveragesOverRecordsWithValues() {
        Aggregator aggregator = new Aggregator(ColumnSpec.parseList("user,numcpus,elapsed,memory", FieldCatalog.pbs()));

        aggregator.accept(job(4, 3600, 2));
        aggregator.accept(job(8, 7200, 4));
        aggregator.accept(Record.builder().tag("E").timestamp(LocalDateTime.of(2025, 3, 1, 0, 0)).jobId("9.x")
                .field("numcpus", FieldValue.uncoerced("n/a"))
                .build());

        AggregateSummary summary = aggregator.summary();
        assertEquals(3, summary.recordCount());
        assertEquals(3, summary.averages().size());
        assertEquals(2, summary.averages().get(0).samples());
        assertEquals(6.0, summary.averages().get(0).average(), 1e-9);
        assertEquals("average over 3 records: numcpus=6.00, elapsed=01:30:00, memory=3.00", summary.describe());
    }

    @Test
    void testNoSamples() {
        Aggregator aggregator = new Aggregator(ColumnSpec.parseList("numcpus", FieldCatalog.pbs()));

        AggregateSummary summary = aggregator.summary();

        assertEquals(0, summary.recordCount());
        assertTrue(Double.isNaN(summary.averages().get(0).average()));
        assertEquals("average over 0 records: numcpus=-", summary.describe());
    }

    @Test
    void testTextColumnsOnly() {
        Aggregator aggregator = new Aggregator(ColumnSpec.parseList("user,queue", FieldCatalog.pbs()));
        aggregator.accept(job(1, 1, 1));

        assertEquals("average over 1 record", aggregator.summary().describe());
    }

    private static Record job(long cpus, long seconds, long gigabytes) {
        return Record.builder()
                .tag("E")
                .timestamp(LocalDateTime.of(2025, 3, 1, 12, 0))
                .jobId(cpus + ".server")
                .field("user", FieldValue.ofText("u" + cpus))
                .field("numcpus", FieldValue.ofInteger(Long.toString(cpus), cpus))
                .field("elapsed", FieldValue.ofDuration(Long.toString(seconds), Duration.ofSeconds(seconds)))
                .field("memory", FieldValue.ofMemory(gigabytes + "gb", gigabytes << 30))
                .build();
    }
}

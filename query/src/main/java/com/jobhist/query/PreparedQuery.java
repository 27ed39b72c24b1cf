package com.jobhist.query;

import com.jobhist.filter.CompiledFilter;
import com.jobhist.format.Aggregator;
import com.jobhist.format.ColumnSpec;
import com.jobhist.format.FormatOptions;
import com.jobhist.format.OutputFormatter;
import com.jobhist.format.OutputMode;
import com.jobhist.record.Record;
import com.jobhist.stream.LogFileSequencer;
import com.jobhist.stream.RecordStream;
import com.jobhist.stream.window.DateWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.List;
import java.util.Set;

/**
 * A validated query, ready to stream.
 *
 * <p>Records flow one at a time from the file sequencer through the filter
 * to the formatter (and the aggregator, when averaging). None are
 * buffered. The files are closed on every exit path.</p>
 */
public class PreparedQuery {

    private static final Logger log = LoggerFactory.getLogger(PreparedQuery.class);

    private final DateWindow window;
    private final CompiledFilter filter;
    private final List<ColumnSpec> columns;
    private final OutputMode mode;
    private final FormatOptions formatOptions;
    private final boolean aggregate;
    private final LogFileSequencer sequencer;
    private final CountingDiagnostics diagnostics;

    PreparedQuery(DateWindow window, CompiledFilter filter, List<ColumnSpec> columns, OutputMode mode,
                  FormatOptions formatOptions, boolean aggregate, LogFileSequencer sequencer,
                  CountingDiagnostics diagnostics) {
        this.window = window;
        this.filter = filter;
        this.columns = columns;
        this.mode = mode;
        this.formatOptions = formatOptions;
        this.aggregate = aggregate;
        this.sequencer = sequencer;
        this.diagnostics = diagnostics;
    }

    public DateWindow getWindow() {
        return window;
    }

    public CompiledFilter getFilter() {
        return filter;
    }

    public List<ColumnSpec> getColumns() {
        return columns;
    }

    /**
     * Stream the matching records to {@code out}.
     *
     * @throws java.io.UncheckedIOException if a log file cannot be read
     */
    public QueryResult run(PrintWriter out) {
        OutputFormatter formatter = OutputFormatter.create(mode, out, columns, formatOptions);
        Aggregator aggregator = aggregate ? new Aggregator(columns) : null;
        Set<String> tags = filter.pushDownTypes();
        long diagnosticsBefore = diagnostics.getCount();
        long read = 0;
        long matched = 0;

        formatter.writeHeader();
        try (RecordStream records = sequencer.open(window, tags)) {
            while (records.hasNext()) {
                Record record = records.next();
                read++;
                if (!filter.test(record)) {
                    continue;
                }
                matched++;
                if (aggregator != null) {
                    aggregator.accept(record);
                }
                formatter.writeRecord(record);
            }
        }
        formatter.writeFooter(aggregator != null ? aggregator.summary() : null);

        QueryResult result = new QueryResult(window, read, matched, diagnostics.getCount() - diagnosticsBefore);
        log.debug("Query complete: {}", result);
        return result;
    }
}

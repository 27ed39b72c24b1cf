package com.jobhist.query;

import com.jobhist.config.ClockProvider;
import com.jobhist.filter.CompiledFilter;
import com.jobhist.filter.FilterCompiler;
import com.jobhist.format.ColumnSpec;
import com.jobhist.record.Diagnostics;
import com.jobhist.record.FieldCatalog;
import com.jobhist.record.FieldCoercer;
import com.jobhist.record.LogLineDecoder;
import com.jobhist.stream.LogFileSequencer;
import com.jobhist.stream.window.DateWindow;
import com.jobhist.stream.window.WindowResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point for history queries.
 *
 * <p>A query runs in two phases. {@link #prepare(QueryRequest)} does all the
 * validation: it resolves the date window, compiles the filter and parses
 * the column list, so a bad window, an unknown field, an unreadable literal
 * or an unsupported display specifier fails before anything is read or
 * written. {@link PreparedQuery#run(java.io.PrintWriter)} then streams the
 * records.</p>
 *
 * <pre>{@code
 * HistoryQuery query = new HistoryQuery(FieldCatalog.pbs(), ClockProvider.system(), new LoggingDiagnostics());
 * QueryResult result = query.prepare(request).run(out);
 * }</pre>
 */
public class HistoryQuery {

    private static final Logger log = LoggerFactory.getLogger(HistoryQuery.class);

    private final FieldCatalog catalog;
    private final ClockProvider clockProvider;
    private final Diagnostics diagnostics;

    /**
     * @param catalog       known fields
     * @param clockProvider source of "today" and of the zone used to read log timestamps
     * @param diagnostics   receives non-fatal problems found while reading
     */
    public HistoryQuery(FieldCatalog catalog, ClockProvider clockProvider, Diagnostics diagnostics) {
        this.catalog = catalog;
        this.clockProvider = clockProvider;
        this.diagnostics = diagnostics;
    }

    /**
     * Validate a request and set up its pipeline.
     *
     * @throws com.jobhist.stream.window.InvalidWindowException if the window is invalid
     * @throws com.jobhist.record.UnknownFieldException if the filter or column list names an unknown field
     * @throws com.jobhist.filter.InvalidFilterException if a filter clause is malformed
     * @throws com.jobhist.filter.InvalidLiteralException if a filter literal does not fit its field
     * @throws com.jobhist.format.UnsupportedFormatSpecifierException if a display specifier is invalid
     */
    public PreparedQuery prepare(QueryRequest request) {
        DateWindow window = new WindowResolver(clockProvider).resolve(request.getWindow());

        FieldCoercer coercer = new FieldCoercer(clockProvider.getZone());
        CompiledFilter filter = new FilterCompiler(catalog, coercer).compile(request.getFilter());
        List<ColumnSpec> columns = ColumnSpec.parseList(request.getFields(), catalog);

        CountingDiagnostics counting = new CountingDiagnostics(diagnostics);
        LogFileSequencer sequencer = new LogFileSequencer(request.getLayout(),
                new LogLineDecoder(catalog, coercer), counting, request.getBlockSize());

        log.debug("Prepared query: window={}, filter='{}', columns={}, mode={}",
                window, filter, columns, request.getMode());
        return new PreparedQuery(window, filter, columns, request.getMode(), request.getFormatOptions(),
                request.isAggregate(), sequencer, counting);
    }
}

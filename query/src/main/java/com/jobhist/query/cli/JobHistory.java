package com.jobhist.query.cli;

import com.jobhist.config.ClockProvider;
import com.jobhist.config.ConfigLoader;
import com.jobhist.filter.FilterCompiler;
import com.jobhist.format.FormatOptions;
import com.jobhist.format.OutputConfig;
import com.jobhist.format.OutputMode;
import com.jobhist.query.HistoryQuery;
import com.jobhist.query.QueryConfig;
import com.jobhist.query.QueryRequest;
import com.jobhist.query.QueryResult;
import com.jobhist.record.FieldCatalog;
import com.jobhist.record.FieldDefinition;
import com.jobhist.record.JobHistoryException;
import com.jobhist.record.LoggingDiagnostics;
import com.jobhist.stream.LogFileLayout;
import com.jobhist.stream.StreamConfig;
import com.jobhist.stream.window.ReadDirection;
import com.jobhist.stream.window.WindowIntent;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line front end for job history queries.
 *
 * <p>Translates options into a {@link QueryRequest}, runs it, and writes the
 * records to standard output. Diagnostics and errors go to standard error.</p>
 *
 * <h2>Usage Examples</h2>
 * <pre>
 * # Finished jobs of today
 * jobhist
 *
 * # Finished jobs of the last week for one user, newest first
 * jobhist -d 7 -u alice -r
 *
 * # Every record of a job over a fixed period
 * jobhist -p 20250201-20250228 -j 4711 -t all -l
 *
 * # Large jobs as CSV with chosen columns
 * jobhist -d 30 -f "numcpus&gt;=128" --csv -o id,user,numcpus,elapsed:h
 *
 * # Average resource use of a queue
 * jobhist -d 30 -q gpu -a
 *
 * # List the queryable fields
 * jobhist --list-fields
 * </pre>
 *
 * <p>Exit codes: 0 on success, 1 when the query fails, 2 on a usage error.</p>
 */
@Command(name = "jobhist",
        mixinStandardHelpOptions = true,
        version = "jobhist 1.0",
        sortOptions = false,
        description = "Query job records in PBS accounting logs.")
public class JobHistory implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(JobHistory.class);

    /**
     * Type value that disables the record type filter.
     */
    static final String ALL_TYPES = "all";

    /**
     * Record type selected when neither {@code -t} nor a filter names one.
     */
    static final String DEFAULT_TYPE = "E";

    @Spec
    private CommandSpec spec;

    private final ClockProvider clockOverride;

    // ==================== Source ====================

    @Option(names = {"--log-dir"}, paramLabel = "DIR", description = "Accounting log directory (default: from configuration)")
    Path logDir;

    @Option(names = {"-c", "--config"}, paramLabel = "FILE", description = "Additional configuration file (repeatable)")
    List<String> configFiles = new ArrayList<>();

    // ==================== Window ====================

    private LocalDate periodStart;
    private LocalDate periodEnd;
    private LocalDate anchor;

    @Option(names = {"-d", "--days"}, paramLabel = "N", description = "Days before the anchor day to include")
    Integer days;

    @Option(names = {"-r", "--reverse"}, description = "Newest records first")
    boolean reverse;

    // ==================== Selection ====================

    @Option(names = {"-f", "--filter"}, paramLabel = "EXPR",
            description = {"Filter clauses, e.g. \"numcpus>1;user==alice\" (repeatable)",
                    "Timestamps take yyyyMMdd, yyyy-MM-dd[THH:mm[:ss]] or epoch seconds"})
    List<String> filters = new ArrayList<>();

    @Option(names = {"-u", "--user"}, description = "Only jobs of this user")
    String user;

    @Option(names = {"-q", "--queue"}, description = "Only jobs of this queue")
    String queue;

    @Option(names = {"-j", "--job"}, paramLabel = "ID", description = "Only this job (full or numeric id)")
    String job;

    @Option(names = {"-t", "--type"}, paramLabel = "TAG",
            description = "Record type tag, or 'all' (default: E unless a filter tests record_type)")
    String type;

    // ==================== Output ====================

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    ModeOptions modeOptions;

    @Option(names = {"-o", "--format"}, paramLabel = "FIELDS",
            description = "Columns as field[:[-][width][.precision][style]],...")
    String fields;

    @Option(names = {"-a", "--average"}, description = "Append the averages of the numeric columns")
    boolean average;

    @Option(names = {"--no-header"}, description = "Omit the header row")
    boolean noHeader;

    @Option(names = {"--list-fields"}, description = "List the queryable fields and exit")
    boolean listFields;

    static class ModeOptions {
        @Option(names = {"-l", "--long"}, description = "One labeled block per record")
        boolean longForm;

        @Option(names = {"--csv"}, description = "Comma separated values")
        boolean csv;

        @Option(names = {"--json"}, description = "A JSON document")
        boolean json;

        OutputMode mode() {
            if (longForm) return OutputMode.LONG;
            if (csv) return OutputMode.CSV;
            return OutputMode.JSON;
        }
    }

    public JobHistory() {
        this(null);
    }

    /**
     * @param clockProvider clock to use instead of the configured one, or {@code null}
     */
    public JobHistory(ClockProvider clockProvider) {
        this.clockOverride = clockProvider;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JobHistory())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }

    @Option(names = {"-p", "--period"}, paramLabel = "yyyyMMdd[-yyyyMMdd]",
            description = "Explicit range of days, inclusive")
    void setPeriod(String period) {
        int dash = period.indexOf('-');
        if (dash < 0) {
            periodStart = parseDay(period, "--period");
            periodEnd = periodStart;
        } else {
            periodStart = parseDay(period.substring(0, dash), "--period");
            periodEnd = parseDay(period.substring(dash + 1), "--period");
        }
    }

    @Option(names = {"--anchor"}, paramLabel = "yyyyMMdd", description = "Last day of the window (default: today)")
    void setAnchor(String day) {
        anchor = parseDay(day, "--anchor");
    }

    private LocalDate parseDay(String text, String option) {
        try {
            return LocalDate.parse(text.trim(), DateTimeFormatter.BASIC_ISO_DATE);
        } catch (DateTimeParseException e) {
            throw new ParameterException(spec.commandLine(),
                    "Invalid date for " + option + ": '" + text + "' (expected yyyyMMdd)");
        }
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (listFields) {
            printFields(out, FieldCatalog.pbs());
            return 0;
        }
        if (periodStart != null && (days != null || anchor != null)) {
            throw new ParameterException(spec.commandLine(), "--period cannot be combined with --days or --anchor");
        }

        ClockProvider clockProvider;
        QueryRequest request;
        try {
            Config config = ConfigLoader.load(configFiles).getConfig(ConfigLoader.ROOT);
            clockProvider = clockOverride != null ? clockOverride : ClockProvider.fromConfig(config);
            // typed settings validate here so bad values report like a missing file
            request = buildRequest(config);
        } catch (ConfigException | IllegalArgumentException | DateTimeException e) {
            err.println("Error: Cannot load configuration: " + e.getMessage());
            return 1;
        }

        try {
            log.debug("Running {}", request);
            QueryResult result = new HistoryQuery(FieldCatalog.pbs(), clockProvider, new LoggingDiagnostics())
                    .prepare(request)
                    .run(out);
            log.debug("{}", result);
            return 0;
        } catch (JobHistoryException | UncheckedIOException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    QueryRequest buildRequest(Config config) {
        StreamConfig streamConfig = StreamConfig.fromConfig(config.getConfig("stream"));
        OutputConfig outputConfig = OutputConfig.fromConfig(config.getConfig("output"));
        QueryConfig queryConfig = QueryConfig.fromConfig(config.getConfig("query"));

        LogFileLayout layout = logDir != null
                ? new LogFileLayout(logDir, streamConfig.getFilePattern())
                : LogFileLayout.fromConfig(streamConfig);
        OutputMode mode = modeOptions != null ? modeOptions.mode() : outputConfig.getMode();

        return QueryRequest.builder()
                .layout(layout)
                .blockSize(streamConfig.getBlockSize())
                .window(buildWindow(queryConfig))
                .filter(buildFilter())
                .mode(mode)
                .fields(fields != null ? fields : outputConfig.getFields(mode))
                .aggregate(average)
                .formatOptions(new FormatOptions(outputConfig.isHeader() && !noHeader, outputConfig.isPrettyJson()))
                .build();
    }

    WindowIntent buildWindow(QueryConfig queryConfig) {
        WindowIntent.Builder window = WindowIntent.builder()
                .direction(reverse ? ReadDirection.REVERSE : ReadDirection.FORWARD);
        if (periodStart != null) {
            return window.range(periodStart, periodEnd).build();
        }
        return window.anchor(anchor)
                .daysBack(days != null ? days : queryConfig.getDefaultDays())
                .build();
    }

    /**
     * Joins the free-form filters and the shorthand options into one filter text.
     */
    String buildFilter() {
        List<String> clauses = new ArrayList<>(filters);
        if (user != null) {
            clauses.add(FilterCompiler.equalsClause("user", user));
        }
        if (queue != null) {
            clauses.add(FilterCompiler.equalsClause("queue", queue));
        }
        if (job != null) {
            // a bare number names the job on any server
            clauses.add(FilterCompiler.equalsClause(job.indexOf('.') >= 0 ? FieldCatalog.ID : FieldCatalog.SHORT_ID, job));
        }
        String tag = type != null ? type.trim() : filtersTestRecordType() ? null : DEFAULT_TYPE;
        if (tag != null && !tag.isEmpty() && !ALL_TYPES.equalsIgnoreCase(tag)) {
            clauses.add(FilterCompiler.equalsClause(FieldCatalog.RECORD_TYPE, tag));
        }
        return String.join(";", clauses);
    }

    private boolean filtersTestRecordType() {
        return filters.stream()
                .flatMap(filter -> FilterCompiler.fieldNames(filter).stream())
                .anyMatch(FieldCatalog.RECORD_TYPE::equals);
    }

    static void printFields(PrintWriter out, FieldCatalog catalog) {
        out.println("Queryable Fields");
        out.println("================");
        out.println();
        out.printf("%-12s %-10s %-28s %s%n", "Field", "Kind", "Logged As", "Description");
        out.println("-".repeat(80));
        for (FieldDefinition def : catalog.definitions()) {
            out.printf("%-12s %-10s %-28s %s%n", def.name(), def.kind(),
                    def.logKey() != null ? def.logKey() : "(line header)", def.label());
        }
        out.println();
        out.printf("Total: %d fields%n", catalog.definitions().size());
        out.flush();
    }
}

package com.jobhist.format;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobhist.record.FieldValue;
import com.jobhist.record.Record;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.StringJoiner;

/**
 * Writes records to the data output, one at a time.
 *
 * <p>Call {@link #writeHeader()} once, {@link #writeRecord(Record)} per
 * record, then {@link #writeFooter(AggregateSummary)} once. Nothing is
 * buffered beyond the record being written.</p>
 *
 * <pre>{@code
 * OutputFormatter formatter = OutputFormatter.create(OutputMode.CSV, out, columns, FormatOptions.defaults());
 * formatter.writeHeader();
 * records.forEachRemaining(formatter::writeRecord);
 * formatter.writeFooter(null);
 * }</pre>
 */
public abstract class OutputFormatter {

    protected final PrintWriter out;
    protected final List<ColumnSpec> columns;
    protected final FormatOptions options;
    protected long count;

    protected OutputFormatter(PrintWriter out, List<ColumnSpec> columns, FormatOptions options) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("At least one column is required");
        }
        this.out = out;
        this.columns = List.copyOf(columns);
        this.options = options;
    }

    /**
     * Write the header (if any).
     */
    public abstract void writeHeader();

    /**
     * Write a single record.
     */
    public abstract void writeRecord(Record record);

    /**
     * Write the footer and flush.
     *
     * @param summary averages to report, or {@code null} when not aggregating
     */
    public abstract void writeFooter(AggregateSummary summary);

    /**
     * Number of records written so far.
     */
    public long getCount() {
        return count;
    }

    public List<ColumnSpec> getColumns() {
        return columns;
    }

    // ==================== Factory Methods ====================

    public static OutputFormatter create(OutputMode mode, PrintWriter out, List<ColumnSpec> columns,
                                         FormatOptions options) {
        return switch (mode) {
            case TABULAR -> tabular(out, columns, options);
            case LONG -> longForm(out, columns, options);
            case CSV -> csv(out, columns, options);
            case JSON -> json(out, columns, options);
        };
    }

    public static OutputFormatter tabular(PrintWriter out, List<ColumnSpec> columns, FormatOptions options) {
        return new TabularFormatter(out, columns, options);
    }

    public static OutputFormatter longForm(PrintWriter out, List<ColumnSpec> columns, FormatOptions options) {
        return new LongFormatter(out, columns, options);
    }

    public static OutputFormatter csv(PrintWriter out, List<ColumnSpec> columns, FormatOptions options) {
        return new CsvFormatter(out, columns, options);
    }

    public static OutputFormatter json(PrintWriter out, List<ColumnSpec> columns, FormatOptions options) {
        return new JsonFormatter(out, columns, options);
    }

    // ==================== Tabular Formatter ====================

    private static class TabularFormatter extends OutputFormatter {

        TabularFormatter(PrintWriter out, List<ColumnSpec> columns, FormatOptions options) {
            super(out, columns, options);
        }

        @Override
        public void writeHeader() {
            if (!options.header()) {
                return;
            }
            StringJoiner headers = new StringJoiner(" ");
            StringJoiner rules = new StringJoiner(" ");
            for (ColumnSpec column : columns) {
                headers.add(ValueRenderer.fit(column.getField().header(), column.getWidth(), column.isRightAligned()));
                rules.add("-".repeat(column.getWidth()));
            }
            out.println(headers.toString().stripTrailing());
            out.println(rules);
        }

        @Override
        public void writeRecord(Record record) {
            count++;
            StringJoiner row = new StringJoiner(" ");
            for (ColumnSpec column : columns) {
                String text = ValueRenderer.render(column, record.get(column.getName()));
                row.add(ValueRenderer.fit(text == null ? "-" : text, column.getWidth(), column.isRightAligned()));
            }
            out.println(row.toString().stripTrailing());
        }

        @Override
        public void writeFooter(AggregateSummary summary) {
            if (summary != null) {
                out.println(summary.describe());
            }
            out.flush();
        }
    }

    // ==================== Long Formatter ====================

    private static class LongFormatter extends OutputFormatter {
        private final int labelWidth;

        LongFormatter(PrintWriter out, List<ColumnSpec> columns, FormatOptions options) {
            super(out, columns, options);
            int width = 0;
            for (ColumnSpec column : columns) {
                width = Math.max(width, column.getField().label().length());
            }
            this.labelWidth = width;
        }

        @Override
        public void writeHeader() {
            // Each record carries its own labels
        }

        @Override
        public void writeRecord(Record record) {
            if (count > 0) {
                out.println();
            }
            count++;
            for (ColumnSpec column : columns) {
                String text = ValueRenderer.render(column, record.get(column.getName()));
                out.printf("%-" + labelWidth + "s : %s%n", column.getField().label(), text == null ? "-" : text);
            }
        }

        @Override
        public void writeFooter(AggregateSummary summary) {
            if (summary != null) {
                if (count > 0) {
                    out.println();
                }
                out.println(summary.describe());
            }
            out.flush();
        }
    }

    // ==================== CSV Formatter ====================

    private static class CsvFormatter extends OutputFormatter {

        CsvFormatter(PrintWriter out, List<ColumnSpec> columns, FormatOptions options) {
            super(out, columns, options);
        }

        @Override
        public void writeHeader() {
            if (!options.header()) {
                return;
            }
            StringJoiner row = new StringJoiner(",");
            for (ColumnSpec column : columns) {
                row.add(csvEscape(column.getName()));
            }
            out.println(row);
        }

        @Override
        public void writeRecord(Record record) {
            count++;
            StringJoiner row = new StringJoiner(",");
            for (ColumnSpec column : columns) {
                row.add(csvEscape(ValueRenderer.render(column, record.get(column.getName()))));
            }
            out.println(row);
        }

        @Override
        public void writeFooter(AggregateSummary summary) {
            if (summary != null) {
                out.println("# " + summary.describe());
            }
            out.flush();
        }

        static String csvEscape(String value) {
            if (value == null) return "";
            if (value.indexOf(',') >= 0 || value.indexOf('"') >= 0
                    || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
                return "\"" + value.replace("\"", "\"\"") + "\"";
            }
            return value;
        }
    }

    // ==================== JSON Formatter ====================

    private static class JsonFormatter extends OutputFormatter {
        private static final ObjectMapper MAPPER = new ObjectMapper();

        private final JsonGenerator generator;
        private boolean started;

        JsonFormatter(PrintWriter out, List<ColumnSpec> columns, FormatOptions options) {
            super(out, columns, options);
            try {
                this.generator = MAPPER.getFactory().createGenerator(out)
                        .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to create JSON generator", e);
            }
            if (options.prettyJson()) {
                generator.useDefaultPrettyPrinter();
            }
        }

        @Override
        public void writeHeader() {
            try {
                start();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        @Override
        public void writeRecord(Record record) {
            try {
                start();
                count++;
                generator.writeStartObject();
                for (ColumnSpec column : columns) {
                    generator.writeFieldName(column.getName());
                    writeValue(column, record.get(column.getName()));
                }
                generator.writeEndObject();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        @Override
        public void writeFooter(AggregateSummary summary) {
            try {
                start();
                generator.writeEndArray();
                generator.writeNumberField("count", count);
                if (summary != null) {
                    generator.writeObjectFieldStart("summary");
                    generator.writeNumberField("records", summary.recordCount());
                    generator.writeObjectFieldStart("averages");
                    for (AggregateSummary.ColumnAverage average : summary.averages()) {
                        String name = average.column().getName();
                        if (!average.hasValue()) {
                            generator.writeNullField(name);
                        } else if (average.column().hasStyle()) {
                            generator.writeStringField(name, average.rendered());
                        } else {
                            generator.writeNumberField(name, average.average());
                        }
                    }
                    generator.writeEndObject();
                    generator.writeEndObject();
                }
                generator.writeEndObject();
                generator.flush();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            out.println();
            out.flush();
        }

        private void start() throws IOException {
            if (!started) {
                started = true;
                generator.writeStartObject();
                generator.writeArrayFieldStart("jobs");
            }
        }

        /**
         * Typed value: numbers, seconds for durations, bytes for memory, ISO-8601
         * timestamps. A styled column or an unreadable value is written as text.
         */
        private void writeValue(ColumnSpec column, FieldValue value) throws IOException {
            if (value == null) {
                generator.writeNull();
            } else if (!value.isCoerced() || value.kind() != column.getField().kind() || column.hasStyle()) {
                generator.writeString(ValueRenderer.render(column, value));
            } else {
                switch (value.kind()) {
                    case INTEGER -> generator.writeNumber(value.asLong());
                    case FLOAT -> generator.writeNumber(value.asDouble());
                    case DURATION -> generator.writeNumber(value.asDuration().getSeconds());
                    case MEMORY -> generator.writeNumber(value.asBytes());
                    case TIMESTAMP -> generator.writeString(DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(value.asTimestamp()));
                    case TEXT -> generator.writeString(value.asText());
                }
            }
        }
    }
}

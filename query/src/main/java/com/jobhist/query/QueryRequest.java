package com.jobhist.query;

import com.jobhist.format.FormatOptions;
import com.jobhist.format.OutputMode;
import com.jobhist.stream.LogFileLayout;
import com.jobhist.stream.window.WindowIntent;

import java.util.Objects;

/**
 * Everything one history query needs: where the logs are, which days to
 * read in which order, which records to keep and how to write them.
 *
 * <pre>{@code
 * QueryRequest request = QueryRequest.builder()
 *         .layout(new LogFileLayout(Path.of("/var/spool/pbs/server_priv/accounting")))
 *         .window(WindowIntent.builder().daysBack(3).build())
 *         .filter("record_type==E;numcpus>1")
 *         .mode(OutputMode.CSV)
 *         .fields("id,user,numcpus,elapsed")
 *         .build();
 * }</pre>
 */
public final class QueryRequest {

    private final LogFileLayout layout;
    private final int blockSize;
    private final WindowIntent window;
    private final String filter;
    private final OutputMode mode;
    private final String fields;
    private final boolean aggregate;
    private final FormatOptions formatOptions;

    private QueryRequest(Builder builder) {
        this.layout = Objects.requireNonNull(builder.layout, "layout");
        this.blockSize = builder.blockSize;
        this.window = builder.window;
        this.filter = builder.filter;
        this.mode = builder.mode;
        this.fields = Objects.requireNonNull(builder.fields, "fields");
        this.aggregate = builder.aggregate;
        this.formatOptions = builder.formatOptions;
    }

    public LogFileLayout getLayout() {
        return layout;
    }

    public int getBlockSize() {
        return blockSize;
    }

    public WindowIntent getWindow() {
        return window;
    }

    /**
     * @return the filter text, empty to keep every record
     */
    public String getFilter() {
        return filter;
    }

    public OutputMode getMode() {
        return mode;
    }

    /**
     * @return the {@code field[:spec],...} column list
     */
    public String getFields() {
        return fields;
    }

    public boolean isAggregate() {
        return aggregate;
    }

    public FormatOptions getFormatOptions() {
        return formatOptions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private LogFileLayout layout;
        private int blockSize = 64 * 1024;
        private WindowIntent window = WindowIntent.today();
        private String filter = "";
        private OutputMode mode = OutputMode.TABULAR;
        private String fields;
        private boolean aggregate;
        private FormatOptions formatOptions = FormatOptions.defaults();

        private Builder() {}

        public Builder layout(LogFileLayout layout) {
            this.layout = layout;
            return this;
        }

        public Builder blockSize(int blockSize) {
            if (blockSize <= 0) {
                throw new IllegalArgumentException("blockSize must be positive: " + blockSize);
            }
            this.blockSize = blockSize;
            return this;
        }

        public Builder window(WindowIntent window) {
            this.window = Objects.requireNonNull(window, "window");
            return this;
        }

        public Builder filter(String filter) {
            this.filter = filter == null ? "" : filter;
            return this;
        }

        public Builder mode(OutputMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public Builder fields(String fields) {
            this.fields = fields;
            return this;
        }

        public Builder aggregate(boolean aggregate) {
            this.aggregate = aggregate;
            return this;
        }

        public Builder formatOptions(FormatOptions formatOptions) {
            this.formatOptions = Objects.requireNonNull(formatOptions, "formatOptions");
            return this;
        }

        public QueryRequest build() {
            return new QueryRequest(this);
        }
    }

    @Override
    public String toString() {
        return "QueryRequest{" +
                "layout=" + layout +
                ", window=" + window +
                ", filter='" + filter + '\'' +
                ", mode=" + mode +
                ", fields='" + fields + '\'' +
                ", aggregate=" + aggregate +
                '}';
    }
}

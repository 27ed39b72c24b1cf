package com.jobhist.format;

import com.typesafe.config.Config;

import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration for the data output (the {@code jobhist.output} section):
 * default mode, default field list per mode, and formatter switches.
 */
public final class OutputConfig {

    private final OutputMode mode;
    private final Map<OutputMode, String> fields;
    private final boolean header;
    private final boolean prettyJson;

    private OutputConfig(Builder builder) {
        this.mode = builder.mode;
        this.fields = new EnumMap<>(builder.fields);
        this.header = builder.header;
        this.prettyJson = builder.prettyJson;
    }

    /**
     * Create configuration from Typesafe Config.
     *
     * @param config the {@code jobhist.output} section
     */
    public static OutputConfig fromConfig(Config config) {
        Builder builder = builder()
                .mode(OutputMode.parse(config.getString("mode")))
                .header(config.getBoolean("header"))
                .prettyJson(config.getBoolean("pretty-json"));
        Config fields = config.getConfig("fields");
        for (OutputMode mode : OutputMode.values()) {
            if (fields.hasPath(mode.configKey())) {
                builder.fields(mode, fields.getString(mode.configKey()));
            }
        }
        return builder.build();
    }

    public OutputMode getMode() {
        return mode;
    }

    /**
     * Default {@code field[:spec]} list for a mode.
     */
    public String getFields(OutputMode mode) {
        return fields.get(mode);
    }

    public boolean isHeader() {
        return header;
    }

    public boolean isPrettyJson() {
        return prettyJson;
    }

    public FormatOptions toFormatOptions() {
        return new FormatOptions(header, prettyJson);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private static final String LONG_FIELDS = "id,record_type,user,account,queue,jobname,numnodes,numcpus,"
                + "numgpus,reqmem,memory,walltime,elapsed,cputime,submit,start,end,status";

        private OutputMode mode = OutputMode.TABULAR;
        private final Map<OutputMode, String> fields = new EnumMap<>(OutputMode.class);
        private boolean header = true;
        private boolean prettyJson = false;

        private Builder() {
            fields.put(OutputMode.TABULAR, "short_id,user,queue,numnodes,numcpus,memory,elapsed:t,end");
            fields.put(OutputMode.LONG, LONG_FIELDS);
            fields.put(OutputMode.CSV, LONG_FIELDS);
            fields.put(OutputMode.JSON, LONG_FIELDS);
        }

        public Builder mode(OutputMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder fields(OutputMode mode, String fieldList) {
            this.fields.put(mode, fieldList);
            return this;
        }

        public Builder header(boolean header) {
            this.header = header;
            return this;
        }

        public Builder prettyJson(boolean prettyJson) {
            this.prettyJson = prettyJson;
            return this;
        }

        public OutputConfig build() {
            return new OutputConfig(this);
        }
    }

    @Override
    public String toString() {
        return "OutputConfig{" +
                "mode=" + mode +
                ", fields=" + fields +
                ", header=" + header +
                ", prettyJson=" + prettyJson +
                '}';
    }
}

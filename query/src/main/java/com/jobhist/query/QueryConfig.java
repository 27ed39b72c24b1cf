package com.jobhist.query;

import com.typesafe.config.Config;

/**
 * Query defaults (the {@code jobhist.query} section).
 */
public final class QueryConfig {

    private final int defaultDays;

    private QueryConfig(Builder builder) {
        this.defaultDays = builder.defaultDays;
    }

    /**
     * Create configuration from Typesafe Config.
     *
     * @param config the {@code jobhist.query} section
     */
    public static QueryConfig fromConfig(Config config) {
        return builder()
                .defaultDays(config.getInt("default-days"))
                .build();
    }

    /**
     * Days before the anchor to read when a query names neither a period nor a day count.
     */
    public int getDefaultDays() {
        return defaultDays;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int defaultDays = 0;

        private Builder() {}

        public Builder defaultDays(int defaultDays) {
            if (defaultDays < 0) {
                throw new IllegalArgumentException("default-days must not be negative: " + defaultDays);
            }
            this.defaultDays = defaultDays;
            return this;
        }

        public QueryConfig build() {
            return new QueryConfig(this);
        }
    }

    @Override
    public String toString() {
        return "QueryConfig{defaultDays=" + defaultDays + '}';
    }
}

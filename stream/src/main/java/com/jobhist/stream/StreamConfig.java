package com.jobhist.stream;

import com.typesafe.config.Config;

import java.nio.file.Path;

/**
 * Configuration for locating and reading accounting log files
 * (the {@code jobhist.stream} section).
 */
public final class StreamConfig {

    private final Path logDir;
    private final String filePattern;
    private final int blockSize;

    private StreamConfig(Builder builder) {
        this.logDir = builder.logDir;
        this.filePattern = builder.filePattern;
        this.blockSize = builder.blockSize;
    }

    /**
     * Create configuration from Typesafe Config.
     *
     * @param config the {@code jobhist.stream} section
     */
    public static StreamConfig fromConfig(Config config) {
        long blockSize = config.getBytes("block-size");
        if (blockSize <= 0 || blockSize > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("block-size out of range: " + blockSize);
        }
        return builder()
                .logDir(Path.of(config.getString("log-dir")))
                .filePattern(config.getString("file-pattern"))
                .blockSize((int) blockSize)
                .build();
    }

    public Path getLogDir() {
        return logDir;
    }

    public String getFilePattern() {
        return filePattern;
    }

    public int getBlockSize() {
        return blockSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path logDir = Path.of("/var/spool/pbs/server_priv/accounting");
        private String filePattern = LogFileLayout.DEFAULT_PATTERN;
        private int blockSize = 64 * 1024;

        private Builder() {}

        public Builder logDir(Path logDir) {
            this.logDir = logDir;
            return this;
        }

        public Builder filePattern(String filePattern) {
            this.filePattern = filePattern;
            return this;
        }

        public Builder blockSize(int blockSize) {
            if (blockSize <= 0) {
                throw new IllegalArgumentException("blockSize must be positive: " + blockSize);
            }
            this.blockSize = blockSize;
            return this;
        }

        public StreamConfig build() {
            return new StreamConfig(this);
        }
    }

    @Override
    public String toString() {
        return "StreamConfig{" +
                "logDir=" + logDir +
                ", filePattern='" + filePattern + '\'' +
                ", blockSize=" + blockSize +
                '}';
    }
}

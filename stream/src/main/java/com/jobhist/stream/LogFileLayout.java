package com.jobhist.stream;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Maps a calendar day to its accounting log file: one file per day directly
 * under a root directory, named by a date pattern ({@code yyyyMMdd} by default,
 * e.g. {@code /var/spool/pbs/server_priv/accounting/20250301}).
 */
public final class LogFileLayout {

    public static final String DEFAULT_PATTERN = "yyyyMMdd";

    private final Path root;
    private final String pattern;
    private final DateTimeFormatter formatter;

    public LogFileLayout(Path root) {
        this(root, DEFAULT_PATTERN);
    }

    /**
     * @param root    directory holding the daily files
     * @param pattern {@link DateTimeFormatter} pattern of the file names
     * @throws IllegalArgumentException if the pattern is invalid
     */
    public LogFileLayout(Path root, String pattern) {
        this.root = Objects.requireNonNull(root, "root");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.formatter = DateTimeFormatter.ofPattern(pattern);
    }

    public static LogFileLayout fromConfig(StreamConfig config) {
        return new LogFileLayout(config.getLogDir(), config.getFilePattern());
    }

    /**
     * The file for a day. Existence is not checked.
     */
    public LogFileRef fileFor(LocalDate date) {
        return new LogFileRef(root.resolve(formatter.format(date)), date);
    }

    public Path getRoot() {
        return root;
    }

    public String getPattern() {
        return pattern;
    }

    @Override
    public String toString() {
        return "LogFileLayout{root=" + root + ", pattern='" + pattern + "'}";
    }
}

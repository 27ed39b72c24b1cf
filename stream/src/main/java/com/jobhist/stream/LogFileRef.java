package com.jobhist.stream;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Objects;

/**
 * The log file expected to hold one day's records. The file may not exist;
 * that is discovered when it is opened.
 */
public record LogFileRef(Path path, LocalDate date) {

    public LogFileRef {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(date, "date");
    }

    @Override
    public String toString() {
        return path + " (" + date + ")";
    }
}

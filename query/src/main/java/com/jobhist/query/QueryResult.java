package com.jobhist.query;

import com.jobhist.stream.window.DateWindow;

/**
 * Counters of one completed query.
 *
 * @param window         the days that were read
 * @param recordsRead    records decoded and offered to the filter
 * @param recordsMatched records written to the output
 * @param diagnostics    non-fatal problems reported while reading
 */
public record QueryResult(DateWindow window, long recordsRead, long recordsMatched, long diagnostics) {

    @Override
    public String toString() {
        return "QueryResult{window=" + window + ", read=" + recordsRead + ", matched=" + recordsMatched
                + ", diagnostics=" + diagnostics + '}';
    }
}

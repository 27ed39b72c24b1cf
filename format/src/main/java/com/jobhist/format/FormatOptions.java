package com.jobhist.format;

/**
 * Formatter switches that do not depend on the output mode.
 *
 * @param header     write the header row (tabular and csv)
 * @param prettyJson indent json output
 */
public record FormatOptions(boolean header, boolean prettyJson) {

    public static FormatOptions defaults() {
        return new FormatOptions(true, false);
    }

    public FormatOptions withHeader(boolean header) {
        return new FormatOptions(header, prettyJson);
    }
}

package com.jobhist.stream;

import java.io.Closeable;
import java.io.IOException;

/**
 * A single-pass source of text lines from one file.
 *
 * <p>Lines are split on {@code \n}; one trailing {@code \r} is removed and
 * bytes are decoded as UTF-8. A final {@code \n} at the end of the file ends
 * the last line and does not produce an extra empty line.</p>
 */
public interface LineSource extends Closeable {

    /**
     * Read the next line.
     *
     * @return the line without its terminator, or {@code null} when exhausted
     */
    String readLine() throws IOException;

    /**
     * Byte offset in the file of the first byte of the line last returned,
     * or {@code -1} before the first line.
     */
    long lineOffset();
}

package com.jobhist.stream;

import com.jobhist.record.Record;

import java.io.Closeable;
import java.util.Iterator;

/**
 * A lazy, single-pass sequence of records that owns at most one open file.
 *
 * <p>Records are produced one at a time as the caller pulls them. The stream
 * releases its file when exhausted, when closed, and when reading fails.
 * A caller that stops early must call {@link #close()}; closing twice is
 * harmless.</p>
 *
 * <pre>{@code
 * try (RecordStream records = sequencer.open(window, Set.of("E"))) {
 *     while (records.hasNext()) {
 *         Record record = records.next();
 *         ...
 *     }
 * }
 * }</pre>
 */
public interface RecordStream extends Iterator<Record>, Closeable {

    /**
     * Release the open file, if any. Further calls to {@link #hasNext()} return {@code false}.
     */
    @Override
    void close();

}

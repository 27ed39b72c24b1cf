package com.jobhist.stream;

import com.jobhist.record.Diagnostic;
import com.jobhist.record.Diagnostics;
import com.jobhist.record.LogLineDecoder;
import com.jobhist.record.MalformedRecordException;
import com.jobhist.record.Record;
import com.jobhist.stream.window.ReadDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Streams the records of one daily log file in either direction.
 *
 * <p>The file is opened on the first pull. A file that does not exist is
 * reported once as a {@code MISSING_FILE} diagnostic and yields no records.
 * Blank lines are skipped. A line that cannot be decoded is reported as a
 * {@code MALFORMED_RECORD} diagnostic with source {@code path@offset} and
 * skipped. When a tag filter is given, lines whose record type tag it
 * rejects are dropped before decoding.</p>
 *
 * <p>The file is closed when the stream is exhausted, on {@link #close()},
 * and before an I/O failure is rethrown as {@link UncheckedIOException}.</p>
 */
public class LogStreamReader implements RecordStream {

    private static final Logger log = LoggerFactory.getLogger(LogStreamReader.class);

    private final LogFileRef file;
    private final ReadDirection direction;
    private final LogLineDecoder decoder;
    private final Diagnostics diagnostics;
    private final Predicate<String> tagFilter;
    private final int blockSize;

    private LineSource source;
    private boolean opened;
    private boolean finished;
    private Record next;
    private long linesRead;
    private long recordsRead;

    /**
     * @param file        the day's file
     * @param direction   read order
     * @param decoder     line decoder
     * @param diagnostics receives missing-file, malformed-line and coercion diagnostics
     * @param tagFilter   accepts the record type tags to decode, or {@code null} for all
     * @param blockSize   read block size in bytes
     */
    public LogStreamReader(LogFileRef file, ReadDirection direction, LogLineDecoder decoder,
                           Diagnostics diagnostics, Predicate<String> tagFilter, int blockSize) {
        this.file = Objects.requireNonNull(file, "file");
        this.direction = Objects.requireNonNull(direction, "direction");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.tagFilter = tagFilter;
        if (blockSize <= 0) {
            throw new IllegalArgumentException("blockSize must be positive: " + blockSize);
        }
        this.blockSize = blockSize;
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        next = advance();
        return next != null;
    }

    @Override
    public Record next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more records in " + file.path());
        }
        Record record = next;
        next = null;
        return record;
    }

    @Override
    public void close() {
        finished = true;
        next = null;
        if (source != null) {
            LineSource open = source;
            source = null;
            try {
                open.close();
                log.debug("Closed {} after {} lines, {} records", file.path(), linesRead, recordsRead);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to close " + file.path(), e);
            }
        }
    }

    public LogFileRef getFile() {
        return file;
    }

    /**
     * Lines read so far, including skipped ones.
     */
    public long getLinesRead() {
        return linesRead;
    }

    /**
     * Records produced so far.
     */
    public long getRecordsRead() {
        return recordsRead;
    }

    private Record advance() {
        try {
            if (!opened && !open()) {
                return null;
            }
            String line;
            while ((line = source.readLine()) != null) {
                linesRead++;
                if (line.isBlank()) {
                    continue;
                }
                if (tagFilter != null) {
                    String tag = LogLineDecoder.peekTag(line);
                    // lines without a tag column go on to the decoder, which reports them
                    if (tag != null && !tagFilter.test(tag)) {
                        continue;
                    }
                }
                Record record = decode(line, source.lineOffset());
                if (record != null) {
                    recordsRead++;
                    return record;
                }
            }
            close();
            return null;
        } catch (IOException e) {
            IOException failure = e;
            try {
                finished = true;
                if (source != null) {
                    source.close();
                }
            } catch (IOException closeFailure) {
                failure.addSuppressed(closeFailure);
            } finally {
                source = null;
            }
            throw new UncheckedIOException("Failed reading " + file.path(), failure);
        }
    }

    private boolean open() throws IOException {
        opened = true;
        try {
            source = direction == ReadDirection.REVERSE
                    ? new ReverseLineSource(file.path(), blockSize)
                    : new ForwardLineSource(file.path(), blockSize);
            log.debug("Opened {} ({})", file.path(), direction);
            return true;
        } catch (NoSuchFileException e) {
            finished = true;
            diagnostics.warn(new Diagnostic(Diagnostic.Kind.MISSING_FILE, file.path().toString(),
                    "No accounting log for " + file.date()));
            return false;
        }
    }

    private Record decode(String line, long offset) {
        String where = file.path() + "@" + offset;
        try {
            return decoder.decode(line, d -> diagnostics.warn(d.withSource(where)));
        } catch (MalformedRecordException e) {
            diagnostics.warn(new Diagnostic(Diagnostic.Kind.MALFORMED_RECORD, where, e.getMessage()));
            return null;
        }
    }
}

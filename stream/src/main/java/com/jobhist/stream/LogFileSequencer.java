package com.jobhist.stream;

import com.jobhist.record.Diagnostics;
import com.jobhist.record.LogLineDecoder;
import com.jobhist.record.Record;
import com.jobhist.stream.window.DateWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Chains the daily files of a {@link DateWindow} into one record stream.
 *
 * <p>Files are visited in window order, oldest first when reading forward and
 * newest first in reverse, and each is read in the window's direction. All
 * records of one file precede those of the next. Each file is closed before
 * the next one is opened.</p>
 *
 * <pre>{@code
 * LogFileSequencer sequencer = new LogFileSequencer(layout, decoder, diagnostics, 64 * 1024);
 * try (RecordStream records = sequencer.open(window, Set.of("E"))) {
 *     records.forEachRemaining(formatter::writeRecord);
 * }
 * }</pre>
 */
public class LogFileSequencer {

    private static final Logger log = LoggerFactory.getLogger(LogFileSequencer.class);

    private final LogFileLayout layout;
    private final LogLineDecoder decoder;
    private final Diagnostics diagnostics;
    private final int blockSize;

    public LogFileSequencer(LogFileLayout layout, LogLineDecoder decoder, Diagnostics diagnostics, int blockSize) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        if (blockSize <= 0) {
            throw new IllegalArgumentException("blockSize must be positive: " + blockSize);
        }
        this.blockSize = blockSize;
    }

    /**
     * The files of a window in read order, as a list. Existence is not checked.
     * {@link #open(DateWindow, Collection)} does not build this list; it visits
     * one day at a time.
     */
    public List<LogFileRef> files(DateWindow window) {
        List<LogFileRef> files = new ArrayList<>();
        for (LocalDate day : window.days()) {
            files.add(layout.fileFor(day));
        }
        return files;
    }

    /**
     * Stream every record of the window.
     */
    public RecordStream open(DateWindow window) {
        return open(window, null);
    }

    /**
     * Stream the records of the window whose type tag is in {@code tags}.
     *
     * @param tags record type tags to keep; {@code null} or empty keeps all
     */
    public RecordStream open(DateWindow window, Collection<String> tags) {
        Predicate<String> tagFilter = null;
        if (tags != null && !tags.isEmpty()) {
            Set<String> accepted = Set.copyOf(tags);
            tagFilter = accepted::contains;
        }
        log.debug("Streaming {} file(s) for {}{}", window.length(), window,
                tagFilter != null ? " with types " + tags : "");
        return new ChainedStream(window, tagFilter);
    }

    private final class ChainedStream implements RecordStream {
        private final DateWindow window;
        private final Predicate<String> tagFilter;
        private LocalDate nextDay;
        private LogStreamReader current;
        private boolean closed;

        ChainedStream(DateWindow window, Predicate<String> tagFilter) {
            this.window = window;
            this.tagFilter = tagFilter;
            this.nextDay = window.firstDay();
        }

        @Override
        public boolean hasNext() {
            if (closed) {
                return false;
            }
            while (current == null || !current.hasNext()) {
                if (current != null) {
                    current.close();
                    current = null;
                }
                if (nextDay == null) {
                    closed = true;
                    return false;
                }
                LogFileRef file = layout.fileFor(nextDay);
                nextDay = window.nextDay(nextDay);
                current = new LogStreamReader(file, window.direction(), decoder,
                        diagnostics, tagFilter, blockSize);
            }
            return true;
        }

        @Override
        public Record next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Window " + window + " is exhausted");
            }
            return current.next();
        }

        @Override
        public void close() {
            closed = true;
            if (current != null) {
                LogStreamReader open = current;
                current = null;
                open.close();
            }
        }
    }
}

package com.jobhist.stream;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Reads lines bottom to top without loading the file.
 *
 * <p>Fixed-size blocks are read from the tail with positional reads into a
 * buffer whose unconsumed bytes are kept right-aligned. Lines are cut from
 * the right end of that region at each {@code \n}; the fragment left over at
 * its left end is the tail of a line that started in an earlier block and
 * stays in the buffer until the next block supplies its beginning. The
 * buffer holds at most one block plus the longest line.</p>
 *
 * <p>Produces exactly the lines of {@link ForwardLineSource}, last first.</p>
 */
public class ReverseLineSource implements LineSource {

    private final FileChannel channel;
    private final int blockSize;

    private byte[] buffer;
    private int head;
    private int tail;
    private int scanned;
    private long filePosition;
    private boolean done;

    private long lineOffset = -1;
    private int peakBufferedBytes;

    /**
     * Open a file. The channel is closed again if the file cannot be prepared for reading.
     *
     * @throws java.nio.file.NoSuchFileException if the file does not exist
     */
    public ReverseLineSource(Path path, int blockSize) throws IOException {
        this(requirePositive(blockSize), FileChannel.open(path, StandardOpenOption.READ), true);
    }

    /**
     * Read from an open channel. The caller keeps ownership of the channel until
     * this constructor returns.
     */
    public ReverseLineSource(FileChannel channel, int blockSize) throws IOException {
        this(requirePositive(blockSize), channel, false);
    }

    private ReverseLineSource(int blockSize, FileChannel channel, boolean ownsChannel) throws IOException {
        this.channel = channel;
        this.blockSize = blockSize;
        this.buffer = new byte[blockSize];
        this.head = buffer.length;
        this.tail = buffer.length;
        this.scanned = tail;
        this.peakBufferedBytes = buffer.length;

        try {
            long size = channel.size();
            if (size == 0) {
                done = true;
            } else {
                // a final newline terminates the last line rather than starting an empty one
                ByteBuffer last = ByteBuffer.allocate(1);
                readFully(last, size - 1);
                filePosition = last.get(0) == '\n' ? size - 1 : size;
            }
        } catch (IOException | RuntimeException e) {
            if (ownsChannel) {
                try {
                    channel.close();
                } catch (IOException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            throw e;
        }
    }

    private static int requirePositive(int blockSize) {
        if (blockSize <= 0) {
            throw new IllegalArgumentException("blockSize must be positive: " + blockSize);
        }
        return blockSize;
    }

    @Override
    public String readLine() throws IOException {
        if (done) {
            return null;
        }
        while (true) {
            for (int i = scanned - 1; i >= head; i--) {
                if (buffer[i] == '\n') {
                    String line = decode(i + 1, tail);
                    lineOffset = filePosition + (i + 1 - head);
                    tail = i;
                    scanned = i;
                    return line;
                }
            }
            scanned = head;
            if (filePosition == 0) {
                done = true;
                lineOffset = 0;
                return decode(head, tail);
            }
            loadPreviousBlock();
        }
    }

    @Override
    public long lineOffset() {
        return lineOffset;
    }

    /**
     * Largest buffer capacity used so far, in bytes.
     */
    public int getPeakBufferedBytes() {
        return peakBufferedBytes;
    }

    @Override
    public void close() throws IOException {
        done = true;
        channel.close();
    }

    private void loadPreviousBlock() throws IOException {
        int n = (int) Math.min(blockSize, filePosition);
        int pending = tail - head;
        if (head < n) {
            int capacity = buffer.length;
            if (pending + n > capacity) {
                capacity = Math.max(capacity * 2, pending + n);
            }
            byte[] target = capacity == buffer.length ? buffer : new byte[capacity];
            System.arraycopy(buffer, head, target, capacity - pending, pending);
            int shift = (capacity - pending) - head;
            buffer = target;
            head += shift;
            tail += shift;
            scanned += shift;
            peakBufferedBytes = Math.max(peakBufferedBytes, capacity);
        }
        readFully(ByteBuffer.wrap(buffer, head - n, n), filePosition - n);
        head -= n;
        filePosition -= n;
    }

    private void readFully(ByteBuffer target, long position) throws IOException {
        long at = position;
        while (target.hasRemaining()) {
            int n = channel.read(target, at);
            if (n < 0) {
                throw new EOFException("File truncated while reading at offset " + at);
            }
            at += n;
        }
    }

    private String decode(int from, int to) {
        int end = to;
        if (end > from && buffer[end - 1] == '\r') {
            end--;
        }
        return new String(buffer, from, end - from, StandardCharsets.UTF_8);
    }
}

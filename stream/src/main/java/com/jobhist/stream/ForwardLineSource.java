package com.jobhist.stream;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Reads lines top to bottom with buffered sequential reads.
 */
public class ForwardLineSource implements LineSource {

    private final InputStream in;
    private final byte[] block;
    private int pos;
    private int limit;
    private long position;
    private boolean eof;

    private byte[] line = new byte[256];
    private int lineLength;
    private long lineOffset = -1;

    /**
     * Open a file.
     *
     * @throws java.nio.file.NoSuchFileException if the file does not exist
     */
    public ForwardLineSource(Path path, int blockSize) throws IOException {
        this(Files.newInputStream(path), blockSize);
    }

    public ForwardLineSource(InputStream in, int blockSize) {
        if (blockSize <= 0) {
            throw new IllegalArgumentException("blockSize must be positive: " + blockSize);
        }
        this.in = in;
        this.block = new byte[blockSize];
    }

    @Override
    public String readLine() throws IOException {
        lineLength = 0;
        long start = position;
        boolean consumed = false;
        while (true) {
            if (pos == limit) {
                if (eof || !fill()) {
                    break;
                }
            }
            consumed = true;
            int i = pos;
            while (i < limit && block[i] != '\n') {
                i++;
            }
            append(pos, i - pos);
            position += i - pos;
            if (i < limit) {
                pos = i + 1;
                position++;
                lineOffset = start;
                return decode();
            }
            pos = limit;
        }
        if (!consumed) {
            return null;
        }
        lineOffset = start;
        return decode();
    }

    @Override
    public long lineOffset() {
        return lineOffset;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }

    private boolean fill() throws IOException {
        int n = in.read(block, 0, block.length);
        if (n < 0) {
            eof = true;
            return false;
        }
        pos = 0;
        limit = n;
        return true;
    }

    private void append(int from, int length) {
        if (lineLength + length > line.length) {
            line = Arrays.copyOf(line, Math.max(line.length * 2, lineLength + length));
        }
        System.arraycopy(block, from, line, lineLength, length);
        lineLength += length;
    }

    private String decode() {
        int length = lineLength;
        if (length > 0 && line[length - 1] == '\r') {
            length--;
        }
        return new String(line, 0, length, StandardCharsets.UTF_8);
    }
}

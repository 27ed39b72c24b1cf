package com.jobhist.record;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Decodes one accounting log line into a {@link Record}.
 *
 * <p>Line layout:</p>
 * <pre>
 * 03/01/2025 10:15:02;E;4123456.desched1;user=vanderwb queue=main Resource_List.ncpus=36 ...
 * </pre>
 *
 * <p>The header is split on the first three {@code ;}: timestamp
 * ({@code MM/dd/yyyy HH:mm:ss}), record type tag, job id; the remainder is the
 * body, which may be absent. Body tokens are separated by whitespace outside
 * double quotes. A {@code key=value} token splits on its first {@code =}, so
 * values such as {@code select=2:ncpus=36:mpiprocs=36+1:ncpus=1} stay whole.
 * Quotes are removed and {@code \"} inside quotes is a literal quote. Tokens
 * without a key are joined, space separated, into the {@code message} field.</p>
 *
 * <p>Catalogued keys are stored under their catalog name with a coerced value.
 * A value that cannot be coerced is kept as raw text and reported once
 * through {@link Diagnostics}. Other keys are stored as text under the key as
 * logged.</p>
 *
 * <p>The decoder holds no mutable state and does no I/O.</p>
 */
public class LogLineDecoder {

    private final FieldCatalog catalog;
    private final FieldCoercer coercer;

    public LogLineDecoder(FieldCatalog catalog, FieldCoercer coercer) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.coercer = Objects.requireNonNull(coercer, "coercer");
    }

    public FieldCatalog getCatalog() {
        return catalog;
    }

    public FieldCoercer getCoercer() {
        return coercer;
    }

    /**
     * Decode a line.
     *
     * @param line        one log line without its line terminator
     * @param diagnostics receives one {@code FIELD_COERCION} diagnostic per unreadable value
     * @return the decoded record
     * @throws MalformedRecordException if the header is incomplete or its
     *         timestamp, type tag or job id is missing or unparseable
     */
    public Record decode(String line, Diagnostics diagnostics) {
        if (line == null) {
            throw new MalformedRecordException("Null line", null);
        }
        int first = line.indexOf(';');
        int second = first < 0 ? -1 : line.indexOf(';', first + 1);
        if (second < 0) {
            throw new MalformedRecordException("Missing ';' separated header", line);
        }
        int third = line.indexOf(';', second + 1);

        String timestampText = line.substring(0, first).trim();
        String tag = line.substring(first + 1, second).trim();
        String id = (third < 0 ? line.substring(second + 1) : line.substring(second + 1, third)).trim();
        String body = third < 0 ? "" : line.substring(third + 1);

        if (timestampText.isEmpty()) {
            throw new MalformedRecordException("Missing timestamp", line);
        }
        LocalDateTime timestamp;
        try {
            timestamp = FieldCoercer.parseLogTimestamp(timestampText);
        } catch (DateTimeParseException e) {
            throw new MalformedRecordException("Unparseable timestamp '" + timestampText + "'", line);
        }
        if (tag.isEmpty()) {
            throw new MalformedRecordException("Missing record type", line);
        }
        if (id.isEmpty()) {
            throw new MalformedRecordException("Missing job id", line);
        }

        Record.Builder builder = Record.builder()
                .timestamp(timestamp)
                .timestampText(timestampText)
                .tag(tag)
                .jobId(JobId.parse(id));

        StringBuilder message = new StringBuilder();
        for (String token : tokenize(body)) {
            int eq = token.indexOf('=');
            if (eq <= 0) {
                if (message.length() > 0) {
                    message.append(' ');
                }
                message.append(token);
                continue;
            }
            String key = token.substring(0, eq);
            String raw = token.substring(eq + 1);
            addField(builder, key, raw, diagnostics);
        }
        if (message.length() > 0) {
            addField(builder, FieldCatalog.MESSAGE, message.toString(), diagnostics);
        }
        return builder.build();
    }

    /**
     * Extract the record type tag without decoding the line.
     *
     * @return the trimmed tag, or {@code null} if the line has no complete tag column
     */
    public static String peekTag(String line) {
        if (line == null) {
            return null;
        }
        int first = line.indexOf(';');
        if (first < 0) {
            return null;
        }
        int second = line.indexOf(';', first + 1);
        if (second < 0) {
            return null;
        }
        return line.substring(first + 1, second).trim();
    }

    private void addField(Record.Builder builder, String key, String raw, Diagnostics diagnostics) {
        FieldDefinition def = catalog.byLogKey(key);
        if (def == null) {
            builder.field(key, FieldValue.ofText(raw));
            return;
        }
        try {
            builder.field(def.name(), coercer.coerce(def, raw));
        } catch (FieldCoercionException e) {
            diagnostics.warn(new Diagnostic(Diagnostic.Kind.FIELD_COERCION, null, e.getMessage()));
            builder.field(def.name(), FieldValue.uncoerced(raw));
        }
    }

    /**
     * Split a body into tokens on whitespace outside double quotes. Quotes are
     * dropped; an unterminated quote runs to the end of the body.
     */
    static List<String> tokenize(String body) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        boolean inToken = false;
        int len = body.length();
        for (int i = 0; i < len; i++) {
            char c = body.charAt(i);
            if (inQuotes) {
                if (c == '\\' && i + 1 < len && body.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else if (c == '"') {
                    inQuotes = false;
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                inQuotes = true;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }
}

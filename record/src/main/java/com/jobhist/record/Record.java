package com.jobhist.record;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One decoded accounting event.
 *
 * <p>A record is immutable. Its header values (type, timestamp, job id) come
 * from the first three columns of the log line and are also readable through
 * {@link #get(String)} as the pseudo-fields {@code record_type},
 * {@code timestamp}, {@code id} and {@code short_id}. Body fields are kept in
 * logged order, under their catalog name when the key is catalogued and
 * under the logged key otherwise.</p>
 *
 * <pre>{@code
 * Record record = decoder.decode(line, diagnostics);
 * FieldValue cpus = record.get("numcpus");
 * if (cpus != null && cpus.isCoerced()) {
 *     long n = cpus.asLong();
 * }
 * }</pre>
 */
public final class Record {

    private final RecordType type;
    private final String tag;
    private final LocalDateTime timestamp;
    private final JobId jobId;
    private final Map<String, FieldValue> fields;

    private final FieldValue typeValue;
    private final FieldValue timestampValue;
    private final FieldValue idValue;
    private final FieldValue shortIdValue;

    private Record(Builder builder) {
        this.tag = Objects.requireNonNull(builder.tag, "tag");
        this.type = RecordType.fromTag(tag);
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp");
        this.jobId = Objects.requireNonNull(builder.jobId, "jobId");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));

        String timestampText = builder.timestampText != null
                ? builder.timestampText : FieldCoercer.LOG_TIMESTAMP.format(timestamp);
        this.typeValue = FieldValue.ofText(tag);
        this.timestampValue = FieldValue.ofTimestamp(timestampText, timestamp);
        this.idValue = FieldValue.ofText(jobId.full());
        this.shortIdValue = FieldValue.ofText(jobId.shortId());
    }

    public RecordType getType() {
        return type;
    }

    /**
     * The record type tag exactly as logged.
     */
    public String getTag() {
        return tag;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public JobId getJobId() {
        return jobId;
    }

    /**
     * Body fields in logged order. The map is unmodifiable.
     */
    public Map<String, FieldValue> getFields() {
        return fields;
    }

    /**
     * Look up a header pseudo-field or a body field by name.
     *
     * @return the value, or {@code null} if this record has no such field
     */
    public FieldValue get(String name) {
        return switch (name) {
            case FieldCatalog.RECORD_TYPE -> typeValue;
            case FieldCatalog.TIMESTAMP -> timestampValue;
            case FieldCatalog.ID -> idValue;
            case FieldCatalog.SHORT_ID -> shortIdValue;
            default -> fields.get(name);
        };
    }

    public boolean has(String name) {
        return get(name) != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record other)) return false;
        return tag.equals(other.tag)
                && timestamp.equals(other.timestamp)
                && jobId.equals(other.jobId)
                && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, timestamp, jobId, fields);
    }

    @Override
    public String toString() {
        return "Record{" + timestampValue.raw() + ";" + tag + ";" + jobId.full() + ", fields=" + fields.size() + "}";
    }

    public static final class Builder {
        private String tag;
        private LocalDateTime timestamp;
        private String timestampText;
        private JobId jobId;
        private final Map<String, FieldValue> fields = new LinkedHashMap<>();

        private Builder() {}

        public Builder tag(String tag) {
            this.tag = tag;
            return this;
        }

        public Builder type(RecordType type) {
            this.tag = type.getTag();
            return this;
        }

        public Builder timestamp(LocalDateTime timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /**
         * The header timestamp text as logged, kept as the raw form of the
         * {@code timestamp} pseudo-field.
         */
        public Builder timestampText(String timestampText) {
            this.timestampText = timestampText;
            return this;
        }

        public Builder jobId(JobId jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder jobId(String jobId) {
            this.jobId = JobId.parse(jobId);
            return this;
        }

        /**
         * Add a body field. A repeated name keeps its first position and takes the later value.
         */
        public Builder field(String name, FieldValue value) {
            fields.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Record build() {
            return new Record(this);
        }
    }
}

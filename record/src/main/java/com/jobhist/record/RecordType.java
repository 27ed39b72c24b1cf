package com.jobhist.record;

import java.util.HashMap;
import java.util.Map;

/**
 * Accounting record types, keyed by the one-letter tag in the second header column.
 *
 * <p>Tags that are not listed here decode to {@link #UNKNOWN}; the tag text
 * itself is kept on the {@link Record}.</p>
 */
public enum RecordType {

    QUEUED("Q", "Queued"),
    STARTED("S", "Started"),
    ENDED("E", "Ended"),
    REQUEUED("R", "Requeued"),
    DELETED("D", "Deleted"),
    ABORTED("A", "Aborted"),
    CHECKPOINTED("C", "Checkpointed"),
    RESTARTED("T", "Restarted"),
    MOVED("M", "Moved"),
    UNKNOWN("", "Unknown");

    private static final Map<String, RecordType> BY_TAG = new HashMap<>();

    static {
        for (RecordType type : values()) {
            if (!type.tag.isEmpty()) {
                BY_TAG.put(type.tag, type);
            }
        }
    }

    private final String tag;
    private final String label;

    RecordType(String tag, String label) {
        this.tag = tag;
        this.label = label;
    }

    public String getTag() {
        return tag;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Look up a type by its logged tag.
     *
     * @return the matching type, or {@link #UNKNOWN}
     */
    public static RecordType fromTag(String tag) {
        return BY_TAG.getOrDefault(tag, UNKNOWN);
    }
}

package com.jobhist.record;

import java.util.Objects;

/**
 * A job identifier as logged (e.g. {@code 4123456.desched1}) and its short,
 * numeric-prefix form ({@code 4123456}).
 *
 * <p>Array sub-jobs keep their index in the short form: {@code 4123456[2].desched1}
 * gives {@code 4123456[2]}.</p>
 */
public record JobId(String full, String shortId) {

    public JobId {
        Objects.requireNonNull(full, "full");
        Objects.requireNonNull(shortId, "shortId");
    }

    /**
     * @throws IllegalArgumentException if the id is blank
     */
    public static JobId parse(String text) {
        String full = text == null ? "" : text.trim();
        if (full.isEmpty()) {
            throw new IllegalArgumentException("Empty job id");
        }
        int dot = full.indexOf('.');
        return new JobId(full, dot > 0 ? full.substring(0, dot) : full);
    }

    @Override
    public String toString() {
        return full;
    }
}

package com.jobhist.record;

/**
 * Receives non-fatal problems found while streaming.
 *
 * <p>Implementations must not write to the data output. The default
 * implementation is {@link LoggingDiagnostics}.</p>
 */
@FunctionalInterface
public interface Diagnostics {

    /**
     * Report a problem. Called on the streaming thread, once per occurrence.
     */
    void warn(Diagnostic diagnostic);

    /**
     * A sink that discards everything.
     */
    static Diagnostics ignore() {
        return diagnostic -> { };
    }
}

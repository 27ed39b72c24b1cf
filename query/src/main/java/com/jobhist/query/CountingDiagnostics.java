package com.jobhist.query;

import com.jobhist.record.Diagnostic;
import com.jobhist.record.Diagnostics;

/**
 * Forwards diagnostics to a delegate, counting them on the way.
 */
class CountingDiagnostics implements Diagnostics {

    private final Diagnostics delegate;
    private long count;

    CountingDiagnostics(Diagnostics delegate) {
        this.delegate = delegate;
    }

    @Override
    public void warn(Diagnostic diagnostic) {
        count++;
        delegate.warn(diagnostic);
    }

    long getCount() {
        return count;
    }
}

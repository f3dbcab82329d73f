package org.javai.status.ops;

import org.javai.status.Status;

/**
 * Reports statuses for observability.
 * Implementations might write structured logs or forward to an alerting system.
 */
@FunctionalInterface
public interface StatusReporter {

    /**
     * Reports a failure. The status must not be modified by the reporter.
     */
    void report(Status status);

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static StatusReporter noOp() {
        return status -> {};
    }
}

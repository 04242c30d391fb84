package net.relaytrace.ErrorCorrelation;

/**
 * Forwards errors to an external error-monitoring backend.
 *
 * Called inline on the failing message's thread, so implementations should hand the
 * report off rather than do network I/O. Exceptions thrown here are caught by the caller.
 */
@FunctionalInterface
public interface ErrorReporter {

    void reportError(ErrorReport report);

    static ErrorReporter noop() {
        return report -> {
        };
    }
}

package in.co.jathakam.services;

import in.co.jathakam.pojos.ErrorKind;

/**
 * Raised inside the engine when a chart cannot be computed for the given input.
 * {@link ChartOrchestrator} turns it into a failed {@code ChartOutcome}.
 */
public class ChartComputationException extends Exception {

    private final ErrorKind errorKind;

    public ChartComputationException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    public ChartComputationException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}

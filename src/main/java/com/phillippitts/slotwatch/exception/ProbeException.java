package com.phillippitts.slotwatch.exception;

/**
 * Thrown when an operation against the probed page fails (navigation, refresh, login).
 * Always recoverable: the monitor absorbs it into the circuit breaker and backs off.
 */
public class ProbeException extends SlotWatchException {

    private final String operation;

    public ProbeException(String message) {
        super(message);
        this.operation = "unknown";
    }

    public ProbeException(String message, String operation) {
        super(message + " (operation: " + operation + ")");
        this.operation = operation;
    }

    public ProbeException(String message, Throwable cause) {
        super(message, cause);
        this.operation = "unknown";
    }

    public ProbeException(String message, String operation, Throwable cause) {
        super(message + " (operation: " + operation + ")", cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}

package com.phillippitts.slotwatch.exception;

/**
 * Base exception for all slotwatch application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SlotWatchException extends RuntimeException {

    public SlotWatchException(String message) {
        super(message);
    }

    public SlotWatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public SlotWatchException(Throwable cause) {
        super(cause);
    }
}

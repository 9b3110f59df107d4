package com.phillippitts.slotwatch.exception;

/**
 * Thrown when a notification cannot be delivered to a single recipient.
 * Broadcasts log and isolate it; delivery to other recipients continues.
 */
public class DeliveryException extends SlotWatchException {

    private final long recipientId;

    public DeliveryException(long recipientId, String message) {
        super("Delivery to " + recipientId + " failed: " + message);
        this.recipientId = recipientId;
    }

    public DeliveryException(long recipientId, String message, Throwable cause) {
        super("Delivery to " + recipientId + " failed: " + message, cause);
        this.recipientId = recipientId;
    }

    public long getRecipientId() {
        return recipientId;
    }
}

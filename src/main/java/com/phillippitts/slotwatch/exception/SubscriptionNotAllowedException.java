package com.phillippitts.slotwatch.exception;

/**
 * Thrown when a recipient outside the configured allowlist tries to subscribe.
 */
public class SubscriptionNotAllowedException extends SlotWatchException {

    private final long recipientId;

    public SubscriptionNotAllowedException(long recipientId) {
        super("Recipient " + recipientId + " is not allowed to subscribe");
        this.recipientId = recipientId;
    }

    public long getRecipientId() {
        return recipientId;
    }
}

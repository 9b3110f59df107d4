package com.phillippitts.slotwatch.service.notify;

import com.phillippitts.slotwatch.exception.DeliveryException;

/**
 * Delivers a text message to a single recipient.
 *
 * <p>Implementations may block on network I/O; the broadcast dispatcher runs them on the
 * notification pool so the monitor worker never waits on a slow recipient.
 */
@FunctionalInterface
public interface Notifier {

    /**
     * @param recipientId transport-specific recipient id (a Telegram chat id, for example)
     * @param text        message body
     * @throws DeliveryException if the message could not be delivered
     */
    void send(long recipientId, String text);
}

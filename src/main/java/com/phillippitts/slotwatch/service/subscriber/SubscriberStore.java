package com.phillippitts.slotwatch.service.subscriber;

/**
 * Mutable subscriber set behind the subscribe and unsubscribe endpoints.
 *
 * <p>Ids are unique. Implementations must be safe for concurrent use from request threads
 * and the monitor worker.
 */
public interface SubscriberStore extends SubscriberRegistry {

    /** @return true if the id was not subscribed before */
    boolean add(long id);

    /** @return true if the id was subscribed */
    boolean remove(long id);

    boolean exists(long id);

    int count();
}

package com.phillippitts.slotwatch.service.subscriber;

import java.util.Collection;

/**
 * Read side of the subscriber set, as seen by the monitor.
 */
@FunctionalInterface
public interface SubscriberRegistry {

    /**
     * @return snapshot of all recipient ids; later changes to the set are not reflected in it
     */
    Collection<Long> all();
}

package com.phillippitts.slotwatch.service.subscriber;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentSkipListSet;

/**
 * Non-persistent subscriber store; subscriptions are lost on restart.
 */
public class InMemorySubscriberStore implements SubscriberStore {

    private final Set<Long> ids = new ConcurrentSkipListSet<>();

    @Override
    public Collection<Long> all() {
        return List.copyOf(ids);
    }

    @Override
    public boolean add(long id) {
        return ids.add(id);
    }

    @Override
    public boolean remove(long id) {
        return ids.remove(id);
    }

    @Override
    public boolean exists(long id) {
        return ids.contains(id);
    }

    @Override
    public int count() {
        return ids.size();
    }
}

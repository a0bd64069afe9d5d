package com.limitbook.engine.core.event;

import org.springframework.context.ApplicationEventPublisher;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects events raised inside a shard's critical section so that listeners run only
 * after the lock is released. One instance per operation; not thread-safe.
 */
public class DeferredEventPublisher implements ApplicationEventPublisher {
    private final List<Object> pending = new ArrayList<>();

    @Override
    public void publishEvent(Object event) {
        pending.add(event);
    }

    /**
     * Hands over the collected events in the order they were raised and forgets them.
     */
    public List<Object> drain() {
        List<Object> events = List.copyOf(pending);
        pending.clear();
        return events;
    }
}

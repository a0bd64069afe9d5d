package com.limitbook.engine.core.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Delivers event batches to listeners in the order they were enqueued.
 * <p>
 * Batches must be enqueued while the producing shard lock is still held, so two batches for the
 * same symbol queue up in version order. Delivery runs outside every shard lock and on one thread
 * at a time: a caller that finds delivery in progress leaves its batch to the thread already
 * delivering.
 */
@Slf4j
public class OrderedEventDispatcher {
    private final Queue<List<Object>> batches = new ConcurrentLinkedQueue<>();
    private final ReentrantLock deliveryLock = new ReentrantLock();

    public void enqueue(DeferredEventPublisher events) {
        List<Object> batch = events.drain();
        if (!batch.isEmpty()) {
            batches.add(batch);
        }
    }

    public void dispatchTo(ApplicationEventPublisher target) {
        // a listener that trades again lands here while its own batch is being delivered
        if (deliveryLock.isHeldByCurrentThread()) {
            return;
        }
        while (!batches.isEmpty() && deliveryLock.tryLock()) {
            try {
                List<Object> batch;
                while ((batch = batches.poll()) != null) {
                    batch.forEach(event -> deliver(target, event));
                }
            } finally {
                deliveryLock.unlock();
            }
        }
    }

    public int getQueuedBatchCount() {
        return batches.size();
    }

    private void deliver(ApplicationEventPublisher target, Object event) {
        try {
            target.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("EVENT: Listener failed on {}, continuing with the next event", event, e);
        }
    }
}

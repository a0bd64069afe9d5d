package com.limitbook.engine.core.concurrency;

import com.limitbook.engine.core.model.OrderBook;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Unit of exclusive write ownership. The write lock serialises every mutation of the shard's
 * books; the read lock is only for diagnostic reads of live order state.
 */
public class Shard {
    private final int index;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, OrderBook> books = new ConcurrentHashMap<>();

    Shard(int index) {
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    ReentrantReadWriteLock getLock() {
        return lock;
    }

    OrderBook register(String symbol, BigDecimal tickSize) {
        return books.computeIfAbsent(symbol, s -> new OrderBook(s, tickSize));
    }

    OrderBook book(String symbol) {
        return books.get(symbol);
    }

    boolean owns(String symbol) {
        return books.containsKey(symbol);
    }

    Set<String> symbols() {
        return Set.copyOf(books.keySet());
    }

    @Override
    public String toString() {
        return "Shard-" + index;
    }
}
